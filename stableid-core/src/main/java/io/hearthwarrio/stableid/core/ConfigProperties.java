package io.hearthwarrio.stableid.core;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * Persists {@link IdentifierConfig} as {@code stableid.*} properties.
 * <p>
 * Loading is lenient: only keys that are present overwrite the target, unknown modes are ignored.
 */
public final class ConfigProperties {

    public static final String PREFIX = "stableid.";

    static final String ENABLE_AUTO_IDS = PREFIX + "enableAutoIds";
    static final String NAMESPACE = PREFIX + "namespace";
    static final String MODE = PREFIX + "mode";
    static final String ENABLE_VIEW_HIERARCHY_TRACKING = PREFIX + "enableViewHierarchyTracking";
    static final String ENABLE_UI_TEST_INTEGRATION = PREFIX + "enableUiTestIntegration";
    static final String ENABLE_DEBUG_LOGGING = PREFIX + "enableDebugLogging";
    static final String GLOBAL_PREFIX = PREFIX + "globalPrefix";
    static final String INCLUDE_COMPONENT_NAMES = PREFIX + "includeComponentNames";
    static final String INCLUDE_ELEMENT_TYPES = PREFIX + "includeElementTypes";

    private ConfigProperties() {
        // utility class
    }

    public static Properties toProperties(IdentifierConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        IdentifierConfig c = config.copy();

        Properties properties = new Properties();
        properties.setProperty(ENABLE_AUTO_IDS, Boolean.toString(c.isEnableAutoIds()));
        properties.setProperty(NAMESPACE, c.getNamespace());
        properties.setProperty(MODE, c.getMode().name());
        properties.setProperty(ENABLE_VIEW_HIERARCHY_TRACKING, Boolean.toString(c.isEnableViewHierarchyTracking()));
        properties.setProperty(ENABLE_UI_TEST_INTEGRATION, Boolean.toString(c.isEnableUiTestIntegration()));
        properties.setProperty(ENABLE_DEBUG_LOGGING, Boolean.toString(c.isEnableDebugLogging()));
        properties.setProperty(GLOBAL_PREFIX, c.getGlobalPrefix());
        properties.setProperty(INCLUDE_COMPONENT_NAMES, Boolean.toString(c.isIncludeComponentNames()));
        properties.setProperty(INCLUDE_ELEMENT_TYPES, Boolean.toString(c.isIncludeElementTypes()));
        return properties;
    }

    /**
     * Copies every recognized key present in {@code properties} onto {@code target}.
     *
     * @return target, for chaining
     */
    public static IdentifierConfig apply(Properties properties, IdentifierConfig target) {
        Objects.requireNonNull(properties, "properties must not be null");
        Objects.requireNonNull(target, "target must not be null");

        String value = properties.getProperty(ENABLE_AUTO_IDS);
        if (value != null) {
            target.setEnableAutoIds(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(NAMESPACE);
        if (value != null) {
            target.setNamespace(value);
        }
        value = properties.getProperty(MODE);
        if (value != null) {
            IdentifierMode.fromName(value).ifPresent(target::setMode);
        }
        value = properties.getProperty(ENABLE_VIEW_HIERARCHY_TRACKING);
        if (value != null) {
            target.setEnableViewHierarchyTracking(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(ENABLE_UI_TEST_INTEGRATION);
        if (value != null) {
            target.setEnableUiTestIntegration(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(ENABLE_DEBUG_LOGGING);
        if (value != null) {
            target.setEnableDebugLogging(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(GLOBAL_PREFIX);
        if (value != null) {
            target.setGlobalPrefix(value);
        }
        value = properties.getProperty(INCLUDE_COMPONENT_NAMES);
        if (value != null) {
            target.setIncludeComponentNames(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(INCLUDE_ELEMENT_TYPES);
        if (value != null) {
            target.setIncludeElementTypes(Boolean.parseBoolean(value.trim()));
        }
        return target;
    }

    public static void save(IdentifierConfig config, Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        Properties properties = toProperties(config);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            properties.store(writer, "StableId identifier configuration");
        }
    }

    /**
     * Loads {@code file} onto {@code target}. A missing file leaves the target untouched.
     *
     * @return target, for chaining
     */
    public static IdentifierConfig load(Path file, IdentifierConfig target) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(target, "target must not be null");
        if (!Files.exists(file)) {
            return target;
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return apply(properties, target);
    }
}
