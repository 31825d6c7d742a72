package io.hearthwarrio.stableid.core;

import java.util.Map;
import java.util.Objects;

/**
 * Identifier generation policy.
 * <p>
 * Instances are mutable and shared: whoever holds a reference observes every later change.
 * Generation never caches values across calls; it takes a {@link #copy()} at the start of each call
 * so that one identifier is always built from one consistent set of values.
 * <p>
 * All accessors are synchronized on the instance.
 */
public final class IdentifierConfig {

    /**
     * Environment variable that turns debug logging on for the process-wide configuration.
     */
    public static final String DEBUG_ENV_VARIABLE = "STABLEID_DEBUG";

    private boolean enableAutoIds;
    private String namespace;
    private IdentifierMode mode;
    private boolean enableViewHierarchyTracking;
    private boolean enableUiTestIntegration;
    private boolean enableDebugLogging;
    private String globalPrefix;
    private boolean includeComponentNames;
    private boolean includeElementTypes;

    public IdentifierConfig() {
        resetToDefaults();
    }

    /**
     * Preset used by test scaffolding: auto ids on, namespace {@code DebugTest}.
     */
    public static IdentifierConfig forTesting() {
        IdentifierConfig config = new IdentifierConfig();
        config.setNamespace("DebugTest");
        return config;
    }

    /**
     * Default configuration, with debug logging switched on when {@value #DEBUG_ENV_VARIABLE}
     * is {@code 1} or {@code true} in the given environment.
     */
    public static IdentifierConfig fromEnvironment(Map<String, String> environment) {
        Objects.requireNonNull(environment, "environment must not be null");
        IdentifierConfig config = new IdentifierConfig();
        String value = environment.get(DEBUG_ENV_VARIABLE);
        if ("1".equals(value) || "true".equalsIgnoreCase(value)) {
            config.setEnableDebugLogging(true);
        }
        return config;
    }

    /**
     * Restores documented defaults.
     */
    public synchronized void resetToDefaults() {
        enableAutoIds = true;
        namespace = "";
        mode = IdentifierMode.AUTOMATIC;
        enableViewHierarchyTracking = false;
        enableUiTestIntegration = false;
        enableDebugLogging = false;
        globalPrefix = "";
        includeComponentNames = true;
        includeElementTypes = true;
    }

    /**
     * Point-in-time copy. The copy is detached: later changes to either side are not shared.
     */
    public synchronized IdentifierConfig copy() {
        IdentifierConfig copy = new IdentifierConfig();
        copy.enableAutoIds = enableAutoIds;
        copy.namespace = namespace;
        copy.mode = mode;
        copy.enableViewHierarchyTracking = enableViewHierarchyTracking;
        copy.enableUiTestIntegration = enableUiTestIntegration;
        copy.enableDebugLogging = enableDebugLogging;
        copy.globalPrefix = globalPrefix;
        copy.includeComponentNames = includeComponentNames;
        copy.includeElementTypes = includeElementTypes;
        return copy;
    }

    /**
     * Whether the global layer alone turns generation on (master switch and mode both allow it).
     */
    public synchronized boolean isGlobalGenerationEnabled() {
        return enableAutoIds && mode.allowsGlobalGeneration();
    }

    public synchronized boolean isEnableAutoIds() {
        return enableAutoIds;
    }

    public synchronized IdentifierConfig setEnableAutoIds(boolean enableAutoIds) {
        this.enableAutoIds = enableAutoIds;
        return this;
    }

    public synchronized String getNamespace() {
        return namespace;
    }

    /**
     * An empty namespace is allowed; generated identifiers simply omit the segment.
     */
    public synchronized IdentifierConfig setNamespace(String namespace) {
        this.namespace = namespace == null ? "" : namespace;
        return this;
    }

    public synchronized IdentifierMode getMode() {
        return mode;
    }

    public synchronized IdentifierConfig setMode(IdentifierMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        return this;
    }

    public synchronized boolean isEnableViewHierarchyTracking() {
        return enableViewHierarchyTracking;
    }

    public synchronized IdentifierConfig setEnableViewHierarchyTracking(boolean enableViewHierarchyTracking) {
        this.enableViewHierarchyTracking = enableViewHierarchyTracking;
        return this;
    }

    public synchronized boolean isEnableUiTestIntegration() {
        return enableUiTestIntegration;
    }

    public synchronized IdentifierConfig setEnableUiTestIntegration(boolean enableUiTestIntegration) {
        this.enableUiTestIntegration = enableUiTestIntegration;
        return this;
    }

    public synchronized boolean isEnableDebugLogging() {
        return enableDebugLogging;
    }

    public synchronized IdentifierConfig setEnableDebugLogging(boolean enableDebugLogging) {
        this.enableDebugLogging = enableDebugLogging;
        return this;
    }

    public synchronized String getGlobalPrefix() {
        return globalPrefix;
    }

    public synchronized IdentifierConfig setGlobalPrefix(String globalPrefix) {
        this.globalPrefix = globalPrefix == null ? "" : globalPrefix;
        return this;
    }

    public synchronized boolean isIncludeComponentNames() {
        return includeComponentNames;
    }

    public synchronized IdentifierConfig setIncludeComponentNames(boolean includeComponentNames) {
        this.includeComponentNames = includeComponentNames;
        return this;
    }

    public synchronized boolean isIncludeElementTypes() {
        return includeElementTypes;
    }

    public synchronized IdentifierConfig setIncludeElementTypes(boolean includeElementTypes) {
        this.includeElementTypes = includeElementTypes;
        return this;
    }

    @Override
    public synchronized String toString() {
        return "IdentifierConfig{" +
                "enableAutoIds=" + enableAutoIds +
                ", namespace='" + namespace + '\'' +
                ", mode=" + mode +
                ", enableViewHierarchyTracking=" + enableViewHierarchyTracking +
                ", enableUiTestIntegration=" + enableUiTestIntegration +
                ", enableDebugLogging=" + enableDebugLogging +
                ", globalPrefix='" + globalPrefix + '\'' +
                ", includeComponentNames=" + includeComponentNames +
                ", includeElementTypes=" + includeElementTypes +
                '}';
    }
}
