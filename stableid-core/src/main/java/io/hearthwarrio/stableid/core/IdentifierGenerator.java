package io.hearthwarrio.stableid.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives identifier strings from the active configuration, the hierarchy context and per-node hints.
 * <p>
 * The result depends only on {@code (configuration, screen context, innermost frame, subject, role, context)}:
 * never on time, call order or object identity. Only the minimal context is used (namespace, prefix, screen,
 * the innermost frame when tracking is on, the node's own context/role/name), so identifiers stay short
 * however deep the tree is.
 * <p>
 * Component order:
 * <ul>
 *   <li>{@link IdentifierMode#AUTOMATIC}: {@code namespace.prefix.screen.frame.context.role.name}</li>
 *   <li>{@link IdentifierMode#SEMANTIC} and {@link IdentifierMode#MANUAL}:
 *       {@code namespace.prefix.screen.frame.context.name.role}</li>
 * </ul>
 * Empty components are skipped. Screen, frame and context qualifiers are dropped when they repeat the previous
 * qualifier or the node's name, so nested naming never repeats a segment. Namespace and prefix are never merged.
 * <p>
 * Every identifier handed out (including exact names) is registered in the {@link CollisionRegistry};
 * with debug logging enabled each call appends exactly one {@link DebugLogEntry}.
 */
public final class IdentifierGenerator {

    public static final char SEPARATOR = '.';

    static final String DEFAULT_ROLE = "ui";
    static final String DEFAULT_NAME = "element";

    private final ConfigStore configStore;
    private final HierarchyTracker hierarchy;
    private final CollisionRegistry registry;
    private final DebugLog debugLog;

    public IdentifierGenerator(
            ConfigStore configStore,
            HierarchyTracker hierarchy,
            CollisionRegistry registry,
            DebugLog debugLog
    ) {
        this.configStore = Objects.requireNonNull(configStore, "configStore must not be null");
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.debugLog = Objects.requireNonNull(debugLog, "debugLog must not be null");
    }

    /**
     * Generates the identifier for one node.
     *
     * @param subjectIdentity stable content-derived token (data id, label text, declared name); may be blank
     * @param role            node role such as {@code button}, {@code item}, {@code text}; blank means {@code ui}
     * @param context         extra caller qualifier; may be blank
     * @return identifier, never empty
     */
    public String generateId(String subjectIdentity, String role, String context) {
        return generateId(new IdentifierRequest(subjectIdentity, role, context));
    }

    public String generateId(IdentifierRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        IdentifierConfig config = configStore.get().copy();
        String identifier = compose(config, request);
        issue(config, DebugLogEntry.Kind.GENERATED, request, identifier);
        return identifier;
    }

    /**
     * Returns {@code explicitName} unchanged: no configuration, hierarchy or sanitization is applied.
     * The name still takes part in collision bookkeeping and debug logging.
     */
    public String generateExactId(String explicitName) {
        Objects.requireNonNull(explicitName, "explicitName must not be null");
        IdentifierConfig config = configStore.get().copy();
        issue(config, DebugLogEntry.Kind.EXACT, new IdentifierRequest(explicitName, "", ""), explicitName);
        return explicitName;
    }

    /**
     * Whether {@code identifier} was already issued in this run. Does not modify the registry.
     */
    public boolean checkForCollision(String identifier) {
        return registry.contains(identifier);
    }

    private void issue(IdentifierConfig config, DebugLogEntry.Kind kind, IdentifierRequest request, String identifier) {
        CollisionRegistry.Collision collision = registry.register(identifier, request);
        if (!config.isEnableDebugLogging()) {
            return;
        }
        if (collision != null) {
            debugLog.reportCollision(collision);
        }
        debugLog.record(kind, request, identifier);
    }

    String compose(IdentifierConfig config, IdentifierRequest request) {
        boolean uiTestIntegration = config.isEnableUiTestIntegration();
        Optional<String> frame = hierarchy.innermostFrame().map(HierarchyTracker::frameName);

        List<String> components = new ArrayList<>(8);
        addConfigured(components, IdentifierSanitizer.configuredSegment(config.getNamespace()));
        addConfigured(components, IdentifierSanitizer.configuredSegment(config.getGlobalPrefix()));
        int qualifiersFrom = components.size();

        String role = IdentifierSanitizer.component(request.getRole());
        if (role.isEmpty()) {
            role = DEFAULT_ROLE;
        }
        String name = name(config, request, frame);

        String screen = uiTestIntegration ? HierarchyTracker.DEFAULT_SCREEN_CONTEXT : hierarchy.screenContext();
        addQualifier(components, qualifiersFrom, IdentifierSanitizer.component(screen), name);

        if (config.isEnableViewHierarchyTracking() && !uiTestIntegration) {
            frame.ifPresent(f -> addQualifier(components, qualifiersFrom, IdentifierSanitizer.component(f), name));
        }
        addQualifier(components, qualifiersFrom, IdentifierSanitizer.component(request.getContext()), name);

        boolean withRole = config.isIncludeElementTypes() && !role.equalsIgnoreCase(name);
        if (config.getMode() == IdentifierMode.AUTOMATIC) {
            if (withRole) {
                addQualifier(components, qualifiersFrom, role, name);
            }
            components.add(name);
        } else {
            components.add(name);
            if (withRole) {
                components.add(role);
            }
        }
        return join(components);
    }

    private static String name(IdentifierConfig config, IdentifierRequest request, Optional<String> frame) {
        String subject = request.getSubjectIdentity();
        if (!subject.isBlank()) {
            return config.isIncludeComponentNames()
                    ? IdentifierSanitizer.component(subject)
                    : IdentifierSanitizer.hashToken(subject);
        }
        return frame.map(IdentifierSanitizer::component)
                .filter(s -> !s.isEmpty())
                .orElse(DEFAULT_NAME);
    }

    /**
     * Namespace and prefix are kept as configured, even when they equal the screen or each other.
     */
    private static void addConfigured(List<String> components, String segment) {
        if (!segment.isEmpty()) {
            components.add(segment);
        }
    }

    /**
     * Appends a non-empty hierarchy or context component unless it repeats the previous qualifier
     * or the node's name, which always comes last in its own position.
     */
    private static void addQualifier(List<String> components, int qualifiersFrom, String component, String name) {
        if (component == null || component.isEmpty() || component.equalsIgnoreCase(name)) {
            return;
        }
        if (components.size() > qualifiersFrom
                && components.get(components.size() - 1).equalsIgnoreCase(component)) {
            return;
        }
        components.add(component);
    }

    private static String join(List<String> components) {
        return String.join(String.valueOf(SEPARATOR), components);
    }
}
