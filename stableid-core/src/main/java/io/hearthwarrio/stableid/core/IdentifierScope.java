package io.hearthwarrio.stableid.core;

import io.hearthwarrio.stableid.core.export.ScriptDialect;
import io.hearthwarrio.stableid.core.export.TestScriptExporter;

import java.util.Objects;

/**
 * Shared state of one unit of work (an application run, a test case): configuration, hierarchy,
 * collision registry and debug log. Generators, resolvers and exporters created from the same scope
 * see the same registry and log.
 */
public final class IdentifierScope {

    private final ConfigStore configStore;
    private final HierarchyTracker hierarchy;
    private final CollisionRegistry registry;
    private final DebugLog debugLog;

    public IdentifierScope() {
        this(new ConfigStore());
    }

    public IdentifierScope(ConfigStore configStore) {
        this(configStore, new HierarchyTracker(), new CollisionRegistry(), new DebugLog());
    }

    public IdentifierScope(
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
     * Scope bound to the process-wide {@link ConfigStore#global()}.
     */
    public static IdentifierScope global() {
        return new IdentifierScope(ConfigStore.global());
    }

    public ConfigStore configStore() {
        return configStore;
    }

    /**
     * Shortcut for {@code configStore().get()}.
     */
    public IdentifierConfig config() {
        return configStore.get();
    }

    public HierarchyTracker hierarchy() {
        return hierarchy;
    }

    public CollisionRegistry registry() {
        return registry;
    }

    public DebugLog debugLog() {
        return debugLog;
    }

    public IdentifierGenerator generator() {
        return new IdentifierGenerator(configStore, hierarchy, registry, debugLog);
    }

    public AssignmentResolver resolver() {
        return new AssignmentResolver(configStore, generator());
    }

    public TestScriptExporter exporter() {
        return new TestScriptExporter(registry, hierarchy);
    }

    public TestScriptExporter exporter(ScriptDialect dialect) {
        return new TestScriptExporter(registry, hierarchy, dialect);
    }

    /**
     * Clears accumulated state (hierarchy, issued identifiers, debug log). Configuration is left alone.
     */
    public void reset() {
        hierarchy.reset();
        registry.clear();
        debugLog.clear();
    }
}
