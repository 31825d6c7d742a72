package io.hearthwarrio.stableid.core;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Resolves the active {@link IdentifierConfig}.
 * <p>
 * Two layers:
 * <ul>
 *   <li>a scoped override, installed for one unit of work (typically one test case) and confined to the
 *       installing thread</li>
 *   <li>the store-wide default instance</li>
 * </ul>
 * The scoped override, when present, always wins. {@link #get()} returns the live object, never a copy,
 * so changes made through any reference are visible on the next call.
 */
public final class ConfigStore {

    private static final ConfigStore GLOBAL = new ConfigStore(IdentifierConfig.fromEnvironment(System.getenv()));

    private final IdentifierConfig defaultConfig;
    private final ThreadLocal<IdentifierConfig> scoped = new ThreadLocal<>();

    public ConfigStore() {
        this(new IdentifierConfig());
    }

    public ConfigStore(IdentifierConfig defaultConfig) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig must not be null");
    }

    /**
     * Process-wide store. Its default configuration honors {@value IdentifierConfig#DEBUG_ENV_VARIABLE}.
     */
    public static ConfigStore global() {
        return GLOBAL;
    }

    /**
     * Active configuration: the scoped override of the current thread, otherwise the default instance.
     */
    public IdentifierConfig get() {
        IdentifierConfig override = scoped.get();
        return override != null ? override : defaultConfig;
    }

    /**
     * The store-wide instance, ignoring any scoped override.
     */
    public IdentifierConfig defaultConfig() {
        return defaultConfig;
    }

    public boolean hasScopedOverride() {
        return scoped.get() != null;
    }

    /**
     * Restores defaults on the active configuration.
     */
    public void resetToDefaults() {
        get().resetToDefaults();
    }

    /**
     * Installs {@code config} as the scoped override for the current thread.
     * Closing the returned scope restores whatever override was active before, so scopes nest.
     */
    public Scope install(IdentifierConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        IdentifierConfig previous = scoped.get();
        scoped.set(config);
        return new Scope(previous);
    }

    /**
     * Runs {@code action} with {@code config} installed as the scoped override.
     */
    public <T> T withScoped(IdentifierConfig config, Supplier<T> action) {
        Objects.requireNonNull(action, "action must not be null");
        try (Scope ignored = install(config)) {
            return action.get();
        }
    }

    /**
     * Runs {@code action} with {@code config} installed as the scoped override.
     */
    public void withScoped(IdentifierConfig config, Runnable action) {
        Objects.requireNonNull(action, "action must not be null");
        try (Scope ignored = install(config)) {
            action.run();
        }
    }

    /**
     * Handle of an installed override. Closing it more than once has no further effect.
     */
    public final class Scope implements AutoCloseable {

        private final IdentifierConfig previous;
        private boolean closed;

        private Scope(IdentifierConfig previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (previous == null) {
                scoped.remove();
            } else {
                scoped.set(previous);
            }
        }
    }
}
