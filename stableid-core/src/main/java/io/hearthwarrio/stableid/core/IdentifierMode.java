package io.hearthwarrio.stableid.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Naming strategy used by {@link IdentifierGenerator}.
 */
public enum IdentifierMode {
    /**
     * Role before name: {@code namespace.screen.button.save}.
     */
    AUTOMATIC,

    /**
     * Name before role, reads like a sentence: {@code namespace.screen.save.button}.
     */
    SEMANTIC,

    /**
     * Semantic naming, but only nodes that opt in locally get an identifier.
     */
    MANUAL;

    /**
     * Whether the global enable flag may turn generation on by itself in this mode.
     */
    public boolean allowsGlobalGeneration() {
        return this != MANUAL;
    }

    /**
     * Lenient lookup by name (case-insensitive). Unknown or blank names yield empty.
     */
    public static Optional<IdentifierMode> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (IdentifierMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
