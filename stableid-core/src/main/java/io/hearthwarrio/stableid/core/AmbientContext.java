package io.hearthwarrio.stableid.core;

import java.util.Objects;

/**
 * Immutable ambient state handed from a parent node to its children during traversal.
 * <p>
 * Traversal code keeps the context for the current node on its own call stack and derives child contexts with
 * {@link #with(AmbientOverride)}; nothing is looked up globally. The nearest explicit override wins.
 */
public final class AmbientContext {

    private static final AmbientContext ROOT = new AmbientContext(null, AmbientOverride.INHERIT);

    private final AmbientContext parent;
    private final AmbientOverride override;

    private AmbientContext(AmbientContext parent, AmbientOverride override) {
        this.parent = parent;
        this.override = override;
    }

    public static AmbientContext root() {
        return ROOT;
    }

    /**
     * Context for a child subtree. {@link AmbientOverride#INHERIT} returns this context unchanged.
     */
    public AmbientContext with(AmbientOverride override) {
        Objects.requireNonNull(override, "override must not be null");
        if (override == AmbientOverride.INHERIT) {
            return this;
        }
        return new AmbientContext(this, override);
    }

    /**
     * Effective override: the nearest non-inherit value, or {@link AmbientOverride#INHERIT}.
     */
    public AmbientOverride effectiveOverride() {
        return override;
    }

    public int depth() {
        int depth = 0;
        for (AmbientContext c = parent; c != null; c = c.parent) {
            depth++;
        }
        return depth;
    }

    @Override
    public String toString() {
        return "AmbientContext{" +
                "override=" + override +
                ", depth=" + depth() +
                '}';
    }
}
