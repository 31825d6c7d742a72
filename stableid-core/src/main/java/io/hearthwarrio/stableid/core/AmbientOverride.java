package io.hearthwarrio.stableid.core;

/**
 * Subtree-wide override signal threaded down the tree.
 */
public enum AmbientOverride {
    /**
     * No opinion; the global flag decides.
     */
    INHERIT,

    /**
     * Generate for the whole subtree, even when the global flag is off.
     */
    FORCE_ON,

    /**
     * Generate for nobody in the subtree, even when the global flag is on.
     */
    FORCE_OFF
}
