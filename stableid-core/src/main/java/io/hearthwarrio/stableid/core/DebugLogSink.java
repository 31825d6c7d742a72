package io.hearthwarrio.stableid.core;

/**
 * Receives debug log events as they are recorded.
 * <p>
 * Implementations may print to stdout, attach to Allure, etc. Sinks are called in record order
 * while the log is locked, so they should return quickly and must not call back into the log.
 */
@FunctionalInterface
public interface DebugLogSink {

    /**
     * Called once per recorded entry.
     */
    void onEntry(DebugLogEntry entry);

    /**
     * Called when two distinct requests produced the same identifier.
     * Default: ignore.
     */
    default void onCollision(CollisionRegistry.Collision collision) {
    }
}
