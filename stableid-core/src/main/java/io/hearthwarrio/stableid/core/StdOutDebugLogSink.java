package io.hearthwarrio.stableid.core;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints debug log events as {@code [StableId] ...} lines.
 */
public final class StdOutDebugLogSink implements DebugLogSink {

    private final PrintStream out;

    public StdOutDebugLogSink() {
        this(System.out);
    }

    public StdOutDebugLogSink(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public void onEntry(DebugLogEntry entry) {
        out.println("[StableId] " + entry.format());
    }

    @Override
    public void onCollision(CollisionRegistry.Collision collision) {
        out.println("[StableId] collision on '" + collision.getIdentifier() + "': " +
                collision.getFirst() + " vs " + collision.getSecond());
    }
}
