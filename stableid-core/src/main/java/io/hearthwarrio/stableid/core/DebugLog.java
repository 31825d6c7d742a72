package io.hearthwarrio.stableid.core;

import java.io.PrintStream;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Bounded, append-only record of generation events, shared by every generator of one scope.
 * <p>
 * When full, the oldest entry is evicted; the most recent entries are always kept.
 * Entries appear in the order their {@link #record} calls completed. Whether an event is recorded
 * at all is decided by the caller (see {@link IdentifierConfig#isEnableDebugLogging()}).
 */
public final class DebugLog {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Clock clock;
    private final Deque<DebugLogEntry> entries = new ArrayDeque<>();
    private final List<DebugLogSink> sinks = new CopyOnWriteArrayList<>();

    public DebugLog() {
        this(DEFAULT_CAPACITY, Clock.systemUTC());
    }

    public DebugLog(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public DebugLog addSink(DebugLogSink sink) {
        sinks.add(Objects.requireNonNull(sink, "sink must not be null"));
        return this;
    }

    public boolean removeSink(DebugLogSink sink) {
        return sinks.remove(sink);
    }

    /**
     * Appends {@code entry}, evicting the oldest entry when the log is full.
     */
    public synchronized void record(DebugLogEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
        for (DebugLogSink sink : sinks) {
            sink.onEntry(entry);
        }
    }

    /**
     * Builds an entry stamped with this log's clock and records it.
     */
    public synchronized DebugLogEntry record(DebugLogEntry.Kind kind, IdentifierRequest request, String identifier) {
        DebugLogEntry entry = new DebugLogEntry(clock.instant(), kind, request, identifier);
        record(entry);
        return entry;
    }

    /**
     * Forwards a collision report to the sinks. Collisions are not log entries.
     */
    public synchronized void reportCollision(CollisionRegistry.Collision collision) {
        Objects.requireNonNull(collision, "collision must not be null");
        for (DebugLogSink sink : sinks) {
            sink.onCollision(collision);
        }
    }

    public synchronized List<DebugLogEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * One formatted line per entry, oldest first; empty string when nothing was recorded.
     */
    public synchronized String getLog() {
        StringBuilder sb = new StringBuilder();
        for (DebugLogEntry entry : entries) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(entry.format());
        }
        return sb.toString();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        entries.clear();
    }

    public void print(PrintStream out) {
        Objects.requireNonNull(out, "out must not be null");
        String log = getLog();
        if (log.isEmpty()) {
            out.println("[StableId] debug log: (empty)");
        } else {
            out.println("[StableId] debug log:");
            out.println(log);
        }
    }
}
