package io.hearthwarrio.stableid.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Run-scoped set of identifiers already issued, with the request that first produced each one.
 * <p>
 * Issuing the same identifier again for the same request is normal (a node re-rendered);
 * issuing it for a different request is a collision and is remembered in {@link #collisions()}.
 * Issued identifiers are kept for the whole run; only the most recent collisions are kept,
 * {@link #collisionCount()} counts all of them.
 * All methods are synchronized on the instance.
 */
public final class CollisionRegistry {

    public static final int DEFAULT_COLLISION_CAPACITY = 1000;

    private final Map<String, IdentifierRequest> issued = new LinkedHashMap<>();
    private final Deque<Collision> collisions = new ArrayDeque<>();
    private final int collisionCapacity;
    private long collisionCount;

    public CollisionRegistry() {
        this(DEFAULT_COLLISION_CAPACITY);
    }

    public CollisionRegistry(int collisionCapacity) {
        if (collisionCapacity <= 0) {
            throw new IllegalArgumentException("collisionCapacity must be positive: " + collisionCapacity);
        }
        this.collisionCapacity = collisionCapacity;
    }

    /**
     * Records {@code identifier} as issued for {@code request}.
     *
     * @return the collision if another request already holds this identifier, otherwise null
     */
    public synchronized Collision register(String identifier, IdentifierRequest request) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(request, "request must not be null");

        IdentifierRequest first = issued.putIfAbsent(identifier, request);
        if (first == null || first.equals(request)) {
            return null;
        }
        Collision collision = new Collision(identifier, first, request);
        collisions.addLast(collision);
        collisionCount++;
        while (collisions.size() > collisionCapacity) {
            collisions.removeFirst();
        }
        return collision;
    }

    /**
     * Membership test; never mutates the registry.
     */
    public synchronized boolean contains(String identifier) {
        return identifier != null && issued.containsKey(identifier);
    }

    public synchronized boolean isEmpty() {
        return issued.isEmpty();
    }

    public synchronized int size() {
        return issued.size();
    }

    /**
     * Issued identifiers with their first request, in issue order.
     */
    public synchronized Map<String, IdentifierRequest> issued() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(issued));
    }

    /**
     * The most recent collisions, oldest first.
     */
    public synchronized List<Collision> collisions() {
        return Collections.unmodifiableList(new ArrayList<>(collisions));
    }

    /**
     * Collisions seen since the last {@link #clear()}, including those no longer kept.
     */
    public synchronized long collisionCount() {
        return collisionCount;
    }

    public synchronized void clear() {
        issued.clear();
        collisions.clear();
        collisionCount = 0;
    }

    /**
     * Two distinct requests that produced the same identifier.
     */
    public static final class Collision {

        private final String identifier;
        private final IdentifierRequest first;
        private final IdentifierRequest second;

        public Collision(String identifier, IdentifierRequest first, IdentifierRequest second) {
            this.identifier = identifier;
            this.first = first;
            this.second = second;
        }

        public String getIdentifier() {
            return identifier;
        }

        public IdentifierRequest getFirst() {
            return first;
        }

        public IdentifierRequest getSecond() {
            return second;
        }

        @Override
        public String toString() {
            return "Collision{" +
                    "identifier='" + identifier + '\'' +
                    ", first=" + first +
                    ", second=" + second +
                    '}';
        }
    }
}
