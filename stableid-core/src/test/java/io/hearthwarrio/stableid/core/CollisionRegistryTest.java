package io.hearthwarrio.stableid.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CollisionRegistryTest {

    @Test
    void sameRequestIsNotACollision() {
        CollisionRegistry registry = new CollisionRegistry();

        assertNull(registry.register("a.b", IdentifierRequest.of("b", "x")));
        assertNull(registry.register("a.b", IdentifierRequest.of("b", "x")));

        assertEquals(1, registry.size());
        assertTrue(registry.collisions().isEmpty());
    }

    @Test
    void differentRequestIsRecordedAndFirstOwnerKept() {
        CollisionRegistry registry = new CollisionRegistry();
        IdentifierRequest first = IdentifierRequest.of("Save", "button");
        IdentifierRequest second = IdentifierRequest.of("SAVE", "button");

        registry.register("x.save", first);
        CollisionRegistry.Collision collision = registry.register("x.save", second);

        assertNotNull(collision);
        assertSame(first, collision.getFirst());
        assertSame(second, collision.getSecond());
        assertEquals(first, registry.issued().get("x.save"));
        assertEquals(List.of(collision), registry.collisions());
    }

    @Test
    void issuedKeepsIssueOrder() {
        CollisionRegistry registry = new CollisionRegistry();
        registry.register("z", IdentifierRequest.of("z", ""));
        registry.register("a", IdentifierRequest.of("a", ""));

        assertEquals(List.of("z", "a"), List.copyOf(registry.issued().keySet()));
    }

    @Test
    void clearForgetsEverything() {
        CollisionRegistry registry = new CollisionRegistry();
        registry.register("a", IdentifierRequest.of("a", ""));
        registry.register("a", IdentifierRequest.of("b", ""));

        registry.clear();

        assertTrue(registry.isEmpty());
        assertFalse(registry.contains("a"));
        assertTrue(registry.collisions().isEmpty());
        assertFalse(registry.contains(null));
    }

    @Test
    void keepsOnlyTheMostRecentCollisionsButCountsAll() {
        CollisionRegistry registry = new CollisionRegistry(3);
        registry.register("x.save", IdentifierRequest.of("save", "button"));
        for (int i = 0; i < 10; i++) {
            assertNotNull(registry.register("x.save", IdentifierRequest.of("save-" + i, "button")));
        }

        List<CollisionRegistry.Collision> kept = registry.collisions();
        assertEquals(3, kept.size());
        assertEquals("save-7", kept.get(0).getSecond().getSubjectIdentity());
        assertEquals("save-9", kept.get(2).getSecond().getSubjectIdentity());
        assertEquals(10, registry.collisionCount());
        assertEquals(1, registry.size());

        registry.clear();
        assertEquals(0, registry.collisionCount());
        assertThrows(IllegalArgumentException.class, () -> new CollisionRegistry(0));
    }

    @Test
    void scopeResetClearsRegistryLogAndHierarchy() {
        IdentifierScope scope = new IdentifierScope(new ConfigStore(new IdentifierConfig().setEnableDebugLogging(true)));
        scope.hierarchy().pushFrame("screen:Home");
        scope.generator().generateId("save", "button", "");

        scope.reset();

        assertTrue(scope.registry().isEmpty());
        assertTrue(scope.debugLog().isEmpty());
        assertTrue(scope.hierarchy().isEmpty());
        assertTrue(scope.config().isEnableDebugLogging());
    }
}
