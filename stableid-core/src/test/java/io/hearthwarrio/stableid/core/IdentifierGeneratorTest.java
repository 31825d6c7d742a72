package io.hearthwarrio.stableid.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IdentifierGeneratorTest {

    private IdentifierScope scope;
    private IdentifierGenerator generator;

    @BeforeEach
    void setUp() {
        scope = new IdentifierScope();
        scope.config().setNamespace("test");
        generator = scope.generator();
    }

    @Test
    void composesNamespaceScreenContextRoleAndSubject() {
        assertEquals("test.main.list.item.user-1", generator.generateId("user-1", "item", "list"));
    }

    @Test
    void distinctItemsGetDistinctIdsIndependentOfOrder() {
        String first = generator.generateId("user-1", "item", "list");
        String second = generator.generateId("user-2", "item", "list");

        IdentifierGenerator other = new IdentifierScope(configStoreWithNamespace("test")).generator();
        String secondReordered = other.generateId("user-2", "item", "list");
        String firstReordered = other.generateId("user-1", "item", "list");

        assertNotEquals(first, second);
        assertEquals(first, firstReordered);
        assertEquals(second, secondReordered);
        for (String id : new String[]{first, second}) {
            assertTrue(id.contains("test"));
            assertTrue(id.contains("item"));
        }
        assertTrue(first.contains("user-1"));
        assertTrue(second.contains("user-2"));
    }

    @Test
    void sameInputsYieldSameIdAcrossFreshScopes() {
        scope.hierarchy().setScreenContext("UserProfile");
        String id = generator.generateId("Save", "button", "");

        IdentifierScope restarted = new IdentifierScope(configStoreWithNamespace("test"));
        restarted.hierarchy().setScreenContext("UserProfile");

        assertEquals(id, generator.generateId("Save", "button", ""));
        assertEquals(id, restarted.generator().generateId("Save", "button", ""));
    }

    @Test
    void sanitizesLabelTextButKeepsItRecognizable() {
        assertEquals("test.main.button.add-fuel", generator.generateId("Add Fuel", "button", ""));
        assertEquals("test.main.button.add-fuel", generator.generateId("  Add   Fuel!  ", "Button", ""));
    }

    @Test
    void semanticModePutsNameBeforeRole() {
        scope.config().setMode(IdentifierMode.SEMANTIC);
        assertEquals("test.main.list.user-1.item", generator.generateId("user-1", "item", "list"));
    }

    @Test
    void readsConfigurationChangesOnTheNextCall() {
        String before = generator.generateId("Save", "button", "");
        scope.config().setNamespace("Other");
        String after = generator.generateId("Save", "button", "");

        assertTrue(before.startsWith("test."));
        assertTrue(after.startsWith("Other."));
    }

    @Test
    void emptyNamespaceDegradesToShorterId() {
        scope.config().setNamespace("");
        String id = generator.generateId("Save", "button", "");

        assertEquals("main.button.save", id);
        assertFalse(id.startsWith("."));
    }

    @Test
    void globalPrefixFollowsNamespace() {
        scope.config().setGlobalPrefix("Checkout");
        assertEquals("test.Checkout.main.button.pay", generator.generateId("Pay", "button", ""));
    }

    @Test
    void blankRoleAndSubjectFallBackToDefaults() {
        assertEquals("test.main.ui.element", generator.generateId("", "", ""));
        assertEquals("test.main.ui.element", generator.generateId(null, null, null));
    }

    @Test
    void uiTestIntegrationForcesMainScreenContext() {
        scope.hierarchy().setScreenContext("UserProfile");
        assertEquals("test.userprofile.button.save", generator.generateId("Save", "button", ""));

        scope.config().setEnableUiTestIntegration(true);
        String id = generator.generateId("Save", "button", "");
        assertEquals("test.main.button.save", id);
        assertFalse(id.contains("userprofile"));
    }

    @Test
    void innermostFrameIsUsedOnlyWhenTrackingIsEnabled() {
        scope.hierarchy().pushFrame("screen:UserProfile");
        scope.hierarchy().pushFrame("container:ProfileSection");

        assertEquals("test.main.button.save", generator.generateId("Save", "button", ""));

        scope.config().setEnableViewHierarchyTracking(true);
        String tracked = generator.generateId("Save", "button", "");
        assertEquals("test.main.profilesection.button.save", tracked);
        assertFalse(tracked.contains("userprofile"));
    }

    @Test
    void subjectFallsBackToInnermostFrameName() {
        scope.hierarchy().pushFrame("container:NavigationView");
        assertEquals("test.main.ui.navigationview", generator.generateId("", "", ""));
    }

    @Test
    void nestedIdenticalNamesDoNotRepeatSegments() {
        scope.config().setEnableViewHierarchyTracking(true).setMode(IdentifierMode.SEMANTIC);
        scope.hierarchy().pushFrame("container:Container");
        scope.hierarchy().pushFrame("container:Container");

        String id = generator.generateId("", "", "");
        assertEquals("test.main.container.ui", id);
        assertFalse(id.contains("container.container"));
        assertFalse(id.contains("container-container"));

        scope.hierarchy().pushFrame("Outer");
        String named = generator.generateId("Outer", "", "");
        assertFalse(named.contains("outer.outer"));
        assertFalse(named.contains("outer-outer"));
    }

    @Test
    void nestedIdenticalNamesDoNotRepeatSegmentsInAutomaticMode() {
        scope.config().setEnableViewHierarchyTracking(true);
        scope.hierarchy().pushFrame("container:Container");
        scope.hierarchy().pushFrame("container:Container");

        assertEquals("test.main.ui.container", generator.generateId("", "", ""));
        assertEquals("test.main.button.container", generator.generateId("Container", "button", ""));
        assertEquals("test.main.container.button.save", generator.generateId("Save", "button", ""));
    }

    @Test
    void contextMatchingTheNameIsNotRepeated() {
        assertEquals("test.main.item.list", generator.generateId("List", "item", "list"));

        scope.config().setMode(IdentifierMode.SEMANTIC);
        assertEquals("test.main.list.item", generator.generateId("List", "item", "list"));
    }

    @Test
    void namespaceIsKeptEvenWhenItMatchesTheScreenContext() {
        scope.config().setNamespace("main");
        String namespaced = generator.generateId("Save", "button", "");

        scope.config().setNamespace("");
        String plain = generator.generateId("Save", "button", "");

        assertEquals("main.main.button.save", namespaced);
        assertEquals("main.button.save", plain);
        assertNotEquals(namespaced, plain);
    }

    @Test
    void prefixIsKeptEvenWhenItMatchesTheNamespace() {
        scope.config().setNamespace("shop").setGlobalPrefix("shop");
        assertEquals("shop.shop.main.button.pay", generator.generateId("Pay", "button", ""));
    }

    @Test
    void deepHierarchyKeepsIdShort() {
        scope.config().setEnableViewHierarchyTracking(true);
        scope.hierarchy().pushFrame("level 0 container");
        String shallow = generator.generateId("Save", "button", "");

        for (int i = 1; i < 12; i++) {
            scope.hierarchy().pushFrame("level " + i + " container");
        }
        String deep = generator.generateId("Save", "button", "");

        assertTrue(deep.length() < 100, deep);
        assertFalse(deep.contains("level-0"));
        assertTrue(deep.length() - shallow.length() <= 1, shallow + " vs " + deep);
    }

    @Test
    void veryLongNamesAreCutWithHashSuffix() {
        String longName = "This is a very long button name that should still produce a short identifier";
        String otherLongName = "This is a very long button name that differs only at the very end";

        String id = generator.generateId(longName, "button", "");
        String other = generator.generateId(otherLongName, "button", "");

        assertTrue(id.length() < 70, id);
        assertTrue(id.startsWith("test.main.button.this-is-a-very-long"), id);
        assertNotEquals(id, other);
    }

    @Test
    void textWithoutSafeCharactersStillGetsDistinctIds() {
        String first = generator.generateId("@#$%", "", "");
        String second = generator.generateId("&*()", "", "");

        assertTrue(first.startsWith("test.main.ui.x"), first);
        assertNotEquals(first, second);
        assertEquals(first, generator.generateId("@#$%", "", ""));
    }

    @Test
    void excludedComponentNamesAreReplacedByContentToken() {
        scope.config().setIncludeComponentNames(false);
        String alice = generator.generateId("Alice", "item", "");
        String bob = generator.generateId("Bob", "item", "");

        assertNotEquals(alice, bob);
        assertFalse(alice.contains("alice"));
        assertTrue(alice.startsWith("test.main.item.h"), alice);
    }

    @Test
    void excludedElementTypesDropTheRole() {
        scope.config().setIncludeElementTypes(false);
        assertEquals("test.main.save", generator.generateId("Save", "button", ""));
    }

    @Test
    void exactIdIgnoresConfigurationAndHierarchy() {
        scope.config().setEnableViewHierarchyTracking(true).setGlobalPrefix("Prefix");
        scope.hierarchy().setScreenContext("UserProfile");
        scope.hierarchy().pushFrame("NavigationView");
        scope.hierarchy().pushFrame("ProfileSection");

        assertEquals("SaveButton", generator.generateExactId("SaveButton"));
        assertEquals("Same Name!", generator.generateExactId("Same Name!"));
        assertTrue(generator.checkForCollision("SaveButton"));
    }

    @Test
    void registersIssuedIdsAndDetectsCollisions() {
        String id = generator.generateId("Save", "button", "");

        assertTrue(generator.checkForCollision(id));
        assertFalse(generator.checkForCollision("test.main.button.cancel"));
        assertTrue(scope.registry().collisions().isEmpty());

        generator.generateId("Save", "button", "");
        assertTrue(scope.registry().collisions().isEmpty());

        assertEquals(id, generator.generateId("SAVE", "button", ""));
        assertEquals(1, scope.registry().collisions().size());
        assertEquals(id, scope.registry().collisions().get(0).getIdentifier());
    }

    @Test
    void checkForCollisionDoesNotRegister() {
        assertFalse(generator.checkForCollision("test.main.button.save"));
        assertFalse(generator.checkForCollision("test.main.button.save"));
        assertTrue(scope.registry().isEmpty());
    }

    private static ConfigStore configStoreWithNamespace(String namespace) {
        IdentifierConfig config = new IdentifierConfig();
        config.setNamespace(namespace);
        return new ConfigStore(config);
    }
}
