package io.hearthwarrio.stableid.core.export;

import io.hearthwarrio.stableid.core.IdentifierSanitizer;

import java.util.Set;

/**
 * Action implied by a node role in generated test code.
 */
public enum ElementAction {
    NONE,
    TAP,
    TYPE;

    private static final Set<String> TAP_ROLES = Set.of(
            "button", "link", "toggle", "switch", "checkbox", "tab", "menu-item", "menuitem"
    );

    private static final Set<String> TYPE_ROLES = Set.of(
            "text-field", "textfield", "field", "text-input", "textinput",
            "search-field", "searchfield", "secure-field", "securefield", "text-editor", "texteditor"
    );

    /**
     * Maps a role (as given to the generator, any case or spacing) to its action.
     */
    public static ElementAction fromRole(String role) {
        String normalized = IdentifierSanitizer.component(role);
        if (TAP_ROLES.contains(normalized)) {
            return TAP;
        }
        if (TYPE_ROLES.contains(normalized)) {
            return TYPE;
        }
        return NONE;
    }
}
