package io.hearthwarrio.stableid.core;

/**
 * Which layer of the cascade decided an {@link Assignment}.
 */
public enum AssignmentSource {
    EXPLICIT_LITERAL(true),
    LOCAL_DISABLE(false),
    LOCAL_EXACT_NAME(true),
    LOCAL_NAME(true),
    LOCAL_ENABLE(true),
    AMBIENT_FORCE_ON(true),
    AMBIENT_FORCE_OFF(false),
    GLOBAL_ENABLED(true),
    GLOBAL_DISABLED(false);

    private final boolean assigns;

    AssignmentSource(boolean assigns) {
        this.assigns = assigns;
    }

    /**
     * Whether this decision attaches an identifier.
     */
    public boolean assigns() {
        return assigns;
    }
}
