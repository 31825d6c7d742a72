package io.hearthwarrio.stableid.core;

/**
 * Identifier-related declarations made on a single node.
 * <p>
 * Built fluently:
 * <pre>{@code
 * NodeDeclaration.of("user-1", "item", "list").named("Primary User");
 * NodeDeclaration.of("save", "button", "").disableAutomaticIdentifiers();
 * NodeDeclaration.of("", "button", "").explicitIdentifier("manual-id");
 * }</pre>
 * Null strings are normalized to empty strings; empty means "not declared".
 */
public final class NodeDeclaration {

    private final String subjectIdentity;
    private final String role;
    private final String context;
    private final String explicitIdentifier;
    private final boolean autoIdsDisabled;
    private final boolean autoIdsEnabled;
    private final String name;
    private final String exactName;

    private NodeDeclaration(
            String subjectIdentity,
            String role,
            String context,
            String explicitIdentifier,
            boolean autoIdsDisabled,
            boolean autoIdsEnabled,
            String name,
            String exactName
    ) {
        this.subjectIdentity = normalizeNull(subjectIdentity);
        this.role = normalizeNull(role);
        this.context = normalizeNull(context);
        this.explicitIdentifier = normalizeNull(explicitIdentifier);
        this.autoIdsDisabled = autoIdsDisabled;
        this.autoIdsEnabled = autoIdsEnabled;
        this.name = normalizeNull(name);
        this.exactName = normalizeNull(exactName);
    }

    public static NodeDeclaration of(String subjectIdentity, String role, String context) {
        return new NodeDeclaration(subjectIdentity, role, context, "", false, false, "", "");
    }

    private static String normalizeNull(String s) {
        return s == null ? "" : s;
    }

    /**
     * Sets a literal identifier; it is attached as-is and beats every other declaration.
     */
    public NodeDeclaration explicitIdentifier(String identifier) {
        return new NodeDeclaration(subjectIdentity, role, context, identifier,
                autoIdsDisabled, autoIdsEnabled, name, exactName);
    }

    /**
     * Local opt-out.
     */
    public NodeDeclaration disableAutomaticIdentifiers() {
        return new NodeDeclaration(subjectIdentity, role, context, explicitIdentifier,
                true, autoIdsEnabled, name, exactName);
    }

    /**
     * Local opt-in.
     */
    public NodeDeclaration enableAutomaticIdentifiers() {
        return new NodeDeclaration(subjectIdentity, role, context, explicitIdentifier,
                autoIdsDisabled, true, name, exactName);
    }

    /**
     * Local opt-in that uses {@code name} instead of the subject identity.
     */
    public NodeDeclaration named(String name) {
        return new NodeDeclaration(subjectIdentity, role, context, explicitIdentifier,
                autoIdsDisabled, true, name, exactName);
    }

    /**
     * Local opt-in that attaches {@code exactName} untouched (exact-name bypass).
     */
    public NodeDeclaration exactNamed(String exactName) {
        return new NodeDeclaration(subjectIdentity, role, context, explicitIdentifier,
                autoIdsDisabled, true, name, exactName);
    }

    public String getSubjectIdentity() {
        return subjectIdentity;
    }

    public String getRole() {
        return role;
    }

    public String getContext() {
        return context;
    }

    public String getExplicitIdentifier() {
        return explicitIdentifier;
    }

    public boolean hasExplicitIdentifier() {
        return !explicitIdentifier.isEmpty();
    }

    public boolean isAutoIdsDisabled() {
        return autoIdsDisabled;
    }

    public boolean isAutoIdsEnabled() {
        return autoIdsEnabled;
    }

    public String getName() {
        return name;
    }

    public String getExactName() {
        return exactName;
    }

    @Override
    public String toString() {
        return "NodeDeclaration{" +
                "subjectIdentity='" + subjectIdentity + '\'' +
                ", role='" + role + '\'' +
                ", context='" + context + '\'' +
                ", explicitIdentifier='" + explicitIdentifier + '\'' +
                ", autoIdsDisabled=" + autoIdsDisabled +
                ", autoIdsEnabled=" + autoIdsEnabled +
                ", name='" + name + '\'' +
                ", exactName='" + exactName + '\'' +
                '}';
    }
}
