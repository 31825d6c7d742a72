package io.hearthwarrio.stableid.core;

import java.util.Objects;

/**
 * Inputs of one generation call.
 * <p>
 * {@code subjectIdentity} must be derived from content (a data id, label text, a declared name),
 * never from a memory address or a clock. Null values are normalized to empty strings.
 */
public final class IdentifierRequest {

    private final String subjectIdentity;
    private final String role;
    private final String context;

    public IdentifierRequest(String subjectIdentity, String role, String context) {
        this.subjectIdentity = normalizeNull(subjectIdentity);
        this.role = normalizeNull(role);
        this.context = normalizeNull(context);
    }

    public static IdentifierRequest of(String subjectIdentity, String role) {
        return new IdentifierRequest(subjectIdentity, role, "");
    }

    private static String normalizeNull(String s) {
        return s == null ? "" : s;
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

    @Override
    public String toString() {
        return "IdentifierRequest{" +
                "subjectIdentity='" + subjectIdentity + '\'' +
                ", role='" + role + '\'' +
                ", context='" + context + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdentifierRequest)) return false;
        IdentifierRequest that = (IdentifierRequest) o;
        return Objects.equals(subjectIdentity, that.subjectIdentity) &&
                Objects.equals(role, that.role) &&
                Objects.equals(context, that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectIdentity, role, context);
    }
}
