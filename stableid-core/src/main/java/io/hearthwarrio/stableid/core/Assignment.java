package io.hearthwarrio.stableid.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving one node: the identifier to attach (if any) and the layer that decided.
 */
public final class Assignment {

    private final String identifier;
    private final AssignmentSource source;

    private Assignment(String identifier, AssignmentSource source) {
        this.identifier = identifier;
        this.source = source;
    }

    static Assignment assigned(String identifier, AssignmentSource source) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        return new Assignment(identifier, source);
    }

    static Assignment none(AssignmentSource source) {
        return new Assignment(null, source);
    }

    public Optional<String> getIdentifier() {
        return Optional.ofNullable(identifier);
    }

    public boolean isAssigned() {
        return identifier != null;
    }

    public AssignmentSource getSource() {
        return source;
    }

    @Override
    public String toString() {
        return "Assignment{" +
                "identifier=" + (identifier == null ? "none" : "'" + identifier + "'") +
                ", source=" + source +
                '}';
    }
}
