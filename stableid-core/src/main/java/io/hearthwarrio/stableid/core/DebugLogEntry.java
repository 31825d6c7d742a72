package io.hearthwarrio.stableid.core;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * One generation event: inputs and the resulting identifier.
 */
public final class DebugLogEntry {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    /**
     * How the identifier was produced.
     */
    public enum Kind {
        GENERATED,
        EXACT
    }

    private final Instant timestamp;
    private final Kind kind;
    private final IdentifierRequest request;
    private final String identifier;

    public DebugLogEntry(Instant timestamp, Kind kind, IdentifierRequest request, String identifier) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.request = Objects.requireNonNull(request, "request must not be null");
        this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Kind getKind() {
        return kind;
    }

    public IdentifierRequest getRequest() {
        return request;
    }

    public String getSubjectIdentity() {
        return request.getSubjectIdentity();
    }

    public String getRole() {
        return request.getRole();
    }

    public String getContext() {
        return request.getContext();
    }

    public String getIdentifier() {
        return identifier;
    }

    /**
     * Single-line form used by {@link DebugLog#getLog()}.
     */
    public String format() {
        String verb = kind == Kind.EXACT ? "Exact identifier" : "Generated identifier";
        return "[" + TIMESTAMP.format(timestamp) + "] " + verb + " '" + identifier + "'" +
                " for subject '" + request.getSubjectIdentity() + "'" +
                " role '" + request.getRole() + "'" +
                " context '" + request.getContext() + "'";
    }

    @Override
    public String toString() {
        return "DebugLogEntry{" +
                "timestamp=" + timestamp +
                ", kind=" + kind +
                ", request=" + request +
                ", identifier='" + identifier + '\'' +
                '}';
    }
}
