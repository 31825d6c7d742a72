package io.hearthwarrio.stableid.webdriver;

/**
 * Thrown when an element cannot be found by its generated identifier,
 * or when identifiers issued in a run are missing from the page.
 */
public class IdentifierLookupException extends RuntimeException {
    public IdentifierLookupException(String message) {
        super(message);
    }

    public IdentifierLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
