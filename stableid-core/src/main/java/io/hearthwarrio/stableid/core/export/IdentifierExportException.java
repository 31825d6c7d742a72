package io.hearthwarrio.stableid.core.export;

/**
 * Thrown when generated test code cannot be written.
 */
public class IdentifierExportException extends RuntimeException {
    public IdentifierExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
