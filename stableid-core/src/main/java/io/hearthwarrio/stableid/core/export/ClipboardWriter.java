package io.hearthwarrio.stableid.core.export;

/**
 * Destination of {@link TestScriptExporter#exportToClipboard()}.
 */
@FunctionalInterface
public interface ClipboardWriter {

    /**
     * @return true if the text was placed on the clipboard
     */
    boolean write(String text);
}
