package io.hearthwarrio.stableid.core.export;

import java.awt.GraphicsEnvironment;
import java.awt.HeadlessException;
import java.awt.Toolkit;
import java.awt.datatransfer.StringSelection;

/**
 * AWT system clipboard. Reports {@code false} on headless machines (CI) instead of failing.
 */
public final class SystemClipboardWriter implements ClipboardWriter {

    @Override
    public boolean write(String text) {
        if (GraphicsEnvironment.isHeadless()) {
            System.out.println("[StableId] clipboard export skipped: headless environment");
            return false;
        }
        try {
            Toolkit.getDefaultToolkit().getSystemClipboard().setContents(new StringSelection(text), null);
            return true;
        } catch (IllegalStateException | HeadlessException e) {
            System.out.println("[StableId] clipboard export failed: " + e.getMessage());
            return false;
        }
    }
}
