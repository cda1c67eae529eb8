package com.rtidy.io;

import java.awt.GraphicsEnvironment;
import java.awt.HeadlessException;
import java.awt.Toolkit;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.io.IOException;

/**
 * Reads the text currently on the system clipboard.
 */
public class ClipboardSourceReader implements SourceReader {

    /**
     * @throws IOException when running headless, or when the clipboard
     *                     holds no text
     */
    @Override
    public String read() throws IOException {
        if (GraphicsEnvironment.isHeadless()) {
            throw new IOException("The system clipboard is not available in a headless environment");
        }
        try {
            return (String) Toolkit.getDefaultToolkit().getSystemClipboard().getData(DataFlavor.stringFlavor);
        } catch (UnsupportedFlavorException | HeadlessException | IllegalStateException e) {
            throw new IOException("Could not read text from the clipboard: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "<clipboard>";
    }
}
