package com.rtidy.io;

/**
 * Source text given directly, for example on the command line.
 */
public class TextSourceReader implements SourceReader {
    private final String text;

    public TextSourceReader(String text) {
        this.text = text;
    }

    @Override
    public String read() {
        return text;
    }

    @Override
    public String describe() {
        return "<text>";
    }
}
