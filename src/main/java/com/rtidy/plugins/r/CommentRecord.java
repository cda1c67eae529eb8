package com.rtidy.plugins.r;

/**
 * A comment or blank line the masker replaced with a placeholder.
 */
public final class CommentRecord {

    public enum Kind {
        STANDALONE,
        INLINE,
        BRACE_TRAILING,
        BLANK
    }

    private final Kind kind;
    private final String rawText;
    private final int line;

    public CommentRecord(Kind kind, String rawText, int line) {
        this.kind = kind;
        this.rawText = rawText;
        this.line = line;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The comment as written, starting at its {@code #}; empty for a blank line.
     */
    public String getRawText() {
        return rawText;
    }

    public String getEscapedPayload() {
        return Placeholders.escape(rawText);
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return kind + "@" + line + ": " + rawText;
    }
}
