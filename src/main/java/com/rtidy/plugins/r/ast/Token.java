package com.rtidy.plugins.r.ast;

/**
 * A lexed R token. Offsets are character offsets into the lexed text;
 * lines and columns are 1-based.
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final int line;
    private final int column;
    private final int offset;
    private final int endLine;

    public Token(TokenType type, String lexeme, int line, int column, int offset, int endLine) {
        this.type = type;
        this.lexeme = lexeme;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.endLine = endLine;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * Last line the token touches; differs from {@link #getLine()} only for
     * strings spanning several lines.
     */
    public int getEndLine() {
        return endLine;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("%s(%s) at %d:%d", type, lexeme, line, column);
    }
}
