package com.rtidy.plugins.r.ast;

/**
 * R token types.
 */
public enum TokenType {
    // literals and names
    NUMBER,
    STRING,
    SYMBOL,
    CONSTANT,       // TRUE FALSE NULL NA Inf NaN NA_integer_ ...

    // keywords
    IF,
    ELSE,
    FOR,
    IN,
    WHILE,
    REPEAT,
    FUNCTION,
    LAMBDA,         // \(x)
    BREAK,
    NEXT,

    // operators
    LEFT_ASSIGN,    // <- <<-
    RIGHT_ASSIGN,   // -> ->>
    EQ_ASSIGN,      // =
    QUESTION,
    TILDE,
    OR,             // | ||
    AND,            // & &&
    NOT,
    COMPARE,        // == != < > <= >=
    PLUS,
    MINUS,
    STAR,
    SLASH,
    SPECIAL,        // %any%
    PIPE,           // |>
    COLON,
    CARET,          // ^ **
    DOLLAR,
    AT,
    NAMESPACE,      // :: :::

    // delimiters
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    DOUBLE_LBRACKET,
    RBRACKET,
    COMMA,
    SEMICOLON,

    // layout
    COMMENT,
    NEWLINE,
    EOF;

    /**
     * Whether a token of this type can be the last token of a complete
     * expression.
     */
    public boolean endsExpression() {
        return switch (this) {
            case NUMBER, STRING, SYMBOL, CONSTANT, BREAK, NEXT, RPAREN, RBRACKET, RBRACE -> true;
            default -> false;
        };
    }

    /**
     * Whether this is a binary (or unary) operator token.
     */
    public boolean isOperator() {
        return switch (this) {
            case LEFT_ASSIGN, RIGHT_ASSIGN, EQ_ASSIGN, QUESTION, TILDE, OR, AND, NOT, COMPARE,
                 PLUS, MINUS, STAR, SLASH, SPECIAL, PIPE, COLON, CARET, DOLLAR, AT, NAMESPACE -> true;
            default -> false;
        };
    }
}
