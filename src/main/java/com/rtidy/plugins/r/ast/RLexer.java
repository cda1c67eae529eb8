package com.rtidy.plugins.r.ast;

import com.rtidy.api.error.ParseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * R lexer. Comments and newlines are kept as tokens so callers can decide
 * what to do with layout; the parser ignores comments.
 */
public class RLexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;

    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("for", TokenType.FOR);
        map.put("in", TokenType.IN);
        map.put("while", TokenType.WHILE);
        map.put("repeat", TokenType.REPEAT);
        map.put("function", TokenType.FUNCTION);
        map.put("break", TokenType.BREAK);
        map.put("next", TokenType.NEXT);

        map.put("TRUE", TokenType.CONSTANT);
        map.put("FALSE", TokenType.CONSTANT);
        map.put("NULL", TokenType.CONSTANT);
        map.put("NA", TokenType.CONSTANT);
        map.put("NA_integer_", TokenType.CONSTANT);
        map.put("NA_real_", TokenType.CONSTANT);
        map.put("NA_character_", TokenType.CONSTANT);
        map.put("NA_complex_", TokenType.CONSTANT);
        map.put("Inf", TokenType.CONSTANT);
        map.put("NaN", TokenType.CONSTANT);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    public RLexer(String source) {
        this.source = source;
    }

    /**
     * Scans the whole source. The returned list always ends with an EOF token.
     *
     * @throws ParseException on an unterminated string, backtick name or
     *                        {@code %op%}, or a character R does not accept
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", line, current - lineStart + 1, current, line));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ': case '\t': case '\f': case '\r':
                break;
            case '\n': addToken(TokenType.NEWLINE); break;
            case '#': comment(); break;
            case '"': case '\'': string(c); break;
            case '`': backtick(); break;
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[':
                addToken(match('[') ? TokenType.DOUBLE_LBRACKET : TokenType.LBRACKET);
                break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '<':
                if (match('<')) {
                    if (!match('-')) {
                        throw error("Unexpected '<<'");
                    }
                    addToken(TokenType.LEFT_ASSIGN);
                } else if (match('-')) {
                    addToken(TokenType.LEFT_ASSIGN);
                } else {
                    match('=');
                    addToken(TokenType.COMPARE);
                }
                break;
            case '-':
                if (match('>')) {
                    match('>');
                    addToken(TokenType.RIGHT_ASSIGN);
                } else {
                    addToken(TokenType.MINUS);
                }
                break;
            case '=':
                addToken(match('=') ? TokenType.COMPARE : TokenType.EQ_ASSIGN);
                break;
            case '!':
                addToken(match('=') ? TokenType.COMPARE : TokenType.NOT);
                break;
            case '>':
                match('=');
                addToken(TokenType.COMPARE);
                break;
            case '&':
                match('&');
                addToken(TokenType.AND);
                break;
            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else if (match('>')) {
                    addToken(TokenType.PIPE);
                } else {
                    addToken(TokenType.OR);
                }
                break;
            case ':':
                if (match(':')) {
                    match(':');
                    addToken(TokenType.NAMESPACE);
                } else if (match('=')) {
                    addToken(TokenType.LEFT_ASSIGN);
                } else {
                    addToken(TokenType.COLON);
                }
                break;
            case '*':
                if (match('*')) {
                    // R reads ** as ^
                    addToken(TokenType.CARET, "^");
                } else {
                    addToken(TokenType.STAR);
                }
                break;
            case '+': addToken(TokenType.PLUS); break;
            case '/': addToken(TokenType.SLASH); break;
            case '^': addToken(TokenType.CARET); break;
            case '~': addToken(TokenType.TILDE); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '$': addToken(TokenType.DOLLAR); break;
            case '@': addToken(TokenType.AT); break;
            case '\\': addToken(TokenType.LAMBDA); break;
            case '%': special(); break;
            default:
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    number(c);
                } else if (isIdentifierStart(c)) {
                    if ((c == 'r' || c == 'R') && (peek() == '"' || peek() == '\'')) {
                        rawString();
                    } else {
                        identifier();
                    }
                } else {
                    throw error("Unexpected character");
                }
        }
    }

    private void comment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
        addToken(TokenType.COMMENT);
    }

    private void string(char quote) {
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\') {
                advance();
                if (!isAtEnd()) {
                    advance();
                }
            } else {
                advance();
            }
        }
        if (isAtEnd()) {
            throw error("Unterminated string");
        }
        advance();
        addToken(TokenType.STRING);
    }

    private void rawString() {
        char quote = advance();
        int dashes = 0;
        while (peek() == '-') {
            advance();
            dashes++;
        }
        char open = isAtEnd() ? '\0' : advance();
        char close;
        switch (open) {
            case '(': close = ')'; break;
            case '[': close = ']'; break;
            case '{': close = '}'; break;
            default: throw error("Malformed raw string literal");
        }
        while (!isAtEnd()) {
            char ch = advance();
            if (ch == close && closesRawString(dashes, quote)) {
                current += dashes + 1;
                addToken(TokenType.STRING);
                return;
            }
        }
        throw error("Unterminated raw string");
    }

    private boolean closesRawString(int dashes, char quote) {
        for (int i = 0; i < dashes; i++) {
            if (current + i >= source.length() || source.charAt(current + i) != '-') {
                return false;
            }
        }
        return current + dashes < source.length() && source.charAt(current + dashes) == quote;
    }

    private void backtick() {
        while (!isAtEnd() && peek() != '`') {
            if (peek() == '\\') {
                advance();
            }
            if (!isAtEnd()) {
                advance();
            }
        }
        if (isAtEnd()) {
            throw error("Unterminated backtick name");
        }
        advance();
        addToken(TokenType.SYMBOL);
    }

    private void special() {
        while (peek() != '%') {
            if (isAtEnd() || peek() == '\n') {
                throw error("Unterminated %operator%");
            }
            advance();
        }
        advance();
        addToken(TokenType.SPECIAL);
    }

    private void number(char first) {
        if (first == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            while (isHexDigit(peek())) {
                advance();
            }
            // binary exponent: 0x1p3, 0x1.8p-2
            if (peek() == '.' && (isHexDigit(peekNext()) || peekNext() == 'p' || peekNext() == 'P')) {
                advance();
                while (isHexDigit(peek())) {
                    advance();
                }
                if (peek() != 'p' && peek() != 'P') {
                    throw error("Hexadecimal fraction needs a 'p' exponent");
                }
            }
            if (peek() == 'p' || peek() == 'P') {
                advance();
                if (peek() == '+' || peek() == '-') {
                    advance();
                }
                if (!isDigit(peek())) {
                    throw error("Malformed number exponent");
                }
                while (isDigit(peek())) {
                    advance();
                }
            }
        } else {
            while (isDigit(peek())) {
                advance();
            }
            if (first != '.' && peek() == '.') {
                advance();
                while (isDigit(peek())) {
                    advance();
                }
            }
            if (peek() == 'e' || peek() == 'E') {
                advance();
                if (peek() == '+' || peek() == '-') {
                    advance();
                }
                if (!isDigit(peek())) {
                    throw error("Malformed number exponent");
                }
                while (isDigit(peek())) {
                    advance();
                }
            }
        }
        if (peek() == 'L' || peek() == 'i') {
            advance();
        }
        addToken(TokenType.NUMBER);
    }

    private void identifier() {
        while (isIdentifierPart(peek())) {
            advance();
        }
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.SYMBOL));
    }

    // ============ helpers ============

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            lineStart = current;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) {
            return false;
        }
        current++;
        return true;
    }

    private void addToken(TokenType type) {
        addToken(type, source.substring(start, current));
    }

    private void addToken(TokenType type, String lexeme) {
        int endLine = type == TokenType.NEWLINE ? startLine : line;
        tokens.add(new Token(type, lexeme, startLine, startColumn, start, endLine));
    }

    private ParseException error(String message) {
        String found = source.substring(start, Math.min(current, source.length()));
        return new ParseException(message, startLine, startColumn, found);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '.' || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '.' || c == '_';
    }
}
