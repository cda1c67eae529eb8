package com.rtidy.plugins.r;

import com.rtidy.api.error.MaskingException;
import com.rtidy.plugins.r.ast.RLexer;
import com.rtidy.plugins.r.ast.Token;
import com.rtidy.plugins.r.ast.TokenType;
import com.rtidy.util.LoggerUtil;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Rewrites comments (and, optionally, interior blank lines) into
 * placeholder expressions the parser keeps in the tree.
 *
 * <p>The masked text has exactly as many lines as the input, so parse
 * errors point at input lines. Where a comment lands depends on the code
 * token before it:
 * <ul>
 *   <li>a comment alone on its line at a statement position becomes a
 *       standalone placeholder statement;</li>
 *   <li>a comment after a token that ends an expression becomes an inline
 *       marker operand on that expression;</li>
 *   <li>a comment after {@code ,} or {@code ;} rides on the expression
 *       before the separator;</li>
 *   <li>a comment after {@code {} becomes the first statement of the block;</li>
 *   <li>anything else is deferred to the next line of code.</li>
 * </ul>
 * A comment or blank line directly before {@code else} is attached to the
 * previous code line instead, so no statement splits the if/else.
 */
public class CommentMasker {
    private static final Logger logger = LoggerUtil.getLogger(CommentMasker.class);

    private enum Bracket { PAREN, HEADER, BRACKET, BRACE }

    private final boolean maskBlankLines;

    public CommentMasker(boolean maskBlankLines) {
        this.maskBlankLines = maskBlankLines;
    }

    /**
     * Masks the given physical lines.
     *
     * @throws MaskingException if a comment contains placeholder text, or
     *                          a deferred comment has no code after it
     * @throws com.rtidy.api.error.ParseException if the text cannot be lexed
     */
    public MaskedSource mask(List<String> lines) {
        List<Token> tokens = new RLexer(String.join("\n", lines)).scanTokens();
        MaskedSource masked = new Pass(lines, tokens).run();
        logger.fine(() -> "Masked " + masked.getRecords().size() + " comments and blank lines");
        return masked;
    }

    private final class Pass {
        private final List<String> lines;
        private final List<Token> tokens;
        private int next = 0;

        private final Deque<Bracket> brackets = new ArrayDeque<>();
        private Token lastCode;
        private boolean lastCodeEnds;
        private boolean codeBeforeLastEnds;

        private int stringStartLine = 0;
        private int stringEndLine = 0;

        private int firstContentLine = Integer.MAX_VALUE;
        private int lastContentLine = 0;

        private final List<String> out = new ArrayList<>();
        private int lastCodeOutIndex = -1;
        private final List<CommentRecord> records = new ArrayList<>();
        private final List<CommentRecord> pending = new ArrayList<>();

        Pass(List<String> lines, List<Token> tokens) {
            this.lines = lines;
            this.tokens = tokens;
            for (Token t : tokens) {
                if (!t.isOneOf(TokenType.NEWLINE, TokenType.EOF)) {
                    firstContentLine = Math.min(firstContentLine, t.getLine());
                    lastContentLine = Math.max(lastContentLine, t.getEndLine());
                }
            }
        }

        MaskedSource run() {
            for (int line = 1; line <= lines.size(); line++) {
                maskLine(line, lines.get(line - 1));
            }
            if (!pending.isEmpty()) {
                throw new MaskingException("Comment has no code after it to attach to",
                        pending.get(0).getLine());
            }
            return new MaskedSource(String.join("\n", out), records);
        }

        private void maskLine(int line, String text) {
            boolean insideString = line > stringStartLine && line <= stringEndLine;
            Token comment = null;
            List<Token> code = new ArrayList<>();
            while (next < tokens.size() && tokens.get(next).getLine() == line) {
                Token t = tokens.get(next++);
                if (t.is(TokenType.COMMENT)) {
                    comment = t;
                } else if (!t.isOneOf(TokenType.NEWLINE, TokenType.EOF)) {
                    code.add(t);
                }
            }

            if (code.isEmpty() && !insideString) {
                if (comment == null) {
                    maskBlankLine(line, text);
                } else {
                    maskStandaloneComment(line, text, comment);
                }
                return;
            }

            for (Token t : code) {
                track(t);
            }
            maskCodeLine(line, text, comment, code);
        }

        private void maskBlankLine(int line, String text) {
            if (maskBlankLines && line > firstContentLine && line < lastContentLine
                    && atStatementPosition() && !nextCodeToken().is(TokenType.ELSE)) {
                out.add(leadingWhitespace(text) + Placeholders.blank());
                records.add(new CommentRecord(CommentRecord.Kind.BLANK, "", line));
            } else {
                out.add(text);
            }
        }

        private void maskStandaloneComment(int line, String text, Token comment) {
            String raw = checked(comment);
            if (nextCodeToken().is(TokenType.ELSE) && lastCodeEnds && lastCodeOutIndex >= 0) {
                out.set(lastCodeOutIndex, out.get(lastCodeOutIndex) + Placeholders.inline(Placeholders.escape(raw)));
                records.add(new CommentRecord(CommentRecord.Kind.INLINE, raw, line));
                out.add("");
            } else if (atStatementPosition()) {
                out.add(leadingWhitespace(text) + Placeholders.standalone(Placeholders.escape(raw)));
                records.add(new CommentRecord(CommentRecord.Kind.STANDALONE, raw, line));
            } else {
                pending.add(new CommentRecord(CommentRecord.Kind.INLINE, raw, line));
                out.add("");
            }
        }

        private void maskCodeLine(int line, String text, Token comment, List<Token> code) {
            List<CommentRecord> trailing = new ArrayList<>(pending);
            pending.clear();
            String codeText = text;
            if (comment != null) {
                trailing.add(new CommentRecord(CommentRecord.Kind.INLINE, checked(comment), line));
                codeText = stripTrailing(text.substring(0, comment.getColumn() - 1));
            }
            lastCodeOutIndex = out.size();
            Token last = code.isEmpty() ? lastCode : code.get(code.size() - 1);
            if (trailing.isEmpty() || last.getEndLine() > line) {
                // nothing to place, or the line ends inside a string
                pending.addAll(trailing);
                out.add(text);
                return;
            }

            if (lastCodeEnds) {
                out.add(codeText + inlineMarkers(trailing));
                records.addAll(trailing);
            } else if (last.is(TokenType.LBRACE)) {
                List<String> placeholders = new ArrayList<>();
                for (CommentRecord record : trailing) {
                    placeholders.add(Placeholders.braceTrailing(record.getEscapedPayload()));
                    records.add(new CommentRecord(CommentRecord.Kind.BRACE_TRAILING, record.getRawText(), record.getLine()));
                }
                out.add(codeText + " " + String.join("; ", placeholders));
            } else if (last.isOneOf(TokenType.COMMA, TokenType.SEMICOLON) && codeBeforeLastEnds) {
                int cut = last.getColumn() - 1;
                out.add(stripTrailing(codeText.substring(0, cut)) + inlineMarkers(trailing) + codeText.substring(cut));
                records.addAll(trailing);
            } else {
                pending.addAll(trailing);
                out.add(codeText);
            }
        }

        private void track(Token t) {
            boolean ends;
            switch (t.getType()) {
                case LPAREN:
                    brackets.push(lastCode != null && lastCode.isOneOf(TokenType.IF, TokenType.FOR,
                            TokenType.WHILE, TokenType.FUNCTION, TokenType.LAMBDA) ? Bracket.HEADER : Bracket.PAREN);
                    ends = false;
                    break;
                case LBRACKET:
                    brackets.push(Bracket.BRACKET);
                    ends = false;
                    break;
                case DOUBLE_LBRACKET:
                    brackets.push(Bracket.BRACKET);
                    brackets.push(Bracket.BRACKET);
                    ends = false;
                    break;
                case LBRACE:
                    brackets.push(Bracket.BRACE);
                    ends = false;
                    break;
                case RPAREN:
                    ends = brackets.poll() != Bracket.HEADER;
                    break;
                case RBRACKET:
                case RBRACE:
                    brackets.poll();
                    ends = true;
                    break;
                default:
                    ends = t.getType().endsExpression();
            }
            codeBeforeLastEnds = lastCodeEnds;
            lastCode = t;
            lastCodeEnds = ends;
            if (t.getEndLine() > t.getLine()) {
                stringStartLine = t.getLine();
                stringEndLine = t.getEndLine();
            }
        }

        private boolean atStatementPosition() {
            Bracket top = brackets.peek();
            if (top != null && top != Bracket.BRACE) {
                return false;
            }
            return lastCode == null || lastCodeEnds || lastCode.isOneOf(TokenType.LBRACE, TokenType.SEMICOLON);
        }

        private Token nextCodeToken() {
            for (int i = next; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                if (!t.isOneOf(TokenType.NEWLINE, TokenType.COMMENT)) {
                    return t;
                }
            }
            return tokens.get(tokens.size() - 1);
        }

        private String checked(Token comment) {
            String raw = comment.getLexeme();
            if (Placeholders.containsSentinel(raw)) {
                throw new MaskingException("Comment contains reserved placeholder text", comment.getLine());
            }
            return raw;
        }
    }

    private static String inlineMarkers(List<CommentRecord> comments) {
        return comments.stream()
                .map(c -> Placeholders.inline(c.getEscapedPayload()))
                .collect(Collectors.joining());
    }

    private static String leadingWhitespace(String text) {
        int i = 0;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return text.substring(0, i);
    }

    private static String stripTrailing(String text) {
        int end = text.length();
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
