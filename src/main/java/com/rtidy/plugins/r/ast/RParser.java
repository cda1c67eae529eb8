package com.rtidy.plugins.r.ast;

import com.rtidy.api.error.ParseException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Pratt parser for R. Newlines end a statement at top level and inside
 * braces, and are insignificant inside parentheses and brackets. An
 * {@code else} may follow its {@code if} branch after any number of
 * newlines, at every nesting level.
 */
public class RParser {
    private static final int PREC_QUESTION = 10;
    private static final int PREC_EQ_ASSIGN = 20;
    private static final int PREC_LEFT_ASSIGN = 30;
    private static final int PREC_RIGHT_ASSIGN = 40;
    private static final int PREC_TILDE = 50;
    private static final int PREC_OR = 60;
    private static final int PREC_AND = 70;
    private static final int PREC_NOT = 80;
    private static final int PREC_COMPARE = 90;
    private static final int PREC_ADD = 100;
    private static final int PREC_MULTIPLY = 110;
    private static final int PREC_SPECIAL = 120;
    private static final int PREC_COLON = 130;
    private static final int PREC_UNARY = 140;
    private static final int PREC_CARET = 150;
    private static final int PREC_POSTFIX = 160;
    private static final int PREC_NAMESPACE = 170;

    private final List<Token> tokens;
    private int pos = 0;

    // true while inside ( or [, false inside { and at top level
    private final Deque<Boolean> newlinesIgnored = new ArrayDeque<>();

    public RParser(List<Token> tokens) {
        this.tokens = tokens.stream()
                .filter(t -> t.getType() != TokenType.COMMENT)
                .collect(Collectors.toList());
        newlinesIgnored.push(false);
    }

    /**
     * Lexes and parses a whole program.
     */
    public static List<RNode> parse(String source) {
        return new RParser(new RLexer(source).scanTokens()).parseProgram();
    }

    /**
     * Parses the token stream into its top-level expressions, in order.
     */
    public List<RNode> parseProgram() {
        List<RNode> expressions = new ArrayList<>();
        skipSeparators();
        while (!check(TokenType.EOF)) {
            expressions.add(parseExpression(0));
            if (!check(TokenType.EOF) && !isSeparator(rawPeek())) {
                throw error("Unexpected token", peek());
            }
            skipSeparators();
        }
        return expressions;
    }

    // ============ expressions ============

    private RNode parseExpression(int minPrecedence) {
        RNode left = parsePrefix();
        while (true) {
            Token op = peek();
            int precedence = infixPrecedence(op.getType());
            if (precedence < 0 || precedence < minPrecedence) {
                break;
            }
            left = parseInfix(left, op, precedence);
        }
        return left;
    }

    private RNode parsePrefix() {
        Token t = advance();
        switch (t.getType()) {
            case NUMBER:
            case STRING:
            case CONSTANT:
            case BREAK:
            case NEXT:
                return new ConstantNode(t.getLine(), t.getLexeme());
            case SYMBOL:
                return new SymbolNode(t.getLine(), t.getLexeme());
            case MINUS:
            case PLUS:
                return unary(t, PREC_UNARY);
            case NOT:
                return unary(t, PREC_NOT);
            case TILDE:
                return unary(t, PREC_TILDE);
            case QUESTION:
                return unary(t, PREC_QUESTION + 1);
            case LPAREN: {
                newlinesIgnored.push(true);
                RNode inner = parseExpression(0);
                expect(TokenType.RPAREN, "')'");
                newlinesIgnored.pop();
                return new ParenNode(t.getLine(), inner);
            }
            case LBRACE:
                return parseBlock(t);
            case IF:
                return parseIf(t);
            case FOR:
                return parseFor(t);
            case WHILE:
                return parseWhile(t);
            case REPEAT:
                skipNewlines();
                return new RepeatNode(t.getLine(), parseExpression(0));
            case FUNCTION:
                return parseFunction(t, false);
            case LAMBDA:
                return parseFunction(t, true);
            default:
                throw error("Unexpected token", t);
        }
    }

    private RNode unary(Token op, int operandPrecedence) {
        skipNewlines();
        return new UnaryNode(op.getLine(), op.getLexeme(), parseExpression(operandPrecedence));
    }

    private RNode parseInfix(RNode left, Token op, int precedence) {
        switch (op.getType()) {
            case LPAREN:
                advance();
                return new CallNode(left.getLine(), left, parseArguments(false));
            case LBRACKET:
                advance();
                return new IndexNode(left.getLine(), left, parseArguments(false), false);
            case DOUBLE_LBRACKET:
                advance();
                return new IndexNode(left.getLine(), left, parseArguments(true), true);
            case DOLLAR:
            case AT:
            case NAMESPACE: {
                advance();
                Token name = advance();
                RNode member;
                if (name.is(TokenType.SYMBOL)) {
                    member = new SymbolNode(name.getLine(), name.getLexeme());
                } else if (name.isOneOf(TokenType.STRING, TokenType.CONSTANT)) {
                    member = new ConstantNode(name.getLine(), name.getLexeme());
                } else {
                    throw error("Expected a name after '" + op.getLexeme() + "'", name);
                }
                return new BinaryNode(left.getLine(), op.getLexeme(), left, member);
            }
            default: {
                advance();
                skipNewlines();
                int next = isRightAssociative(op.getType()) ? precedence : precedence + 1;
                RNode right = parseExpression(next);
                return new BinaryNode(left.getLine(), op.getLexeme(), left, right);
            }
        }
    }

    private static int infixPrecedence(TokenType type) {
        return switch (type) {
            case QUESTION -> PREC_QUESTION;
            case EQ_ASSIGN -> PREC_EQ_ASSIGN;
            case LEFT_ASSIGN -> PREC_LEFT_ASSIGN;
            case RIGHT_ASSIGN -> PREC_RIGHT_ASSIGN;
            case TILDE -> PREC_TILDE;
            case OR -> PREC_OR;
            case AND -> PREC_AND;
            case COMPARE -> PREC_COMPARE;
            case PLUS, MINUS -> PREC_ADD;
            case STAR, SLASH -> PREC_MULTIPLY;
            case SPECIAL, PIPE -> PREC_SPECIAL;
            case COLON -> PREC_COLON;
            case CARET -> PREC_CARET;
            case LPAREN, LBRACKET, DOUBLE_LBRACKET, DOLLAR, AT -> PREC_POSTFIX;
            case NAMESPACE -> PREC_NAMESPACE;
            default -> -1;
        };
    }

    private static boolean isRightAssociative(TokenType type) {
        return type == TokenType.EQ_ASSIGN || type == TokenType.LEFT_ASSIGN || type == TokenType.CARET;
    }

    // ============ compound forms ============

    private RNode parseBlock(Token open) {
        newlinesIgnored.push(false);
        List<RNode> statements = new ArrayList<>();
        skipSeparators();
        while (!check(TokenType.RBRACE)) {
            if (check(TokenType.EOF)) {
                throw error("Missing '}' for block opened at line " + open.getLine(), peek());
            }
            statements.add(parseExpression(0));
            if (!check(TokenType.RBRACE) && !isSeparator(rawPeek())) {
                throw error("Unexpected token", peek());
            }
            skipSeparators();
        }
        advance();
        newlinesIgnored.pop();
        return new BlockNode(open.getLine(), statements);
    }

    private RNode parseIf(Token keyword) {
        RNode condition = parseHeader("if");
        skipNewlines();
        RNode thenBranch = parseExpression(0);

        RNode elseBranch = null;
        int mark = pos;
        skipNewlines();
        if (check(TokenType.ELSE)) {
            advance();
            skipNewlines();
            elseBranch = parseExpression(0);
        } else {
            pos = mark;
        }
        return new IfNode(keyword.getLine(), condition, thenBranch, elseBranch);
    }

    private RNode parseFor(Token keyword) {
        expect(TokenType.LPAREN, "'(' after 'for'");
        newlinesIgnored.push(true);
        Token variable = expect(TokenType.SYMBOL, "loop variable");
        expect(TokenType.IN, "'in'");
        RNode sequence = parseExpression(0);
        expect(TokenType.RPAREN, "')'");
        newlinesIgnored.pop();
        skipNewlines();
        return new ForNode(keyword.getLine(), variable.getLexeme(), sequence, parseExpression(0));
    }

    private RNode parseWhile(Token keyword) {
        RNode condition = parseHeader("while");
        skipNewlines();
        return new WhileNode(keyword.getLine(), condition, parseExpression(0));
    }

    private RNode parseHeader(String keyword) {
        expect(TokenType.LPAREN, "'(' after '" + keyword + "'");
        newlinesIgnored.push(true);
        RNode condition = parseExpression(0);
        expect(TokenType.RPAREN, "')'");
        newlinesIgnored.pop();
        return condition;
    }

    private RNode parseFunction(Token keyword, boolean lambda) {
        expect(TokenType.LPAREN, "'(' after '" + keyword.getLexeme() + "'");
        newlinesIgnored.push(true);
        List<Formal> formals = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                Token name = expect(TokenType.SYMBOL, "parameter name");
                RNode defaultValue = null;
                if (match(TokenType.EQ_ASSIGN)) {
                    defaultValue = parseExpression(0);
                }
                formals.add(new Formal(name.getLexeme(), defaultValue));
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RPAREN, "')'");
        newlinesIgnored.pop();
        skipNewlines();
        return new FunctionNode(keyword.getLine(), lambda, formals, parseExpression(0));
    }

    /**
     * Parses an argument list after its opening bracket, through the
     * closing bracket(s).
     */
    private List<Argument> parseArguments(boolean doubleBracket) {
        TokenType close = doubleBracket ? TokenType.RBRACKET
                : (previous().is(TokenType.LPAREN) ? TokenType.RPAREN : TokenType.RBRACKET);
        String closeText = close == TokenType.RPAREN ? "')'" : "']'";
        newlinesIgnored.push(true);
        List<Argument> arguments = new ArrayList<>();
        if (check(close)) {
            advance();
        } else {
            while (true) {
                arguments.add(parseArgument(close));
                if (match(TokenType.COMMA)) {
                    continue;
                }
                expect(close, closeText);
                break;
            }
        }
        if (doubleBracket) {
            expect(TokenType.RBRACKET, "']]'");
        }
        newlinesIgnored.pop();
        return arguments;
    }

    private Argument parseArgument(TokenType close) {
        Token t = peek();
        if (t.is(TokenType.COMMA) || t.is(close)) {
            return Argument.empty();
        }
        if (t.isOneOf(TokenType.SYMBOL, TokenType.STRING, TokenType.CONSTANT)
                && peekNext().is(TokenType.EQ_ASSIGN)) {
            advance();
            advance();
            if (check(TokenType.COMMA) || check(close)) {
                return new Argument(t.getLexeme(), null);
            }
            return new Argument(t.getLexeme(), parseExpression(0));
        }
        return Argument.positional(parseExpression(0));
    }

    // ============ token stream ============

    private Token peek() {
        if (newlinesIgnored.peek()) {
            skipNewlines();
        }
        return tokens.get(pos);
    }

    private Token rawPeek() {
        return tokens.get(pos);
    }

    private Token peekNext() {
        int i = pos + 1;
        while (i < tokens.size() - 1 && tokens.get(i).is(TokenType.NEWLINE)) {
            i++;
        }
        return tokens.get(Math.min(i, tokens.size() - 1));
    }

    private Token previous() {
        return tokens.get(pos - 1);
    }

    private Token advance() {
        Token t = peek();
        if (t.is(TokenType.EOF)) {
            throw error("Unexpected end of input", t);
        }
        pos++;
        return t;
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String what) {
        Token t = peek();
        if (!t.is(type)) {
            throw error("Expected " + what, t);
        }
        return advance();
    }

    private void skipNewlines() {
        while (tokens.get(pos).is(TokenType.NEWLINE)) {
            pos++;
        }
    }

    private void skipSeparators() {
        while (tokens.get(pos).isOneOf(TokenType.NEWLINE, TokenType.SEMICOLON)) {
            pos++;
        }
    }

    private static boolean isSeparator(Token t) {
        return t.isOneOf(TokenType.NEWLINE, TokenType.SEMICOLON);
    }

    private static ParseException error(String message, Token t) {
        String found = switch (t.getType()) {
            case EOF -> "end of input";
            case NEWLINE -> "newline";
            default -> t.getLexeme();
        };
        return new ParseException(message, t.getLine(), t.getColumn(), found);
    }
}
