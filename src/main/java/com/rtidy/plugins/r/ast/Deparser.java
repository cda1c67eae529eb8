package com.rtidy.plugins.r.ast;

import java.util.List;
import java.util.Set;

/**
 * Renders an {@link RNode} tree back to canonical R text.
 *
 * <p>Binary operators are surrounded by single spaces except the tight
 * ones ({@code ^ : $ @ :: :::}). Braces always span lines. Once a line has
 * reached the width, the next argument or right operand starts a new line.
 * Strings and numbers are written exactly as they were lexed.
 */
public class Deparser implements RNodeVisitor<Void> {
    private static final Set<String> TIGHT_OPERATORS = Set.of("^", ":", "$", "@", "::", ":::");

    private final DeparseContext ctx;

    public Deparser(int width) {
        this.ctx = new DeparseContext(width);
    }

    public static String render(RNode node, int width) {
        Deparser deparser = new Deparser(width);
        node.accept(deparser);
        return deparser.ctx.getOutput();
    }

    @Override
    public Void visitSymbol(SymbolNode node) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitConstant(ConstantNode node) {
        ctx.append(node.getText());
        return null;
    }

    @Override
    public Void visitCall(CallNode node) {
        node.getFunction().accept(this);
        ctx.open("(");
        writeArguments(node.getArguments());
        ctx.close(")");
        return null;
    }

    @Override
    public Void visitIndex(IndexNode node) {
        node.getTarget().accept(this);
        ctx.open(node.isDoubleBracket() ? "[[" : "[");
        writeArguments(node.getArguments());
        ctx.close(node.isDoubleBracket() ? "]]" : "]");
        return null;
    }

    private void writeArguments(List<Argument> arguments) {
        for (int i = 0; i < arguments.size(); i++) {
            Argument argument = arguments.get(i);
            if (i > 0) {
                separate(argument.isEmpty());
            }
            if (argument.isNamed()) {
                ctx.append(argument.getName());
                ctx.append(argument.getValue() == null ? " =" : " = ");
            }
            if (argument.getValue() != null) {
                argument.getValue().accept(this);
            }
        }
    }

    private void separate(boolean nextIsEmpty) {
        ctx.append(",");
        if (!nextIsEmpty && ctx.isOverWidth()) {
            ctx.newLine();
        } else {
            ctx.append(" ");
        }
    }

    @Override
    public Void visitBinary(BinaryNode node) {
        String op = node.getOperator();
        node.getLeft().accept(this);
        if (TIGHT_OPERATORS.contains(op)) {
            ctx.append(op);
        } else {
            ctx.append(" " + op);
            if (!node.isAssignment() && !"?".equals(op) && ctx.isOverWidth()) {
                ctx.continuationLine();
            } else {
                ctx.append(" ");
            }
        }
        node.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitUnary(UnaryNode node) {
        ctx.append(node.getOperator());
        node.getOperand().accept(this);
        return null;
    }

    @Override
    public Void visitParen(ParenNode node) {
        ctx.open("(");
        node.getInner().accept(this);
        ctx.close(")");
        return null;
    }

    @Override
    public Void visitBlock(BlockNode node) {
        ctx.open("{");
        for (RNode statement : node.getStatements()) {
            ctx.newLine();
            statement.accept(this);
        }
        ctx.closeOnNewLine("}");
        return null;
    }

    @Override
    public Void visitIf(IfNode node) {
        ctx.append("if ");
        ctx.open("(");
        node.getCondition().accept(this);
        ctx.close(")");
        ctx.append(" ");
        node.getThenBranch().accept(this);
        if (node.hasElse()) {
            ctx.append(" else ");
            node.getElseBranch().accept(this);
        }
        return null;
    }

    @Override
    public Void visitFor(ForNode node) {
        ctx.append("for ");
        ctx.open("(");
        ctx.append(node.getVariable() + " in ");
        node.getSequence().accept(this);
        ctx.close(")");
        ctx.append(" ");
        node.getBody().accept(this);
        return null;
    }

    @Override
    public Void visitWhile(WhileNode node) {
        ctx.append("while ");
        ctx.open("(");
        node.getCondition().accept(this);
        ctx.close(")");
        ctx.append(" ");
        node.getBody().accept(this);
        return null;
    }

    @Override
    public Void visitRepeat(RepeatNode node) {
        ctx.append("repeat ");
        node.getBody().accept(this);
        return null;
    }

    @Override
    public Void visitFunction(FunctionNode node) {
        ctx.append(node.isLambda() ? "\\" : "function");
        ctx.open("(");
        List<Formal> formals = node.getFormals();
        for (int i = 0; i < formals.size(); i++) {
            if (i > 0) {
                separate(false);
            }
            Formal formal = formals.get(i);
            ctx.append(formal.getName());
            if (formal.hasDefault()) {
                ctx.append(" = ");
                formal.getDefaultValue().accept(this);
            }
        }
        ctx.close(")");
        ctx.append(" ");
        node.getBody().accept(this);
        return null;
    }
}
