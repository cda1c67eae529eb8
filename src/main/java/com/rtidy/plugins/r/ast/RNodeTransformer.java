package com.rtidy.plugins.r.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a tree bottom-up. Subclasses override the visit methods for the
 * nodes they rewrite and delegate the rest here.
 */
public class RNodeTransformer implements RNodeVisitor<RNode> {

    public RNode transform(RNode node) {
        return node == null ? null : node.accept(this);
    }

    @Override
    public RNode visitSymbol(SymbolNode node) {
        return node;
    }

    @Override
    public RNode visitConstant(ConstantNode node) {
        return node;
    }

    @Override
    public RNode visitCall(CallNode node) {
        return new CallNode(node.getLine(), transform(node.getFunction()), transformArguments(node.getArguments()));
    }

    @Override
    public RNode visitIndex(IndexNode node) {
        return new IndexNode(node.getLine(), transform(node.getTarget()),
                transformArguments(node.getArguments()), node.isDoubleBracket());
    }

    @Override
    public RNode visitBinary(BinaryNode node) {
        return new BinaryNode(node.getLine(), node.getOperator(),
                transform(node.getLeft()), transform(node.getRight()));
    }

    @Override
    public RNode visitUnary(UnaryNode node) {
        return new UnaryNode(node.getLine(), node.getOperator(), transform(node.getOperand()));
    }

    @Override
    public RNode visitParen(ParenNode node) {
        return new ParenNode(node.getLine(), transform(node.getInner()));
    }

    @Override
    public RNode visitBlock(BlockNode node) {
        List<RNode> statements = new ArrayList<>();
        for (RNode statement : node.getStatements()) {
            statements.add(transform(statement));
        }
        return new BlockNode(node.getLine(), statements);
    }

    @Override
    public RNode visitIf(IfNode node) {
        return new IfNode(node.getLine(), transform(node.getCondition()),
                transform(node.getThenBranch()), transform(node.getElseBranch()));
    }

    @Override
    public RNode visitFor(ForNode node) {
        return new ForNode(node.getLine(), node.getVariable(),
                transform(node.getSequence()), transform(node.getBody()));
    }

    @Override
    public RNode visitWhile(WhileNode node) {
        return new WhileNode(node.getLine(), transform(node.getCondition()), transform(node.getBody()));
    }

    @Override
    public RNode visitRepeat(RepeatNode node) {
        return new RepeatNode(node.getLine(), transform(node.getBody()));
    }

    @Override
    public RNode visitFunction(FunctionNode node) {
        List<Formal> formals = new ArrayList<>();
        for (Formal formal : node.getFormals()) {
            formals.add(formal.withDefault(transform(formal.getDefaultValue())));
        }
        return new FunctionNode(node.getLine(), node.isLambda(), formals, transform(node.getBody()));
    }

    private List<Argument> transformArguments(List<Argument> arguments) {
        List<Argument> result = new ArrayList<>();
        for (Argument argument : arguments) {
            result.add(argument.withValue(transform(argument.getValue())));
        }
        return result;
    }
}
