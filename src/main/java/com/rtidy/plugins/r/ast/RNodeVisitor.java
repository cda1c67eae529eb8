package com.rtidy.plugins.r.ast;

/**
 * Visitor over {@link RNode} trees.
 */
public interface RNodeVisitor<R> {

    R visitSymbol(SymbolNode node);

    R visitConstant(ConstantNode node);

    R visitCall(CallNode node);

    R visitIndex(IndexNode node);

    R visitBinary(BinaryNode node);

    R visitUnary(UnaryNode node);

    R visitParen(ParenNode node);

    R visitBlock(BlockNode node);

    R visitIf(IfNode node);

    R visitFor(ForNode node);

    R visitWhile(WhileNode node);

    R visitRepeat(RepeatNode node);

    R visitFunction(FunctionNode node);
}
