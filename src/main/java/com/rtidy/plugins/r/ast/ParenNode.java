package com.rtidy.plugins.r.ast;

/**
 * Parenthesized expression. Kept as a node so rendering never has to invent
 * or drop parentheses.
 */
public class ParenNode extends RNode {
    private final RNode inner;

    public ParenNode(int line, RNode inner) {
        super(line);
        this.inner = inner;
    }

    public RNode getInner() {
        return inner;
    }

    @Override
    public <R> R accept(RNodeVisitor<R> visitor) {
        return visitor.visitParen(this);
    }
}
