package com.rtidy.plugins.r.ast;

/**
 * {@code repeat body}.
 */
public class RepeatNode extends RNode {
    private final RNode body;

    public RepeatNode(int line, RNode body) {
        super(line);
        this.body = body;
    }

    public RNode getBody() {
        return body;
    }

    @Override
    public <R> R accept(RNodeVisitor<R> visitor) {
        return visitor.visitRepeat(this);
    }
}
