package com.rtidy.plugins.r.ast;

/**
 * {@code while (condition) body}.
 */
public class WhileNode extends RNode {
    private final RNode condition;
    private final RNode body;

    public WhileNode(int line, RNode condition, RNode body) {
        super(line);
        this.condition = condition;
        this.body = body;
    }

    public RNode getCondition() {
        return condition;
    }

    public RNode getBody() {
        return body;
    }

    @Override
    public <R> R accept(RNodeVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }
}
