package com.rtidy.plugins.r.ast;

/**
 * {@code for (variable in sequence) body}.
 */
public class ForNode extends RNode {
    private final String variable;
    private final RNode sequence;
    private final RNode body;

    public ForNode(int line, String variable, RNode sequence, RNode body) {
        super(line);
        this.variable = variable;
        this.sequence = sequence;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public RNode getSequence() {
        return sequence;
    }

    public RNode getBody() {
        return body;
    }

    @Override
    public <R> R accept(RNodeVisitor<R> visitor) {
        return visitor.visitFor(this);
    }
}
