package com.rtidy.plugins.r.ast;

/**
 * {@code if (condition) thenBranch else elseBranch}; the else branch may be null.
 */
public class IfNode extends RNode {
    private final RNode condition;
    private final RNode thenBranch;
    private final RNode elseBranch;

    public IfNode(int line, RNode condition, RNode thenBranch, RNode elseBranch) {
        super(line);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public RNode getCondition() {
        return condition;
    }

    public RNode getThenBranch() {
        return thenBranch;
    }

    public RNode getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R> R accept(RNodeVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
