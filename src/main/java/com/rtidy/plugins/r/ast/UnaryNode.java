package com.rtidy.plugins.r.ast;

/**
 * Prefix operation: {@code -x}, {@code +x}, {@code !x}, {@code ~x}, {@code ?x}.
 */
public class UnaryNode extends RNode {
    private final String operator;
    private final RNode operand;

    public UnaryNode(int line, String operator, RNode operand) {
        super(line);
        this.operator = operator;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }

    public RNode getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(RNodeVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
