package com.rtidy.plugins.r.ast;

/**
 * Binary operation, including assignments ({@code <-}, {@code =},
 * {@code ->}), member access ({@code $}, {@code @}) and namespace access
 * ({@code ::}).
 */
public class BinaryNode extends RNode {
    private final String operator;
    private final RNode left;
    private final RNode right;

    public BinaryNode(int line, String operator, RNode left, RNode right) {
        super(line);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public String getOperator() {
        return operator;
    }

    public RNode getLeft() {
        return left;
    }

    public RNode getRight() {
        return right;
    }

    public boolean isAssignment() {
        return switch (operator) {
            case "<-", "<<-", "=", "->", "->>", ":=" -> true;
            default -> false;
        };
    }

    @Override
    public <R> R accept(RNodeVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
