package com.rtidy.plugins.r.ast;

/**
 * Base class of the R expression tree. Nodes are immutable; transforms build
 * new trees.
 */
public abstract class RNode {
    private final int line;

    protected RNode(int line) {
        this.line = line;
    }

    /**
     * Source line the node starts on, or 0 for synthesized nodes.
     */
    public int getLine() {
        return line;
    }

    public abstract <R> R accept(RNodeVisitor<R> visitor);
}
