package com.rtidy.plugins.r.ast;

import java.util.List;

/**
 * Braced sequence of statements.
 */
public class BlockNode extends RNode {
    private final List<RNode> statements;

    public BlockNode(int line, List<RNode> statements) {
        super(line);
        this.statements = List.copyOf(statements);
    }

    public List<RNode> getStatements() {
        return statements;
    }

    @Override
    public <R> R accept(RNodeVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
