package com.rtidy.plugins.r.ast;

import java.util.List;

/**
 * Subsetting {@code x[i, j]} or {@code x[[i]]}.
 */
public class IndexNode extends RNode {
    private final RNode target;
    private final List<Argument> arguments;
    private final boolean doubleBracket;

    public IndexNode(int line, RNode target, List<Argument> arguments, boolean doubleBracket) {
        super(line);
        this.target = target;
        this.arguments = List.copyOf(arguments);
        this.doubleBracket = doubleBracket;
    }

    public RNode getTarget() {
        return target;
    }

    public List<Argument> getArguments() {
        return arguments;
    }

    public boolean isDoubleBracket() {
        return doubleBracket;
    }

    @Override
    public <R> R accept(RNodeVisitor<R> visitor) {
        return visitor.visitIndex(this);
    }
}
