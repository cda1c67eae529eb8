package com.rtidy.plugins.r.ast;

import java.util.List;

/**
 * Function call {@code f(a, b = 1)}.
 */
public class CallNode extends RNode {
    private final RNode function;
    private final List<Argument> arguments;

    public CallNode(int line, RNode function, List<Argument> arguments) {
        super(line);
        this.function = function;
        this.arguments = List.copyOf(arguments);
    }

    public RNode getFunction() {
        return function;
    }

    public List<Argument> getArguments() {
        return arguments;
    }

    /**
     * Name of the called function when it is a plain symbol, else null.
     */
    public String getFunctionName() {
        return function instanceof SymbolNode ? ((SymbolNode) function).getName() : null;
    }

    @Override
    public <R> R accept(RNodeVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
