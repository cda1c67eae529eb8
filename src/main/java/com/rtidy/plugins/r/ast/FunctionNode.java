package com.rtidy.plugins.r.ast;

import java.util.List;

/**
 * Function literal, written {@code function(x) body} or {@code \(x) body}.
 */
public class FunctionNode extends RNode {
    private final boolean lambda;
    private final List<Formal> formals;
    private final RNode body;

    public FunctionNode(int line, boolean lambda, List<Formal> formals, RNode body) {
        super(line);
        this.lambda = lambda;
        this.formals = List.copyOf(formals);
        this.body = body;
    }

    public boolean isLambda() {
        return lambda;
    }

    public List<Formal> getFormals() {
        return formals;
    }

    public RNode getBody() {
        return body;
    }

    @Override
    public <R> R accept(RNodeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
