package com.rtidy.plugins.r.ast;

/**
 * A name, including backtick-quoted names, {@code ...} and {@code ..1}.
 */
public class SymbolNode extends RNode {
    private final String name;

    public SymbolNode(int line, String name) {
        super(line);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(RNodeVisitor<R> visitor) {
        return visitor.visitSymbol(this);
    }
}
