package com.rtidy.plugins.r.ast;

/**
 * Number, string, logical/NULL/NA constant, or a {@code break}/{@code next}
 * keyword. The text is kept exactly as written in the source.
 */
public class ConstantNode extends RNode {
    private final String text;

    public ConstantNode(int line, String text) {
        super(line);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public boolean isString() {
        if (text.isEmpty()) {
            return false;
        }
        char c = text.charAt(0);
        return c == '"' || c == '\'' || ((c == 'r' || c == 'R') && text.length() > 1);
    }

    @Override
    public <R> R accept(RNodeVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }
}
