package com.rtidy.plugins.r.ast;

import java.util.List;

/**
 * {@link AstEngine} backed by {@link RParser} and {@link Deparser}.
 */
public class RAstEngine implements AstEngine {

    @Override
    public List<RNode> parse(String text) {
        return RParser.parse(text);
    }

    @Override
    public String render(RNode tree, int width) {
        return Deparser.render(tree, width);
    }
}
