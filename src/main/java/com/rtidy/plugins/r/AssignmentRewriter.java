package com.rtidy.plugins.r;

import com.rtidy.plugins.r.ast.BinaryNode;
import com.rtidy.plugins.r.ast.RNode;
import com.rtidy.plugins.r.ast.RNodeTransformer;

/**
 * Rewrites {@code =} assignments to {@code <-}. Named arguments and formal
 * defaults are not binary nodes, so they keep their {@code =}.
 */
public class AssignmentRewriter extends RNodeTransformer {

    public RNode rewrite(RNode tree) {
        return transform(tree);
    }

    @Override
    public RNode visitBinary(BinaryNode node) {
        String operator = "=".equals(node.getOperator()) ? "<-" : node.getOperator();
        return new BinaryNode(node.getLine(), operator, transform(node.getLeft()), transform(node.getRight()));
    }
}
