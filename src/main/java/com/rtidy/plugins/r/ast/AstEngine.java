package com.rtidy.plugins.r.ast;

import java.util.List;

/**
 * Parses R programs into expression trees and renders trees back to text.
 */
public interface AstEngine {

    /**
     * Parses one program into its top-level expressions.
     *
     * @throws com.rtidy.api.error.ParseException if the text is not valid R
     */
    List<RNode> parse(String text);

    /**
     * Renders one tree at the given line width.
     */
    String render(RNode tree, int width);
}
