package com.rtidy.plugins.r;

import com.rtidy.api.error.TidyException;
import com.rtidy.plugins.r.ast.Argument;
import com.rtidy.plugins.r.ast.BinaryNode;
import com.rtidy.plugins.r.ast.CallNode;
import com.rtidy.plugins.r.ast.ConstantNode;
import com.rtidy.plugins.r.ast.Deparser;
import com.rtidy.plugins.r.ast.Formal;
import com.rtidy.plugins.r.ast.FunctionNode;
import com.rtidy.plugins.r.ast.RNode;
import com.rtidy.plugins.r.ast.RParser;
import com.rtidy.plugins.r.ast.SymbolNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the call signature of a function defined in a source, such as
 * {@code f(x, y = 2, ...)}.
 */
public final class FunctionUsage {

    private FunctionUsage() {
    }

    /**
     * Finds the last top-level definition of {@code name} and renders its
     * parameter list at the given width.
     *
     * @throws TidyException if no such function is defined at top level
     */
    public static String usage(String source, String name, int width) {
        FunctionNode definition = null;
        for (RNode tree : RParser.parse(String.join("\n", TidySource.toLines(source)))) {
            FunctionNode function = definitionOf(tree, name);
            if (function != null) {
                definition = function;
            }
        }
        if (definition == null) {
            throw new TidyException("No function named '" + name + "' is defined at top level");
        }

        int line = definition.getLine();
        List<Argument> arguments = new ArrayList<>();
        for (Formal formal : definition.getFormals()) {
            arguments.add(formal.hasDefault()
                    ? new Argument(formal.getName(), formal.getDefaultValue())
                    : Argument.positional(new SymbolNode(line, formal.getName())));
        }
        return Deparser.render(new CallNode(line, new SymbolNode(line, name), arguments), width);
    }

    private static FunctionNode definitionOf(RNode tree, String name) {
        if (!(tree instanceof BinaryNode) || !((BinaryNode) tree).isAssignment()) {
            return null;
        }
        BinaryNode assignment = (BinaryNode) tree;
        boolean rightward = assignment.getOperator().startsWith("->");
        RNode target = rightward ? assignment.getRight() : assignment.getLeft();
        RNode value = rightward ? assignment.getLeft() : assignment.getRight();
        if (value instanceof FunctionNode && name.equals(targetName(target))) {
            return (FunctionNode) value;
        }
        return null;
    }

    private static String targetName(RNode target) {
        String text;
        if (target instanceof SymbolNode) {
            text = ((SymbolNode) target).getName();
        } else if (target instanceof ConstantNode && ((ConstantNode) target).isString()) {
            text = ((ConstantNode) target).getText();
        } else {
            return null;
        }
        if (text.length() >= 2 && "`\"'".indexOf(text.charAt(0)) >= 0 && text.charAt(text.length() - 1) == text.charAt(0)) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
