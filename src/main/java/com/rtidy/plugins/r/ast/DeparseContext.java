package com.rtidy.plugins.r.ast;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Output buffer for the deparser. Tracks open brackets so that a line
 * broken inside a bracket is indented one level past the line that
 * opened it.
 */
public class DeparseContext {
    private static final String INDENT_UNIT = "    ";

    private final StringBuilder output = new StringBuilder();
    private final int width;

    // depth of the line each open bracket was written on
    private final Deque<Integer> openDepths = new ArrayDeque<>();
    private int lineDepth = 0;
    private boolean atLineStart = true;

    public DeparseContext(int width) {
        this.width = width;
    }

    public int getWidth() {
        return width;
    }

    /**
     * Appends text, writing the current line's indentation first when at
     * the start of a line.
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            output.append(INDENT_UNIT.repeat(lineDepth));
            atLineStart = false;
        }
        output.append(text);
    }

    public void open(String bracket) {
        append(bracket);
        openDepths.push(lineDepth);
    }

    public void close(String bracket) {
        openDepths.pop();
        append(bracket);
    }

    /**
     * Closes the innermost bracket on a line of its own, at the depth of
     * the line that opened it.
     */
    public void closeOnNewLine(String bracket) {
        int depth = openDepths.pop();
        newLine(depth);
        append(bracket);
    }

    /**
     * Starts a new line inside the innermost open bracket.
     */
    public void newLine() {
        newLine(innerDepth());
    }

    /**
     * Starts a new line continuing an expression broken after an operator.
     */
    public void continuationLine() {
        newLine(innerDepth() + 1);
    }

    private void newLine(int depth) {
        output.append('\n');
        lineDepth = depth;
        atLineStart = true;
    }

    private int innerDepth() {
        return openDepths.isEmpty() ? 0 : openDepths.peek() + 1;
    }

    public int getCurrentLineLength() {
        int lastNewline = output.lastIndexOf("\n");
        if (lastNewline < 0) {
            return output.length();
        }
        return output.length() - lastNewline - 1;
    }

    public boolean isOverWidth() {
        return getCurrentLineLength() >= width;
    }

    public String getOutput() {
        return output.toString();
    }
}
