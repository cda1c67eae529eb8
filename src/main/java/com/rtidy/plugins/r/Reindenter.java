package com.rtidy.plugins.r;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Rewrites leading whitespace so that each nesting level is indented by a
 * fixed number of spaces.
 *
 * <p>Every open bracket remembers the depth of the line that opened it; a
 * line sits one level inside the innermost open bracket, or at the
 * opener's depth when it starts with the matching closer. A line following
 * one that ends in a binary operator gets one extra level. Lines that start
 * inside a multi-line string are left untouched.
 */
public class Reindenter {
    private static final String OPERATOR_CHARS = "+-*/^<>=!&|~%?:$@";

    private final int indent;

    public Reindenter(int indent) {
        this.indent = indent;
    }

    public List<String> reindent(List<String> lines) {
        LineScanner scanner = new LineScanner();
        Deque<Integer> openDepths = new ArrayDeque<>();
        List<String> result = new ArrayList<>(lines.size());
        boolean continues = false;
        int depth = 0;

        for (String line : lines) {
            LineScanner.ScannedLine scanned = scanner.scan(line);
            if (scanned.startsInString) {
                result.add(line);
            } else {
                String body = line.strip();
                if (body.isEmpty()) {
                    result.add("");
                    continue;
                }
                if (scanned.leadingClosers > 0 && !openDepths.isEmpty()) {
                    depth = openDepths.peek();
                } else {
                    depth = (openDepths.isEmpty() ? 0 : openDepths.peek() + 1) + (continues ? 1 : 0);
                }
                result.add(" ".repeat(depth * indent) + body);
            }

            for (char c : scanned.brackets.toCharArray()) {
                if (c == '(' || c == '[' || c == '{') {
                    openDepths.push(depth);
                } else if (!openDepths.isEmpty()) {
                    openDepths.pop();
                }
            }
            if (scanned.endsInString) {
                continues = false;
            } else if (scanned.hasCode()) {
                continues = OPERATOR_CHARS.indexOf(scanned.lastCodeChar) >= 0;
            }
        }
        return result;
    }
}
