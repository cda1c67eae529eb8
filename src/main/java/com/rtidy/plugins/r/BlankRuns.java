package com.rtidy.plugins.r;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The runs of newlines at the very start and the very end of a source.
 */
public final class BlankRuns {
    private final int leading;
    private final int trailing;

    public BlankRuns(int leading, int trailing) {
        this.leading = leading;
        this.trailing = trailing;
    }

    /**
     * Counts the newline runs at both ends of the lines joined with
     * {@code \n}.
     */
    public static BlankRuns record(List<String> lines) {
        String text = String.join("\n", lines);
        int leading = 0;
        while (leading < text.length() && text.charAt(leading) == '\n') {
            leading++;
        }
        int trailing = 0;
        while (trailing < text.length() - leading && text.charAt(text.length() - 1 - trailing) == '\n') {
            trailing++;
        }
        return new BlankRuns(leading, trailing);
    }

    /**
     * Surrounds the lines with the recorded number of empty lines.
     */
    public List<String> restore(List<String> lines) {
        List<String> result = new ArrayList<>(leading + lines.size() + trailing);
        result.addAll(Collections.nCopies(leading, ""));
        result.addAll(lines);
        result.addAll(Collections.nCopies(trailing, ""));
        return result;
    }

    public int getLeading() {
        return leading;
    }

    public int getTrailing() {
        return trailing;
    }
}
