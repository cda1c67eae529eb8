package com.rtidy.plugins.r;

import java.util.List;

/**
 * Outcome of tidying one source: the tidy lines, the rendered text while
 * comments were still masked, and any warnings raised on the way.
 */
public final class TidyResult {
    private final List<String> textTidy;
    private final List<String> textMask;
    private final List<String> warnings;
    private final String formattedCode;

    TidyResult(List<String> textTidy, List<String> textMask, List<String> warnings, String formattedCode) {
        this.textTidy = List.copyOf(textTidy);
        this.textMask = List.copyOf(textMask);
        this.warnings = List.copyOf(warnings);
        this.formattedCode = formattedCode;
    }

    TidyResult(List<String> textTidy, List<String> textMask, List<String> warnings) {
        this(textTidy, textMask, warnings, textTidy.isEmpty() ? "" : String.join("\n", textTidy) + "\n");
    }

    public List<String> getTextTidy() {
        return textTidy;
    }

    public List<String> getTextMask() {
        return textMask;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * The tidy lines as file content, each line terminated by a newline.
     */
    public String getFormattedCode() {
        return formattedCode;
    }
}
