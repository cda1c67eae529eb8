package com.rtidy.config;

import java.util.List;

/**
 * Options after merging, with the deprecation warnings the merge produced.
 */
public final class ResolvedOptions {
    private final TidyOptions options;
    private final List<String> warnings;

    public ResolvedOptions(TidyOptions options, List<String> warnings) {
        this.options = options;
        this.warnings = List.copyOf(warnings);
    }

    public TidyOptions getOptions() {
        return options;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
