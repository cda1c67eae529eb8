package com.rtidy.plugins.r;

import java.util.List;

/**
 * Output of {@link CommentMasker}: parseable text plus what was hidden in it.
 */
public final class MaskedSource {
    private final String text;
    private final List<CommentRecord> records;

    public MaskedSource(String text, List<CommentRecord> records) {
        this.text = text;
        this.records = List.copyOf(records);
    }

    public String getText() {
        return text;
    }

    public List<CommentRecord> getRecords() {
        return records;
    }
}
