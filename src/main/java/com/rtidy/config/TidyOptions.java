package com.rtidy.config;

import com.rtidy.api.error.ConfigException;

/**
 * Options of one tidy run. Immutable; build with {@link #builder()}.
 */
public final class TidyOptions {
    public static final int MIN_WIDTH = 20;
    public static final int MAX_WIDTH = 500;

    private final boolean comment;
    private final boolean blank;
    private final boolean arrow;
    private final boolean braceNewline;
    private final int indent;
    private final int widthCutoff;

    private TidyOptions(Builder builder) {
        this.comment = builder.comment;
        this.blank = builder.blank;
        this.arrow = builder.arrow;
        this.braceNewline = builder.braceNewline;
        this.indent = builder.indent;
        this.widthCutoff = builder.widthCutoff;
    }

    public static TidyOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isComment() {
        return comment;
    }

    public boolean isBlank() {
        return blank;
    }

    public boolean isArrow() {
        return arrow;
    }

    public boolean isBraceNewline() {
        return braceNewline;
    }

    public int getIndent() {
        return indent;
    }

    public int getWidthCutoff() {
        return widthCutoff;
    }

    public Builder toBuilder() {
        return new Builder()
                .comment(comment)
                .blank(blank)
                .arrow(arrow)
                .braceNewline(braceNewline)
                .indent(indent)
                .widthCutoff(widthCutoff);
    }

    @Override
    public String toString() {
        return "TidyOptions{comment=" + comment + ", blank=" + blank + ", arrow=" + arrow
                + ", braceNewline=" + braceNewline + ", indent=" + indent + ", widthCutoff=" + widthCutoff + "}";
    }

    public static class Builder {
        private boolean comment = true;
        private boolean blank = true;
        private boolean arrow = false;
        private boolean braceNewline = false;
        private int indent = 4;
        private int widthCutoff = 80;

        public Builder comment(boolean comment) {
            this.comment = comment;
            return this;
        }

        public Builder blank(boolean blank) {
            this.blank = blank;
            return this;
        }

        public Builder arrow(boolean arrow) {
            this.arrow = arrow;
            return this;
        }

        public Builder braceNewline(boolean braceNewline) {
            this.braceNewline = braceNewline;
            return this;
        }

        public Builder indent(int indent) {
            this.indent = indent;
            return this;
        }

        public Builder widthCutoff(int widthCutoff) {
            this.widthCutoff = widthCutoff;
            return this;
        }

        /**
         * @throws ConfigException if indent is negative or the width is
         *                         outside [20, 500]
         */
        public TidyOptions build() {
            if (indent < 0) {
                throw new ConfigException(OptionResolver.INDENT, "indent must not be negative, got " + indent);
            }
            if (widthCutoff < MIN_WIDTH || widthCutoff > MAX_WIDTH) {
                throw new ConfigException(OptionResolver.WIDTH_CUTOFF, "width.cutoff must be between "
                        + MIN_WIDTH + " and " + MAX_WIDTH + ", got " + widthCutoff);
            }
            return new TidyOptions(this);
        }
    }
}
