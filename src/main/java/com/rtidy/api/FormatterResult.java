package com.rtidy.api;

import java.util.ArrayList;
import java.util.List;

import com.rtidy.api.error.FormatterError;

/**
 * Result of a formatting operation.
 */
public class FormatterResult {
    private final boolean successful;
    private final String formattedCode;
    private final String maskedCode;
    private final List<FormatterError> errors;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.formattedCode = builder.formattedCode;
        this.maskedCode = builder.maskedCode;
        this.errors = builder.errors;
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    /**
     * The rendered code while comments were still masked; null when the
     * run failed before rendering.
     */
    public String getMaskedCode() {
        return maskedCode;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    /**
     * Whether formatting succeeded and produced text different from the input.
     */
    public boolean changes(String sourceCode) {
        return successful && formattedCode != null && !formattedCode.equals(sourceCode);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String formattedCode;
        private String maskedCode;
        private List<FormatterError> errors = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder maskedCode(String maskedCode) {
            this.maskedCode = maskedCode;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
