package com.rtidy.api.error;

/**
 * Base type for every failure raised while tidying a single source.
 */
public class TidyException extends RuntimeException {
    private final int line;

    public TidyException(String message) {
        this(message, 0, null);
    }

    public TidyException(String message, int line) {
        this(message, line, null);
    }

    public TidyException(String message, int line, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    /**
     * Line of the input the failure refers to, or 0 when it has none.
     */
    public int getLine() {
        return line;
    }

    /**
     * Severity this failure is reported with by the plugin layer.
     */
    public Severity getSeverity() {
        return Severity.FATAL;
    }
}
