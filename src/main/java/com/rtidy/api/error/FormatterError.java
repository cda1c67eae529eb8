package com.rtidy.api.error;

/**
 * A diagnostic reported for one source: a failure that stopped formatting,
 * or a warning raised along the way.
 */
public class FormatterError {
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public FormatterError(Severity severity, String message, int line, int column) {
        this(severity, message, line, column, null);
    }

    public FormatterError(Severity severity, String message, int line, int column, String suggestion) {
        this.severity = severity;
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    /**
     * Describes a failure raised while tidying.
     */
    public static FormatterError of(TidyException e) {
        int column = e instanceof ParseException ? ((ParseException) e).getColumn() : 0;
        String suggestion = null;
        if (e instanceof MaskingException) {
            suggestion = "Move the comment next to a complete expression, or run with comments disabled";
        } else if (e instanceof ConfigException) {
            suggestion = "Check the value of option '" + ((ConfigException) e).getOption() + "'";
        }
        String message = e instanceof ParseException ? ((ParseException) e).getReason() : e.getMessage();
        return new FormatterError(e.getSeverity(), message, e.getLine(), column, suggestion);
    }

    // Getters
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }

    @Override
    public String toString() {
        return severity + ": " + message + (line > 0 ? " (line " + line + ")" : "");
    }
}
