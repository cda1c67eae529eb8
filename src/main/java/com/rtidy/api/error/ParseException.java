package com.rtidy.api.error;

/**
 * The input is not syntactically valid R code.
 */
public class ParseException extends TidyException {
    private final int column;
    private final String found;

    public ParseException(String message, int line, int column, String found) {
        super(message, line);
        this.column = column;
        this.found = found;
    }

    public int getColumn() {
        return column;
    }

    public String getFound() {
        return found;
    }

    /**
     * The message and the offending token, without the position.
     */
    public String getReason() {
        return found == null ? super.getMessage() : super.getMessage() + " (found '" + found + "')";
    }

    @Override
    public String getMessage() {
        if (getLine() <= 0) {
            return getReason();
        }
        return super.getMessage() + " at line " + getLine() + ", column " + column
                + (found == null ? "" : " (found '" + found + "')");
    }
}
