package com.rtidy.api.error;

/**
 * A comment could not be carried through the parser as a placeholder.
 */
public class MaskingException extends TidyException {

    public MaskingException(String message, int line) {
        super(message, line);
    }
}
