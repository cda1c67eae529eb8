package com.rtidy.api.error;

/**
 * An option value is out of range, has the wrong type, or conflicts with
 * another option.
 */
public class ConfigException extends TidyException {
    private final String option;

    public ConfigException(String option, String message) {
        super(message);
        this.option = option;
    }

    public String getOption() {
        return option;
    }

    @Override
    public Severity getSeverity() {
        return Severity.ERROR;
    }
}
