package com.rtidy.plugins.r.ast;

/**
 * A declared function parameter with an optional default.
 */
public final class Formal {
    private final String name;
    private final RNode defaultValue;

    public Formal(String name, RNode defaultValue) {
        this.name = name;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public RNode getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public Formal withDefault(RNode newDefault) {
        return new Formal(name, newDefault);
    }
}
