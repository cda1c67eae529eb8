package com.rtidy.plugins.r.ast;

/**
 * One slot of a call or index argument list. A named argument binds
 * {@code name = value}; this binding is not an assignment and never appears
 * as a {@link BinaryNode}. Both parts are null for an empty slot, as in
 * {@code x[, 1]}.
 */
public final class Argument {
    private final String name;
    private final RNode value;

    public Argument(String name, RNode value) {
        this.name = name;
        this.value = value;
    }

    public static Argument empty() {
        return new Argument(null, null);
    }

    public static Argument positional(RNode value) {
        return new Argument(null, value);
    }

    public String getName() {
        return name;
    }

    public RNode getValue() {
        return value;
    }

    public boolean isNamed() {
        return name != null;
    }

    public boolean isEmpty() {
        return name == null && value == null;
    }

    public Argument withValue(RNode newValue) {
        return new Argument(name, newValue);
    }
}
