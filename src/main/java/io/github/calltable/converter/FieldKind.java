package io.github.calltable.converter;

/**
 * Target primitive kinds a raw field value can be coerced to.
 */
public enum FieldKind {
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean");

    private final String typeName;

    FieldKind(String typeName) {
        this.typeName = typeName;
    }

    /**
     * Returns the lower-case name used in error messages.
     */
    public String getTypeName() {
        return typeName;
    }
}
