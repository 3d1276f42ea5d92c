package com.relcore.types;

/**
 * Character strings, carried as {@link String}.
 */
public final class StringType implements DataType {

    private static final StringType INSTANCE = new StringType();

    private StringType() {}

    public static StringType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public boolean accepts(Object value) {
        return value == null || value instanceof String;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
