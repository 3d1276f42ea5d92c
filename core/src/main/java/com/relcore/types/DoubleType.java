package com.relcore.types;

/**
 * Double-precision floating point numbers, carried as {@link Double}.
 */
public final class DoubleType implements DataType {

    private static final DoubleType INSTANCE = new DoubleType();

    private DoubleType() {}

    public static DoubleType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "double";
    }

    @Override
    public boolean accepts(Object value) {
        return value == null || value instanceof Double;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
