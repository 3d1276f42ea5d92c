package com.relcore.types;

/**
 * 32-bit signed integers, carried as {@link Integer}.
 */
public final class IntegerType implements DataType {

    private static final IntegerType INSTANCE = new IntegerType();

    private IntegerType() {}

    public static IntegerType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "int";
    }

    @Override
    public boolean accepts(Object value) {
        return value == null || value instanceof Integer;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
