package com.relcore.types;

/**
 * Three-valued booleans, carried as {@link Boolean}.
 */
public final class BooleanType implements DataType {

    private static final BooleanType INSTANCE = new BooleanType();

    private BooleanType() {}

    public static BooleanType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "boolean";
    }

    @Override
    public boolean accepts(Object value) {
        return value == null || value instanceof Boolean;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
