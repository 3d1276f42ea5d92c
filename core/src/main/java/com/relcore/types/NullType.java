package com.relcore.types;

/**
 * Type of the untyped {@code NULL} literal. Only null is accepted.
 */
public final class NullType implements DataType {

    private static final NullType INSTANCE = new NullType();

    private NullType() {}

    public static NullType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "null";
    }

    @Override
    public boolean accepts(Object value) {
        return value == null;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
