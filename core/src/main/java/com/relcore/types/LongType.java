package com.relcore.types;

/**
 * 64-bit signed integers, carried as {@link Long}.
 */
public final class LongType implements DataType {

    private static final LongType INSTANCE = new LongType();

    private LongType() {}

    public static LongType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "bigint";
    }

    @Override
    public boolean accepts(Object value) {
        return value == null || value instanceof Long;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
