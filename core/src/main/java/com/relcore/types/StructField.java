package com.relcore.types;

import java.util.Objects;

/**
 * A named, typed column of a {@link StructType}.
 */
public record StructField(String name, DataType dataType, boolean nullable) {

    public StructField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public StructField(String name, DataType dataType) {
        this(name, dataType, true);
    }

    /**
     * Returns whether a value can be stored in this column.
     *
     * @param value the value, possibly null
     * @return false for a null in a non-nullable column or a value of another type
     */
    public boolean accepts(Object value) {
        return value == null ? nullable : dataType.accepts(value);
    }

    @Override
    public String toString() {
        return name + ": " + dataType + (nullable ? "" : " not null");
    }
}
