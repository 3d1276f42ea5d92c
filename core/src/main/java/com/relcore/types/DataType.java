package com.relcore.types;

/**
 * Type of a column or expression.
 *
 * <p>Values are carried at runtime as plain Java objects:
 * <ul>
 *   <li>BooleanType - {@link Boolean}</li>
 *   <li>IntegerType - {@link Integer}</li>
 *   <li>LongType - {@link Long}</li>
 *   <li>DoubleType - {@link Double}</li>
 *   <li>StringType - {@link String}</li>
 *   <li>NullType - always {@code null}</li>
 *   <li>StructType - {@link com.relcore.row.Row}</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, IntegerType, LongType, DoubleType, StringType, NullType, StructType {

    /**
     * Returns the name used when rendering schemas and error messages.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns whether a runtime value can be stored under this type. A null
     * value is accepted by every type; nullability is checked by the field.
     *
     * @param value the value
     * @return true if the value has this type's Java representation
     */
    boolean accepts(Object value);
}
