package com.relcore.types;

/**
 * Static helpers for reasoning about {@link DataType}s and the Java values that
 * carry them at runtime.
 */
public final class DataTypes {

    private DataTypes() {}

    /**
     * Returns whether the type is one of the numeric types.
     *
     * @param type the data type
     * @return true for integer, bigint and double
     */
    public static boolean isNumeric(DataType type) {
        return type instanceof IntegerType || type instanceof LongType || type instanceof DoubleType;
    }

    /**
     * Returns whether values of the two types can be compared with each other.
     *
     * <p>Numeric types compare across widths; other types only with themselves.
     * The null type compares with anything.
     *
     * @param left the left type
     * @param right the right type
     * @return true if comparable
     */
    public static boolean isComparable(DataType left, DataType right) {
        if (left instanceof NullType || right instanceof NullType) {
            return true;
        }
        if (isNumeric(left) && isNumeric(right)) {
            return true;
        }
        return left.equals(right) && !(left instanceof StructType);
    }

    /**
     * Returns the narrowest numeric type both arguments widen to.
     *
     * @param left the left type (numeric or null)
     * @param right the right type (numeric or null)
     * @return the wider type
     */
    public static DataType widerNumericType(DataType left, DataType right) {
        if (left instanceof NullType) {
            return right;
        }
        if (right instanceof NullType) {
            return left;
        }
        if (left instanceof DoubleType || right instanceof DoubleType) {
            return DoubleType.get();
        }
        if (left instanceof LongType || right instanceof LongType) {
            return LongType.get();
        }
        return IntegerType.get();
    }

    /**
     * Compares two non-null runtime values of comparable types.
     *
     * @param left the left value
     * @param right the right value
     * @return negative, zero or positive as for {@link Comparable#compareTo}
     * @throws IllegalArgumentException if the values are not comparable
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            if (left instanceof Double || right instanceof Double) {
                return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
            }
            return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
        }
        if (left instanceof Comparable && left.getClass() == right.getClass()) {
            return ((Comparable) left).compareTo(right);
        }
        throw new IllegalArgumentException(
            "Cannot compare %s with %s".formatted(left.getClass().getSimpleName(),
                right.getClass().getSimpleName()));
    }

    /**
     * Returns the form of a value used for hashing and key equality.
     *
     * <p>Values that compare equal under {@link #compare} map to equal keys:
     * integral numbers and whole doubles in the long range become {@code Long},
     * other values are returned unchanged.
     *
     * @param value the value (may be null)
     * @return the key form of the value
     */
    public static Object keyOf(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double) {
            double d = (Double) value;
            if (d == Math.rint(d) && d >= Long.MIN_VALUE && d < 0x1p63) {
                return (long) d;
            }
        }
        return value;
    }

    /**
     * Converts a numeric runtime value to the Java representation of {@code type}.
     *
     * @param value the value (may be null)
     * @param type the target numeric type
     * @return the converted value
     */
    public static Object castNumeric(Object value, DataType type) {
        if (value == null) {
            return null;
        }
        Number n = (Number) value;
        if (type instanceof IntegerType) {
            return n.intValue();
        }
        if (type instanceof LongType) {
            return n.longValue();
        }
        if (type instanceof DoubleType) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException("Not a numeric type: " + type);
    }
}
