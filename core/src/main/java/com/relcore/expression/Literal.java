package com.relcore.expression;

import com.relcore.row.Row;
import com.relcore.types.BooleanType;
import com.relcore.types.DataType;
import com.relcore.types.DoubleType;
import com.relcore.types.IntegerType;
import com.relcore.types.LongType;
import com.relcore.types.NullType;
import com.relcore.types.StringType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>Literals are fixed values that don't change, such as:
 * <ul>
 *   <li>Numeric literals: 42, 100L, 3.14</li>
 *   <li>String literals: 'hello'</li>
 *   <li>Boolean literals: true, false</li>
 *   <li>Null literal: null</li>
 * </ul>
 *
 * @param value the literal value (may be null)
 * @param dataType the data type of the literal
 */
public record Literal(Object value, DataType dataType) implements Expression {

    public Literal {
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Creates a literal, inferring the data type from the Java value.
     *
     * @param value an Integer, Long, Double, String, Boolean or null
     * @return the literal
     * @throws IllegalArgumentException for unsupported value classes
     */
    public static Literal of(Object value) {
        if (value == null) {
            return new Literal(null, NullType.get());
        }
        if (value instanceof Integer) {
            return new Literal(value, IntegerType.get());
        }
        if (value instanceof Long) {
            return new Literal(value, LongType.get());
        }
        if (value instanceof Double) {
            return new Literal(value, DoubleType.get());
        }
        if (value instanceof String) {
            return new Literal(value, StringType.get());
        }
        if (value instanceof Boolean) {
            return new Literal(value, BooleanType.get());
        }
        throw new IllegalArgumentException(
            "Unsupported literal type: " + value.getClass().getName());
    }

    /**
     * Returns whether this is a NULL literal.
     *
     * @return true if value is null, false otherwise
     */
    public boolean isNull() {
        return value == null;
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return this;
    }

    @Override
    public Object eval(Row input) {
        return value;
    }

    @Override
    public String toString() {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return "'" + value + "'";
        }
        return value.toString();
    }
}
