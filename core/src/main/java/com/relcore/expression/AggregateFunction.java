package com.relcore.expression;

import com.relcore.row.Row;
import com.relcore.types.DataType;
import com.relcore.types.DataTypes;
import com.relcore.types.DoubleType;
import com.relcore.types.IntegerType;
import com.relcore.types.LongType;
import com.relcore.types.NullType;
import com.relcore.types.StructType;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An aggregate function call, evaluated by an aggregation operator over groups
 * of rows rather than by {@link #eval}.
 *
 * <p>{@code COUNT(*)} is represented as {@code COUNT(1)}.
 *
 * @param kind the aggregate function
 * @param child the argument
 */
public record AggregateFunction(Kind kind, Expression child) implements Expression {

    /**
     * Supported aggregate functions.
     */
    public enum Kind {
        COUNT, SUM, MIN, MAX, AVG
    }

    public AggregateFunction {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(child, "child must not be null");
    }

    @Override
    public DataType dataType() {
        return switch (kind) {
            case COUNT -> LongType.get();
            case AVG -> DoubleType.get();
            case SUM -> sumType(child.dataType());
            case MIN, MAX -> child.dataType();
        };
    }

    private static DataType sumType(DataType input) {
        if (input instanceof IntegerType || input instanceof LongType || input instanceof NullType) {
            return LongType.get();
        }
        return DoubleType.get();
    }

    @Override
    public boolean nullable() {
        return kind != Kind.COUNT;
    }

    @Override
    public Optional<String> checkInputDataTypes() {
        DataType type = child.dataType();
        if ((kind == Kind.SUM || kind == Kind.AVG)
                && !(DataTypes.isNumeric(type) || type instanceof NullType)) {
            return Optional.of("function %s requires numeric input, not %s".formatted(kind, type));
        }
        if ((kind == Kind.MIN || kind == Kind.MAX) && type instanceof StructType) {
            return Optional.of("function %s does not support %s".formatted(kind, type));
        }
        return Optional.empty();
    }

    @Override
    public List<Expression> children() {
        return List.of(child);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return new AggregateFunction(kind, newChildren.get(0));
    }

    @Override
    public Object eval(Row input) {
        throw new UnsupportedOperationException("Aggregate function " + this + " cannot be evaluated per row");
    }

    /**
     * Creates an empty accumulation buffer for one group.
     *
     * @return the buffer
     */
    public Buffer newBuffer() {
        return new Buffer(this);
    }

    @Override
    public String toString() {
        return kind + "(" + child + ")";
    }

    /**
     * Mutable accumulation state of one aggregate function for one group.
     */
    public static final class Buffer {

        private final AggregateFunction function;
        private final DataType resultType;
        private long count;
        private Object value;

        private Buffer(AggregateFunction function) {
            this.function = function;
            this.resultType = function.dataType();
        }

        /**
         * Accumulates one input value (already evaluated from the argument).
         *
         * @param input the argument value for the current row
         */
        public void update(Object input) {
            if (input == null) {
                return;
            }
            count++;
            switch (function.kind) {
                case COUNT -> { }
                case SUM, AVG -> value = value == null ? input : add((Number) value, (Number) input);
                case MIN -> value = value == null || DataTypes.compare(input, value) < 0 ? input : value;
                case MAX -> value = value == null || DataTypes.compare(input, value) > 0 ? input : value;
            }
        }

        private static Number add(Number a, Number b) {
            if (a instanceof Double || b instanceof Double) {
                return a.doubleValue() + b.doubleValue();
            }
            return a.longValue() + b.longValue();
        }

        /**
         * Returns the aggregate value of everything accumulated so far.
         *
         * @return the result, null for an empty non-count aggregate
         */
        public Object result() {
            return switch (function.kind) {
                case COUNT -> count;
                case SUM -> DataTypes.castNumeric(value, resultType);
                case AVG -> value == null ? null : ((Number) value).doubleValue() / count;
                case MIN, MAX -> value;
            };
        }
    }
}
