package com.relcore.expression;

import com.relcore.row.Row;
import com.relcore.types.BooleanType;
import com.relcore.types.DataType;
import com.relcore.types.DataTypes;
import com.relcore.types.DoubleType;
import com.relcore.types.NullType;
import com.relcore.types.StringType;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Expression representing a binary operation (operation with two operands).
 *
 * <p>Binary expressions include:
 * <ul>
 *   <li>Arithmetic: a + b, a - b, a * b, a / b, a % b</li>
 *   <li>Comparison: a > b, a >= b, a < b, a <= b, a = b, a != b</li>
 *   <li>Logical: a AND b, a OR b</li>
 *   <li>String: a || b (concatenation)</li>
 * </ul>
 *
 * <p>Null handling follows SQL: arithmetic and comparison yield null when either
 * side is null, logical operators use three-valued logic. Division always
 * yields a double; division or modulo by zero yields null.
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        // Arithmetic operators
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%"),

        // Comparison operators
        EQUAL("="),
        NOT_EQUAL("!="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">="),

        // Logical operators
        AND("AND"),
        OR("OR"),

        // String operators
        CONCAT("||");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isArithmetic() {
            return this == ADD || this == SUBTRACT || this == MULTIPLY ||
                   this == DIVIDE || this == MODULO;
        }

        public boolean isComparison() {
            return this == EQUAL || this == NOT_EQUAL || this == LESS_THAN ||
                   this == LESS_THAN_OR_EQUAL || this == GREATER_THAN ||
                   this == GREATER_THAN_OR_EQUAL;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }

        /**
         * Returns the operator that gives the same result with swapped operands.
         *
         * @return the mirrored comparison, or this operator if symmetric
         */
        public Operator flip() {
            return switch (this) {
                case LESS_THAN -> GREATER_THAN;
                case LESS_THAN_OR_EQUAL -> GREATER_THAN_OR_EQUAL;
                case GREATER_THAN -> LESS_THAN;
                case GREATER_THAN_OR_EQUAL -> LESS_THAN_OR_EQUAL;
                default -> this;
            };
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     */
    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public DataType dataType() {
        if (operator.isComparison() || operator.isLogical()) {
            return BooleanType.get();
        }
        if (operator == Operator.CONCAT) {
            return StringType.get();
        }
        if (operator == Operator.DIVIDE) {
            return DoubleType.get();
        }
        return DataTypes.widerNumericType(left.dataType(), right.dataType());
    }

    @Override
    public boolean nullable() {
        if (operator == Operator.DIVIDE || operator == Operator.MODULO) {
            return true;
        }
        return left.nullable() || right.nullable();
    }

    @Override
    public Optional<String> checkInputDataTypes() {
        DataType l = left.dataType();
        DataType r = right.dataType();
        if (operator.isLogical()) {
            if (!isBooleanOrNull(l) || !isBooleanOrNull(r)) {
                return mismatch("boolean", l, r);
            }
        } else if (operator.isComparison()) {
            if (!DataTypes.isComparable(l, r)) {
                return mismatch("comparable", l, r);
            }
        } else if (operator == Operator.CONCAT) {
            if (!isStringOrNull(l) || !isStringOrNull(r)) {
                return mismatch("string", l, r);
            }
        } else if (!isNumericOrNull(l) || !isNumericOrNull(r)) {
            return mismatch("numeric", l, r);
        }
        return Optional.empty();
    }

    private Optional<String> mismatch(String expected, DataType l, DataType r) {
        return Optional.of("differing or invalid types in '%s' (%s and %s), expected %s operands"
            .formatted(this, l, r, expected));
    }

    private static boolean isBooleanOrNull(DataType type) {
        return type instanceof BooleanType || type instanceof NullType;
    }

    private static boolean isStringOrNull(DataType type) {
        return type instanceof StringType || type instanceof NullType;
    }

    private static boolean isNumericOrNull(DataType type) {
        return DataTypes.isNumeric(type) || type instanceof NullType;
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return new BinaryExpression(newChildren.get(0), operator, newChildren.get(1));
    }

    @Override
    public Object eval(Row input) {
        if (operator == Operator.AND) {
            return evalAnd(input);
        }
        if (operator == Operator.OR) {
            return evalOr(input);
        }
        Object l = left.eval(input);
        if (l == null) {
            return null;
        }
        Object r = right.eval(input);
        if (r == null) {
            return null;
        }
        if (operator.isComparison()) {
            int cmp = DataTypes.compare(l, r);
            return switch (operator) {
                case EQUAL -> cmp == 0;
                case NOT_EQUAL -> cmp != 0;
                case LESS_THAN -> cmp < 0;
                case LESS_THAN_OR_EQUAL -> cmp <= 0;
                case GREATER_THAN -> cmp > 0;
                default -> cmp >= 0;
            };
        }
        if (operator == Operator.CONCAT) {
            return (String) l + r;
        }
        return evalArithmetic((Number) l, (Number) r);
    }

    private Object evalAnd(Row input) {
        Object l = left.eval(input);
        if (Boolean.FALSE.equals(l)) {
            return false;
        }
        Object r = right.eval(input);
        if (Boolean.FALSE.equals(r)) {
            return false;
        }
        return l == null || r == null ? null : Boolean.TRUE;
    }

    private Object evalOr(Row input) {
        Object l = left.eval(input);
        if (Boolean.TRUE.equals(l)) {
            return true;
        }
        Object r = right.eval(input);
        if (Boolean.TRUE.equals(r)) {
            return true;
        }
        return l == null || r == null ? null : Boolean.FALSE;
    }

    private Object evalArithmetic(Number l, Number r) {
        if (operator == Operator.DIVIDE) {
            double divisor = r.doubleValue();
            return divisor == 0.0 ? null : l.doubleValue() / divisor;
        }
        DataType resultType = dataType();
        if (resultType instanceof DoubleType) {
            double a = l.doubleValue();
            double b = r.doubleValue();
            return switch (operator) {
                case ADD -> a + b;
                case SUBTRACT -> a - b;
                case MULTIPLY -> a * b;
                default -> b == 0.0 ? null : a % b;
            };
        }
        long a = l.longValue();
        long b = r.longValue();
        Long result = switch (operator) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            default -> b == 0L ? null : a % b;
        };
        return DataTypes.castNumeric(result, resultType);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return operator == that.operator &&
               left.equals(that.left) &&
               right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    @Override
    public String toString() {
        return "(%s %s %s)".formatted(left, operator.symbol(), right);
    }
}
