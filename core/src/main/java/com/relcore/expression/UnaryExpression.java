package com.relcore.expression;

import com.relcore.row.Row;
import com.relcore.types.BooleanType;
import com.relcore.types.DataType;
import com.relcore.types.DataTypes;
import com.relcore.types.NullType;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Expression representing a unary operation.
 *
 * <p>Unary expressions include:
 * <ul>
 *   <li>Logical negation: NOT active</li>
 *   <li>Arithmetic negation: -amount</li>
 *   <li>Null tests: name IS NULL, name IS NOT NULL</li>
 * </ul>
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        NOT("NOT"),
        NEGATE("-"),
        IS_NULL("IS NULL"),
        IS_NOT_NULL("IS NOT NULL");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isPostfix() {
            return this == IS_NULL || this == IS_NOT_NULL;
        }
    }

    private final Operator operator;
    private final Expression child;

    /**
     * Creates a unary expression.
     *
     * @param operator the operator
     * @param child the operand
     */
    public UnaryExpression(Operator operator, Expression child) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.child = Objects.requireNonNull(child, "child must not be null");
    }

    public Operator operator() {
        return operator;
    }

    public Expression child() {
        return child;
    }

    @Override
    public DataType dataType() {
        return operator == Operator.NEGATE ? child.dataType() : BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return (operator == Operator.NOT || operator == Operator.NEGATE) && child.nullable();
    }

    @Override
    public Optional<String> checkInputDataTypes() {
        DataType type = child.dataType();
        if (operator == Operator.NOT && !(type instanceof BooleanType || type instanceof NullType)) {
            return Optional.of("argument of '%s' must be boolean, not %s".formatted(this, type));
        }
        if (operator == Operator.NEGATE && !DataTypes.isNumeric(type)) {
            return Optional.of("argument of '%s' must be numeric, not %s".formatted(this, type));
        }
        return Optional.empty();
    }

    @Override
    public List<Expression> children() {
        return List.of(child);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return new UnaryExpression(operator, newChildren.get(0));
    }

    @Override
    public Object eval(Row input) {
        Object value = child.eval(input);
        return switch (operator) {
            case IS_NULL -> value == null;
            case IS_NOT_NULL -> value != null;
            case NOT -> value == null ? null : !(Boolean) value;
            case NEGATE -> value == null ? null : negate((Number) value);
        };
    }

    private Object negate(Number value) {
        if (value instanceof Double) {
            return -value.doubleValue();
        }
        if (value instanceof Long) {
            return -value.longValue();
        }
        return -value.intValue();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator && child.equals(that.child);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, child);
    }

    @Override
    public String toString() {
        if (operator.isPostfix()) {
            return "(%s %s)".formatted(child, operator.symbol());
        }
        return operator == Operator.NOT ? "NOT " + child : "-" + child;
    }
}
