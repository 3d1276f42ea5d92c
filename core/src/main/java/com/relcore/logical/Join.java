package com.relcore.logical;

import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing a join operation.
 *
 * <p>This node joins two relations based on a join condition and join type.
 * An inner join without a condition is a cartesian product.
 *
 * <p>Examples:
 * <pre>
 *   df1.join(df2, eq(col("a.id"), col("b.id")))           // Inner join
 *   df1.join(df2, eq(col("a.id"), col("b.id")), LEFT)     // Left outer join
 *   df1.join(df2)                                          // Cartesian product
 * </pre>
 *
 * <p>Supported join types:
 * <ul>
 *   <li>INNER - Standard inner join</li>
 *   <li>LEFT - Left outer join</li>
 *   <li>RIGHT - Right outer join</li>
 *   <li>FULL - Full outer join</li>
 *   <li>LEFT_SEMI - Left semi join (returns left rows with matches)</li>
 * </ul>
 */
public final class Join extends LogicalPlan {

    private final JoinType joinType;
    private final Expression condition;

    /**
     * Creates a join node.
     *
     * @param left the left relation
     * @param right the right relation
     * @param joinType the join type
     * @param condition the join condition (may be null for an unconditioned inner join)
     */
    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType, Expression condition) {
        super(Arrays.asList(
            Objects.requireNonNull(left, "left must not be null"),
            Objects.requireNonNull(right, "right must not be null")));
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.condition = condition;

        if (joinType != JoinType.INNER && condition == null) {
            throw new IllegalArgumentException("condition is required for " + joinType + " joins");
        }
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
    }

    public JoinType joinType() {
        return joinType;
    }

    /**
     * Returns the join condition.
     *
     * @return the condition, empty for a cartesian product
     */
    public Optional<Expression> condition() {
        return Optional.ofNullable(condition);
    }

    @Override
    public List<AttributeReference> output() {
        List<AttributeReference> leftOutput = left().output();
        List<AttributeReference> rightOutput = right().output();
        switch (joinType) {
            case LEFT_SEMI:
                return leftOutput;
            case LEFT:
                return concat(leftOutput, nullable(rightOutput));
            case RIGHT:
                return concat(nullable(leftOutput), rightOutput);
            case FULL:
                return concat(nullable(leftOutput), nullable(rightOutput));
            default:
                return concat(leftOutput, rightOutput);
        }
    }

    private static List<AttributeReference> nullable(List<AttributeReference> attributes) {
        List<AttributeReference> result = new ArrayList<>(attributes.size());
        for (AttributeReference attribute : attributes) {
            result.add(attribute.withNullability(true));
        }
        return result;
    }

    private static List<AttributeReference> concat(List<AttributeReference> a, List<AttributeReference> b) {
        List<AttributeReference> result = new ArrayList<>(a);
        result.addAll(b);
        return result;
    }

    @Override
    public List<Expression> expressions() {
        return condition == null ? Collections.emptyList() : List.of(condition);
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> f) {
        if (condition == null) {
            return this;
        }
        Expression next = f.apply(condition);
        return next == condition ? this : new Join(left(), right(), joinType, next);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return new Join(newChildren.get(0), newChildren.get(1), joinType, condition);
    }

    @Override
    protected List<Object> args() {
        return Arrays.asList(joinType, condition);
    }

    @Override
    public String argString() {
        return condition == null ? joinType.name() : joinType + ", " + condition;
    }

    /**
     * Join type enumeration.
     */
    public enum JoinType {
        INNER,
        LEFT,
        RIGHT,
        FULL,
        LEFT_SEMI
    }
}
