package com.relcore.logical;

import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing a filter (WHERE clause).
 *
 * <p>This node filters rows from its child based on a boolean condition.
 *
 * <p>Examples:
 * <pre>
 *   df.filter(gt(col("age"), lit(25)))
 *   SELECT * FROM people WHERE age > 25
 * </pre>
 */
public final class Filter extends LogicalPlan {

    private final Expression condition;

    /**
     * Creates a filter node.
     *
     * @param child the child node
     * @param condition the filter condition (must evaluate to boolean)
     */
    public Filter(LogicalPlan child, Expression condition) {
        super(child);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public Expression condition() {
        return condition;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        // Filter doesn't change the schema
        return child().output();
    }

    @Override
    public List<Expression> expressions() {
        return List.of(condition);
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> f) {
        Expression next = f.apply(condition);
        return next == condition ? this : new Filter(child(), next);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return new Filter(newChildren.get(0), condition);
    }

    @Override
    protected List<Object> args() {
        return List.of(condition);
    }

    @Override
    public String argString() {
        return condition.toString();
    }
}
