package com.relcore.logical;

import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import com.relcore.expression.Expressions;
import com.relcore.expression.NamedExpression;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing an aggregation (GROUP BY clause).
 *
 * <p>This node groups rows by grouping expressions and computes the aggregate
 * expressions for each group. With no grouping expressions the whole input
 * forms a single group.
 *
 * <p>Examples:
 * <pre>
 *   df.groupBy("category").agg(sum(col("amount")))
 *   SELECT category, SUM(amount) FROM sales GROUP BY category
 * </pre>
 */
public final class Aggregate extends LogicalPlan {

    private final List<Expression> groupingExpressions;
    private final List<NamedExpression> aggregateExpressions;

    /**
     * Creates an aggregate node.
     *
     * @param child the child node
     * @param groupingExpressions the grouping expressions
     * @param aggregateExpressions the output expressions (grouping columns and aggregates)
     */
    public Aggregate(LogicalPlan child,
                     List<? extends Expression> groupingExpressions,
                     List<? extends NamedExpression> aggregateExpressions) {
        super(child);
        this.groupingExpressions = List.copyOf(
            Objects.requireNonNull(groupingExpressions, "groupingExpressions must not be null"));
        this.aggregateExpressions = List.copyOf(
            Objects.requireNonNull(aggregateExpressions, "aggregateExpressions must not be null"));
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public List<Expression> groupingExpressions() {
        return groupingExpressions;
    }

    public List<NamedExpression> aggregateExpressions() {
        return aggregateExpressions;
    }

    @Override
    public List<AttributeReference> output() {
        return Expressions.toAttributes(aggregateExpressions);
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>(groupingExpressions);
        all.addAll(aggregateExpressions);
        return all;
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> f) {
        List<Expression> grouping = mapAll(groupingExpressions, f);
        List<NamedExpression> aggregates = mapAll(aggregateExpressions, f);
        if (grouping == groupingExpressions && aggregates == aggregateExpressions) {
            return this;
        }
        return new Aggregate(child(), grouping, aggregates);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return new Aggregate(newChildren.get(0), groupingExpressions, aggregateExpressions);
    }

    @Override
    protected List<Object> args() {
        return List.of(groupingExpressions, aggregateExpressions);
    }

    @Override
    public String argString() {
        return groupingExpressions + ", " + aggregateExpressions;
    }
}
