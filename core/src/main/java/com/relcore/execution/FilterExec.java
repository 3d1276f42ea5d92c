package com.relcore.execution;

import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import com.relcore.row.Row;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Keeps the rows for which the condition is true.
 */
public final class FilterExec extends PhysicalPlan {

    private final Expression condition;

    public FilterExec(Expression condition, PhysicalPlan child) {
        super(child);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public Expression condition() {
        return condition;
    }

    public PhysicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public Partitioning outputPartitioning() {
        return child().outputPartitioning();
    }

    @Override
    public List<Iterator<Row>> execute() {
        Predicate<Row> predicate = RowIterators.predicate(condition, child().output());
        return RowIterators.mapPartitions(child().execute(), rows -> RowIterators.filter(rows, predicate));
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new FilterExec(condition, newChildren.get(0));
    }

    @Override
    public String argString() {
        return condition.toString();
    }
}
