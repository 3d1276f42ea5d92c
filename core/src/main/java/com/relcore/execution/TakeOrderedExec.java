package com.relcore.execution;

import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expressions;
import com.relcore.expression.SortOrder;
import com.relcore.row.Row;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Returns the first {@code limit} rows of the input under an ordering, as a
 * single partition. Planned for a limit directly above a global sort.
 */
public final class TakeOrderedExec extends PhysicalPlan {

    private final int limit;
    private final List<SortOrder> order;

    public TakeOrderedExec(int limit, List<SortOrder> order, PhysicalPlan child) {
        super(child);
        this.limit = limit;
        this.order = List.copyOf(order);
    }

    public int limit() {
        return limit;
    }

    public List<SortOrder> order() {
        return order;
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
        return Partitioning.SinglePartition.INSTANCE;
    }

    @Override
    public List<Iterator<Row>> execute() {
        Comparator<Row> ordering = SortOrder.ordering(Expressions.bindReferences(order, child().output()));
        List<Row> top = child().execute().stream()
            .flatMap(RowIterators::stream)
            .sorted(ordering)
            .limit(limit)
            .collect(Collectors.toList());
        return List.of(top.iterator());
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new TakeOrderedExec(limit, order, newChildren.get(0));
    }

    @Override
    public String argString() {
        return limit + ", " + order;
    }
}
