package com.relcore.execution;

import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expressions;
import com.relcore.expression.SortOrder;
import com.relcore.row.Row;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Sorts each partition. A global sort requires its input range partitioned by
 * the same ordering, so the concatenated partitions are totally ordered.
 */
public final class SortExec extends PhysicalPlan {

    private final List<SortOrder> order;
    private final boolean global;

    public SortExec(List<SortOrder> order, boolean global, PhysicalPlan child) {
        super(child);
        this.order = List.copyOf(order);
        this.global = global;
    }

    public List<SortOrder> order() {
        return order;
    }

    public boolean global() {
        return global;
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
    public List<Distribution> requiredChildDistribution() {
        return List.of(global
            ? new Distribution.OrderedDistribution(order)
            : Distribution.UnspecifiedDistribution.INSTANCE);
    }

    @Override
    public List<Iterator<Row>> execute() {
        Comparator<Row> ordering = SortOrder.ordering(Expressions.bindReferences(order, child().output()));
        return RowIterators.mapPartitions(child().execute(),
            rows -> RowIterators.stream(rows).sorted(ordering).iterator());
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new SortExec(order, global, newChildren.get(0));
    }

    @Override
    public String argString() {
        return order + ", " + global;
    }
}
