package com.relcore.execution;

import com.relcore.expression.AttributeReference;
import com.relcore.row.Row;
import java.util.Iterator;
import java.util.List;

/**
 * Returns the first {@code limit} rows, reading the input partitions in order,
 * as a single partition.
 */
public final class LimitExec extends PhysicalPlan {

    private final int limit;

    public LimitExec(int limit, PhysicalPlan child) {
        super(child);
        this.limit = limit;
    }

    public int limit() {
        return limit;
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
        List<Iterator<Row>> partitions = child().execute();
        Iterator<Row> concatenated = partitions.stream()
            .flatMap(RowIterators::stream)
            .iterator();
        return List.of(RowIterators.limit(concatenated, limit));
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new LimitExec(limit, newChildren.get(0));
    }

    @Override
    public String argString() {
        return String.valueOf(limit);
    }
}
