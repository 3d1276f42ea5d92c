package com.relcore.execution.joins;

import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.RowIterators;
import com.relcore.expression.AttributeReference;
import com.relcore.row.Row;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Pairs every left row with every right row.
 */
public final class CartesianProductExec extends PhysicalPlan {

    public CartesianProductExec(PhysicalPlan left, PhysicalPlan right) {
        super(List.of(left, right));
    }

    public PhysicalPlan left() {
        return children.get(0);
    }

    public PhysicalPlan right() {
        return children.get(1);
    }

    @Override
    public List<AttributeReference> output() {
        List<AttributeReference> output = new ArrayList<>(left().output());
        output.addAll(right().output());
        return output;
    }

    @Override
    public List<Iterator<Row>> execute() {
        List<Row> rightRows = right().executeCollect();
        return RowIterators.mapPartitions(left().execute(), rows -> RowIterators.stream(rows)
            .flatMap(leftRow -> rightRows.stream().map(leftRow::concat))
            .iterator());
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new CartesianProductExec(newChildren.get(0), newChildren.get(1));
    }

    @Override
    public String argString() {
        return "";
    }
}
