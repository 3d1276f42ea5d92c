package com.relcore.execution.joins;

import com.relcore.execution.Distribution;
import com.relcore.execution.Partitioning;
import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.RowIterators;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import com.relcore.row.Row;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Returns the left rows that have at least one matching right row, each once.
 */
public final class LeftSemiJoinHashExec extends PhysicalPlan {

    private final List<Expression> leftKeys;
    private final List<Expression> rightKeys;
    private final Expression condition;

    public LeftSemiJoinHashExec(List<Expression> leftKeys, List<Expression> rightKeys, Expression condition,
                                PhysicalPlan left, PhysicalPlan right) {
        super(List.of(left, right));
        this.leftKeys = List.copyOf(leftKeys);
        this.rightKeys = List.copyOf(rightKeys);
        this.condition = condition;
    }

    public PhysicalPlan left() {
        return children.get(0);
    }

    public PhysicalPlan right() {
        return children.get(1);
    }

    @Override
    public List<AttributeReference> output() {
        return left().output();
    }

    @Override
    public Partitioning outputPartitioning() {
        return left().outputPartitioning();
    }

    @Override
    public List<Distribution> requiredChildDistribution() {
        return List.of(new Distribution.ClusteredDistribution(leftKeys),
            new Distribution.ClusteredDistribution(rightKeys));
    }

    @Override
    public List<Iterator<Row>> execute() {
        List<Iterator<Row>> leftPartitions = left().execute();
        List<Iterator<Row>> rightPartitions = right().execute();
        if (leftPartitions.size() != rightPartitions.size()) {
            throw new IllegalStateException("Join inputs have %d and %d partitions"
                .formatted(leftPartitions.size(), rightPartitions.size()));
        }
        Function<Row, Row> leftKey = RowIterators.projection(leftKeys, left().output());
        Function<Row, Row> rightKey = RowIterators.projection(rightKeys, right().output());
        Predicate<Row> residual = JoinOutput.residual(condition, left().output(), right().output());

        List<Iterator<Row>> result = new ArrayList<>(leftPartitions.size());
        for (int i = 0; i < leftPartitions.size(); i++) {
            HashedRelation hashed = HashedRelation.build(rightPartitions.get(i), rightKey);
            result.add(RowIterators.filter(leftPartitions.get(i), leftRow -> {
                for (Row rightRow : hashed.get(leftKey.apply(leftRow))) {
                    if (residual.test(leftRow.concat(rightRow))) {
                        return true;
                    }
                }
                return false;
            }));
        }
        return result;
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new LeftSemiJoinHashExec(leftKeys, rightKeys, condition, newChildren.get(0), newChildren.get(1));
    }

    @Override
    public String argString() {
        String keys = leftKeys + ", " + rightKeys;
        return condition == null ? keys : keys + ", " + condition;
    }
}
