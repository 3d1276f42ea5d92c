package com.relcore.execution.joins;

import com.relcore.execution.Distribution;
import com.relcore.execution.Partitioning;
import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.RowIterators;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import com.relcore.logical.Join.JoinType;
import com.relcore.row.Row;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Equi-join of two inputs clustered by their join keys.
 *
 * <p>Partition {@code i} of the right side is hashed and partition {@code i}
 * of the left side is streamed through it. Inner, left, right and full outer
 * joins are supported; an optional residual condition is evaluated on each
 * candidate pair.
 */
public final class ShuffledHashJoinExec extends PhysicalPlan {

    private final List<Expression> leftKeys;
    private final List<Expression> rightKeys;
    private final JoinType joinType;
    private final Expression condition;

    /**
     * Creates a hash join.
     *
     * @param leftKeys the join keys evaluated on the left side
     * @param rightKeys the join keys evaluated on the right side
     * @param joinType the join type, not {@code LEFT_SEMI}
     * @param condition residual condition over both sides, or null
     * @param left the left input
     * @param right the right input
     */
    public ShuffledHashJoinExec(List<Expression> leftKeys, List<Expression> rightKeys, JoinType joinType,
                                Expression condition, PhysicalPlan left, PhysicalPlan right) {
        super(List.of(left, right));
        this.leftKeys = List.copyOf(leftKeys);
        this.rightKeys = List.copyOf(rightKeys);
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.condition = condition;
        if (joinType == JoinType.LEFT_SEMI) {
            throw new IllegalArgumentException("Use LeftSemiJoinHashExec for left semi joins");
        }
    }

    public PhysicalPlan left() {
        return children.get(0);
    }

    public PhysicalPlan right() {
        return children.get(1);
    }

    public JoinType joinType() {
        return joinType;
    }

    @Override
    public List<AttributeReference> output() {
        return JoinOutput.of(left().output(), right().output(), joinType);
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
        int leftWidth = left().output().size();
        int rightWidth = right().output().size();

        List<Iterator<Row>> result = new ArrayList<>(leftPartitions.size());
        for (int i = 0; i < leftPartitions.size(); i++) {
            HashedRelation hashed = HashedRelation.build(rightPartitions.get(i), rightKey);
            result.add(joinPartition(leftPartitions.get(i), hashed, leftKey, residual, leftWidth, rightWidth));
        }
        return result;
    }

    private Iterator<Row> joinPartition(Iterator<Row> streamed, HashedRelation hashed, Function<Row, Row> leftKey,
                                        Predicate<Row> residual, int leftWidth, int rightWidth) {
        boolean keepUnmatchedLeft = joinType == JoinType.LEFT || joinType == JoinType.FULL;
        boolean keepUnmatchedRight = joinType == JoinType.RIGHT || joinType == JoinType.FULL;
        Map<Row, Boolean> matchedRight = new IdentityHashMap<>();
        List<Row> joined = new ArrayList<>();
        while (streamed.hasNext()) {
            Row leftRow = streamed.next();
            boolean matched = false;
            for (Row rightRow : hashed.get(leftKey.apply(leftRow))) {
                Row candidate = leftRow.concat(rightRow);
                if (residual.test(candidate)) {
                    joined.add(candidate);
                    matched = true;
                    matchedRight.put(rightRow, Boolean.TRUE);
                }
            }
            if (!matched && keepUnmatchedLeft) {
                joined.add(leftRow.concat(Row.nulls(rightWidth)));
            }
        }
        if (keepUnmatchedRight) {
            for (Row rightRow : hashed.rows()) {
                if (!matchedRight.containsKey(rightRow)) {
                    joined.add(Row.nulls(leftWidth).concat(rightRow));
                }
            }
        }
        return joined.iterator();
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new ShuffledHashJoinExec(leftKeys, rightKeys, joinType, condition,
            newChildren.get(0), newChildren.get(1));
    }

    @Override
    public String argString() {
        String keys = leftKeys + ", " + rightKeys + ", " + joinType;
        return condition == null ? keys : keys + ", " + condition;
    }
}
