package com.relcore.execution.joins;

import com.relcore.execution.Distribution;
import com.relcore.execution.PhysicalPlan;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import com.relcore.logical.Join.JoinType;
import com.relcore.row.Row;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Joins by testing the condition on every pair, broadcasting the right side to
 * every left partition. Handles every join type and any condition.
 *
 * <p>Right and full outer joins must see every left row before they know which
 * right rows are unmatched, so they require the left side in one partition.
 */
public final class NestedLoopJoinExec extends PhysicalPlan {

    private final JoinType joinType;
    private final Expression condition;

    public NestedLoopJoinExec(JoinType joinType, Expression condition, PhysicalPlan left, PhysicalPlan right) {
        super(List.of(left, right));
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.condition = condition;
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
    public List<Distribution> requiredChildDistribution() {
        Distribution leftDistribution = joinType == JoinType.RIGHT || joinType == JoinType.FULL
            ? Distribution.AllTuples.INSTANCE
            : Distribution.UnspecifiedDistribution.INSTANCE;
        return List.of(leftDistribution, Distribution.UnspecifiedDistribution.INSTANCE);
    }

    @Override
    public List<Iterator<Row>> execute() {
        List<Row> broadcast = right().executeCollect();
        Predicate<Row> predicate = JoinOutput.residual(condition, left().output(), right().output());
        int leftWidth = left().output().size();
        int rightWidth = right().output().size();

        List<Iterator<Row>> result = new ArrayList<>();
        for (Iterator<Row> streamed : left().execute()) {
            boolean[] rightMatched = new boolean[broadcast.size()];
            List<Row> joined = new ArrayList<>();
            while (streamed.hasNext()) {
                Row leftRow = streamed.next();
                boolean matched = false;
                for (int i = 0; i < broadcast.size(); i++) {
                    Row candidate = leftRow.concat(broadcast.get(i));
                    if (predicate.test(candidate)) {
                        matched = true;
                        rightMatched[i] = true;
                        if (joinType == JoinType.LEFT_SEMI) {
                            break;
                        }
                        joined.add(candidate);
                    }
                }
                if (joinType == JoinType.LEFT_SEMI && matched) {
                    joined.add(leftRow);
                } else if (!matched && (joinType == JoinType.LEFT || joinType == JoinType.FULL)) {
                    joined.add(leftRow.concat(Row.nulls(rightWidth)));
                }
            }
            if (joinType == JoinType.RIGHT || joinType == JoinType.FULL) {
                for (int i = 0; i < broadcast.size(); i++) {
                    if (!rightMatched[i]) {
                        joined.add(Row.nulls(leftWidth).concat(broadcast.get(i)));
                    }
                }
            }
            result.add(joined.iterator());
        }
        return result;
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new NestedLoopJoinExec(joinType, condition, newChildren.get(0), newChildren.get(1));
    }

    @Override
    public String argString() {
        return condition == null ? joinType.name() : joinType + ", " + condition;
    }
}
