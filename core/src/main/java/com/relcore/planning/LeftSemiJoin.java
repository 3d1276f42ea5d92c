package com.relcore.planning;

import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.joins.LeftSemiJoinHashExec;
import com.relcore.logical.Join.JoinType;
import com.relcore.logical.LogicalPlan;
import java.util.List;
import java.util.Optional;

/**
 * Plans left semi joins with at least one equality key as hash joins.
 */
final class LeftSemiJoin implements Strategy {

    private final SessionPlanner planner;

    LeftSemiJoin(SessionPlanner planner) {
        this.planner = planner;
    }

    @Override
    public List<PhysicalPlan> apply(LogicalPlan plan) {
        Optional<ExtractEquiJoinKeys> keys = ExtractEquiJoinKeys.unapply(plan);
        if (keys.isEmpty() || keys.get().joinType() != JoinType.LEFT_SEMI) {
            return List.of();
        }
        ExtractEquiJoinKeys join = keys.get();
        return List.of(new LeftSemiJoinHashExec(join.leftKeys(), join.rightKeys(), join.condition(),
            planner.planLater(join.left()), planner.planLater(join.right())));
    }
}
