package com.relcore.planning;

import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.joins.ShuffledHashJoinExec;
import com.relcore.logical.Join.JoinType;
import com.relcore.logical.LogicalPlan;
import java.util.List;
import java.util.Optional;

/**
 * Plans inner and outer joins with at least one equality key as shuffled hash joins.
 */
final class HashJoin implements Strategy {

    private final SessionPlanner planner;

    HashJoin(SessionPlanner planner) {
        this.planner = planner;
    }

    @Override
    public List<PhysicalPlan> apply(LogicalPlan plan) {
        Optional<ExtractEquiJoinKeys> keys = ExtractEquiJoinKeys.unapply(plan);
        if (keys.isEmpty() || keys.get().joinType() == JoinType.LEFT_SEMI) {
            return List.of();
        }
        ExtractEquiJoinKeys join = keys.get();
        return List.of(new ShuffledHashJoinExec(join.leftKeys(), join.rightKeys(), join.joinType(),
            join.condition(), planner.planLater(join.left()), planner.planLater(join.right())));
    }
}
