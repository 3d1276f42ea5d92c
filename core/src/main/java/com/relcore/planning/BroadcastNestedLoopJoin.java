package com.relcore.planning;

import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.joins.NestedLoopJoinExec;
import com.relcore.logical.Join;
import com.relcore.logical.LogicalPlan;
import java.util.List;

/**
 * Fallback for joins no other strategy handles: outer and semi joins without
 * equality keys.
 */
final class BroadcastNestedLoopJoin implements Strategy {

    private final SessionPlanner planner;

    BroadcastNestedLoopJoin(SessionPlanner planner) {
        this.planner = planner;
    }

    @Override
    public List<PhysicalPlan> apply(LogicalPlan plan) {
        if (!(plan instanceof Join)) {
            return List.of();
        }
        Join join = (Join) plan;
        return List.of(new NestedLoopJoinExec(join.joinType(), join.condition().orElse(null),
            planner.planLater(join.left()), planner.planLater(join.right())));
    }
}
