package com.relcore.planning;

import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.TakeOrderedExec;
import com.relcore.logical.Limit;
import com.relcore.logical.LogicalPlan;
import com.relcore.logical.Sort;
import java.util.List;

/**
 * Plans a limit over a global sort as a top-k.
 */
final class TakeOrdered implements Strategy {

    private final SessionPlanner planner;

    TakeOrdered(SessionPlanner planner) {
        this.planner = planner;
    }

    @Override
    public List<PhysicalPlan> apply(LogicalPlan plan) {
        if (plan instanceof Limit && ((Limit) plan).child() instanceof Sort) {
            Limit limit = (Limit) plan;
            Sort sort = (Sort) limit.child();
            if (sort.global()) {
                return List.of(new TakeOrderedExec(limit.limit(), sort.order(), planner.planLater(sort.child())));
            }
        }
        return List.of();
    }
}
