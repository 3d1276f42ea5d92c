package com.relcore.planning;

import com.relcore.execution.AggregateExec;
import com.relcore.execution.PhysicalPlan;
import com.relcore.logical.Aggregate;
import com.relcore.logical.LogicalPlan;
import java.util.List;

final class HashAggregation implements Strategy {

    private final SessionPlanner planner;

    HashAggregation(SessionPlanner planner) {
        this.planner = planner;
    }

    @Override
    public List<PhysicalPlan> apply(LogicalPlan plan) {
        if (!(plan instanceof Aggregate)) {
            return List.of();
        }
        Aggregate aggregate = (Aggregate) plan;
        return List.of(new AggregateExec(
            aggregate.groupingExpressions(),
            aggregate.aggregateExpressions(),
            planner.planLater(aggregate.child())));
    }
}
