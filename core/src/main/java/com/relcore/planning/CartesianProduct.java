package com.relcore.planning;

import com.relcore.execution.FilterExec;
import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.joins.CartesianProductExec;
import com.relcore.logical.Join;
import com.relcore.logical.LogicalPlan;
import java.util.List;

/**
 * Plans inner joins without equality keys as a product, filtered by the
 * condition if there is one.
 */
final class CartesianProduct implements Strategy {

    private final SessionPlanner planner;

    CartesianProduct(SessionPlanner planner) {
        this.planner = planner;
    }

    @Override
    public List<PhysicalPlan> apply(LogicalPlan plan) {
        if (!(plan instanceof Join) || ((Join) plan).joinType() != Join.JoinType.INNER) {
            return List.of();
        }
        Join join = (Join) plan;
        PhysicalPlan product = new CartesianProductExec(planner.planLater(join.left()), planner.planLater(join.right()));
        return List.of(join.condition().isPresent() ? new FilterExec(join.condition().get(), product) : product);
    }
}
