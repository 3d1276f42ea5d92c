package com.relcore.planning;

import com.relcore.execution.PhysicalPlan;
import com.relcore.logical.LogicalPlan;
import java.util.List;

/**
 * Turns a logical operator into candidate physical operators.
 *
 * <p>A strategy returns an empty list for plans it does not handle. Children
 * are planned through {@link QueryPlanner#planLater(LogicalPlan)}.
 */
@FunctionalInterface
public interface Strategy {

    /**
     * Plans the root of a logical plan.
     *
     * @param plan the logical plan
     * @return the candidates, empty if this strategy does not apply
     */
    List<PhysicalPlan> apply(LogicalPlan plan);
}
