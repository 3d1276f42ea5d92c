package com.relcore.optimizer;

import com.relcore.logical.LogicalPlan;
import com.relcore.logical.Subquery;
import com.relcore.rules.Rule;

/**
 * Removes {@link Subquery} nodes, which only matter for name resolution.
 */
public final class EliminateSubqueries implements Rule<LogicalPlan> {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformUp(node -> node instanceof Subquery ? ((Subquery) node).child() : node);
    }
}
