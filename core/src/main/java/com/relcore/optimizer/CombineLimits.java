package com.relcore.optimizer;

import com.relcore.logical.Limit;
import com.relcore.logical.LogicalPlan;
import com.relcore.rules.Rule;

/**
 * Merges adjacent limits, keeping the smaller one.
 */
public final class CombineLimits implements Rule<LogicalPlan> {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformDown(node -> {
            if (node instanceof Limit && ((Limit) node).child() instanceof Limit) {
                Limit outer = (Limit) node;
                Limit inner = (Limit) outer.child();
                return new Limit(inner.child(), Math.min(outer.limit(), inner.limit()));
            }
            return node;
        });
    }
}
