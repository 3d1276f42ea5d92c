package com.relcore.analysis;

import com.relcore.logical.Hint;
import com.relcore.logical.LogicalPlan;
import com.relcore.rules.Rule;

/**
 * Removes hint markers from an analyzed plan.
 */
public final class RemoveHints implements Rule<LogicalPlan> {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformUp(node -> node instanceof Hint ? ((Hint) node).child() : node);
    }
}
