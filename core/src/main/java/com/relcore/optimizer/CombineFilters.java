package com.relcore.optimizer;

import com.relcore.expression.BinaryExpression;
import com.relcore.logical.Filter;
import com.relcore.logical.LogicalPlan;
import com.relcore.rules.Rule;

/**
 * Merges adjacent filters into one filter on the conjunction of their conditions.
 */
public final class CombineFilters implements Rule<LogicalPlan> {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformDown(node -> {
            if (node instanceof Filter && ((Filter) node).child() instanceof Filter) {
                Filter outer = (Filter) node;
                Filter inner = (Filter) outer.child();
                return new Filter(inner.child(),
                    new BinaryExpression(inner.condition(), BinaryExpression.Operator.AND, outer.condition()));
            }
            return node;
        });
    }
}
