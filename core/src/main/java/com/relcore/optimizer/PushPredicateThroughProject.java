package com.relcore.optimizer;

import com.relcore.expression.Alias;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.ExprId;
import com.relcore.expression.Expression;
import com.relcore.expression.NamedExpression;
import com.relcore.logical.Filter;
import com.relcore.logical.LogicalPlan;
import com.relcore.logical.Project;
import com.relcore.rules.Rule;
import java.util.HashMap;
import java.util.Map;

/**
 * Moves a filter below the projection it sits on, substituting aliased
 * expressions into the condition.
 */
public final class PushPredicateThroughProject implements Rule<LogicalPlan> {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformDown(node -> {
            if (node instanceof Filter && ((Filter) node).child() instanceof Project) {
                Filter filter = (Filter) node;
                Project project = (Project) filter.child();
                Map<ExprId, Expression> aliases = new HashMap<>();
                for (NamedExpression expression : project.projectList()) {
                    if (expression instanceof Alias) {
                        aliases.put(expression.exprId(), ((Alias) expression).child());
                    }
                }
                Expression condition = filter.condition().transformUp(e -> {
                    if (e instanceof AttributeReference) {
                        Expression aliased = aliases.get(((AttributeReference) e).exprId());
                        return aliased == null ? e : aliased;
                    }
                    return e;
                });
                return new Project(new Filter(project.child(), condition), project.projectList());
            }
            return node;
        });
    }
}
