package com.relcore.planning;

import com.relcore.expression.Alias;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.ExprId;
import com.relcore.expression.Expression;
import com.relcore.expression.Expressions;
import com.relcore.expression.NamedExpression;
import com.relcore.logical.Filter;
import com.relcore.logical.LogicalPlan;
import com.relcore.logical.Project;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The projections and filters stacked directly above a plan node, collapsed
 * into one projection list and one list of conjunctive filters.
 *
 * <p>Aliases defined by a lower projection are substituted into the
 * expressions above it, so both lists refer to the output of {@link #child()}
 * only.
 *
 * @param projectList the output expressions
 * @param filters the conjuncts to apply to the child output
 * @param child the first node below the chain that is neither a projection nor a filter
 */
public record PhysicalOperation(List<NamedExpression> projectList, List<Expression> filters, LogicalPlan child) {

    /**
     * Collects the projections and filters above {@code plan}. A plan with
     * neither yields its own output and no filters.
     *
     * @param plan the plan
     * @return the collapsed operation
     */
    public static PhysicalOperation of(LogicalPlan plan) {
        Collected collected = collect(plan);
        List<NamedExpression> projectList = collected.fields != null
            ? collected.fields
            : new ArrayList<>(collected.child.output());
        return new PhysicalOperation(projectList, collected.filters, collected.child);
    }

    private static Collected collect(LogicalPlan plan) {
        if (plan instanceof Project) {
            Project project = (Project) plan;
            Collected below = collect(project.child());
            List<NamedExpression> fields = new ArrayList<>();
            for (NamedExpression field : project.projectList()) {
                fields.add(substitute(field, below.aliases));
            }
            return new Collected(fields, below.filters, below.child, aliases(fields));
        }
        if (plan instanceof Filter) {
            Filter filter = (Filter) plan;
            Collected below = collect(filter.child());
            List<Expression> filters = new ArrayList<>(below.filters);
            Expression condition = substituteReferences(filter.condition(), below.aliases);
            filters.addAll(Expressions.splitConjunctivePredicates(condition));
            return new Collected(below.fields, filters, below.child, below.aliases);
        }
        return new Collected(null, new ArrayList<>(), plan, new HashMap<>());
    }

    private static Map<ExprId, Expression> aliases(List<NamedExpression> fields) {
        Map<ExprId, Expression> aliases = new HashMap<>();
        for (NamedExpression field : fields) {
            if (field instanceof Alias) {
                aliases.put(field.exprId(), ((Alias) field).child());
            }
        }
        return aliases;
    }

    private static NamedExpression substitute(NamedExpression field, Map<ExprId, Expression> aliases) {
        if (aliases.isEmpty()) {
            return field;
        }
        if (field instanceof AttributeReference) {
            Expression aliased = aliases.get(field.exprId());
            return aliased == null
                ? field
                : new Alias(aliased, field.name(), field.exprId(), field.qualifiers());
        }
        if (field instanceof Alias) {
            Alias alias = (Alias) field;
            Expression child = substituteReferences(alias.child(), aliases);
            return child == alias.child()
                ? alias
                : new Alias(child, alias.name(), alias.exprId(), alias.qualifiers());
        }
        return field;
    }

    private static Expression substituteReferences(Expression expression, Map<ExprId, Expression> aliases) {
        if (aliases.isEmpty()) {
            return expression;
        }
        return expression.transformUp(e -> {
            if (e instanceof AttributeReference) {
                Expression aliased = aliases.get(((AttributeReference) e).exprId());
                return aliased == null ? e : aliased;
            }
            return e;
        });
    }

    private static final class Collected {
        final List<NamedExpression> fields;
        final List<Expression> filters;
        final LogicalPlan child;
        final Map<ExprId, Expression> aliases;

        Collected(List<NamedExpression> fields, List<Expression> filters, LogicalPlan child,
                  Map<ExprId, Expression> aliases) {
            this.fields = fields;
            this.filters = filters;
            this.child = child;
            this.aliases = aliases;
        }
    }
}
