package com.relcore.optimizer;

import com.relcore.expression.AttributeSet;
import com.relcore.expression.Expression;
import com.relcore.expression.Expressions;
import com.relcore.logical.Filter;
import com.relcore.logical.Join;
import com.relcore.logical.LogicalPlan;
import com.relcore.rules.Rule;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pushes the conjuncts of a filter over an inner join, and of the inner join's
 * own condition, into the side whose output they reference. Conjuncts that
 * reference both sides become part of the join condition.
 */
public final class PushPredicateThroughJoin implements Rule<LogicalPlan> {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformDown(node -> {
            if (node instanceof Filter && ((Filter) node).child() instanceof Join) {
                Filter filter = (Filter) node;
                Join join = (Join) filter.child();
                if (join.joinType() == Join.JoinType.INNER) {
                    List<Expression> predicates =
                        new ArrayList<>(Expressions.splitConjunctivePredicates(filter.condition()));
                    join.condition().ifPresent(c -> predicates.addAll(Expressions.splitConjunctivePredicates(c)));
                    return pushDown(join, predicates);
                }
            }
            if (node instanceof Join && ((Join) node).joinType() == Join.JoinType.INNER) {
                Join join = (Join) node;
                if (join.condition().isPresent()) {
                    List<Expression> predicates = Expressions.splitConjunctivePredicates(join.condition().get());
                    LogicalPlan pushed = pushDown(join, predicates);
                    return pushed instanceof Join && sameShape((Join) pushed, join) ? join : pushed;
                }
            }
            return node;
        });
    }

    private static boolean sameShape(Join pushed, Join original) {
        return pushed.left() == original.left() && pushed.right() == original.right();
    }

    private static LogicalPlan pushDown(Join join, List<Expression> predicates) {
        AttributeSet leftOutput = AttributeSet.fromAttributes(join.left().output());
        AttributeSet rightOutput = AttributeSet.fromAttributes(join.right().output());
        List<Expression> leftPredicates = new ArrayList<>();
        List<Expression> rightPredicates = new ArrayList<>();
        List<Expression> common = new ArrayList<>();
        for (Expression predicate : predicates) {
            AttributeSet references = predicate.references();
            if (!references.isEmpty() && references.subsetOf(leftOutput)) {
                leftPredicates.add(predicate);
            } else if (!references.isEmpty() && references.subsetOf(rightOutput)) {
                rightPredicates.add(predicate);
            } else {
                common.add(predicate);
            }
        }
        LogicalPlan left = withFilter(join.left(), leftPredicates);
        LogicalPlan right = withFilter(join.right(), rightPredicates);
        return new Join(left, right, Join.JoinType.INNER, Expressions.and(common).orElse(null));
    }

    private static LogicalPlan withFilter(LogicalPlan child, List<Expression> predicates) {
        Optional<Expression> condition = Expressions.and(predicates);
        return condition.isPresent() ? new Filter(child, condition.get()) : child;
    }
}
