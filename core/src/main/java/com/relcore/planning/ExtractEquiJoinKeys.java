package com.relcore.planning;

import com.relcore.expression.AttributeSet;
import com.relcore.expression.BinaryExpression;
import com.relcore.expression.Expression;
import com.relcore.expression.Expressions;
import com.relcore.logical.Join;
import com.relcore.logical.Join.JoinType;
import com.relcore.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a join condition into equality keys and a residual condition.
 *
 * <p>A conjunct {@code a = b} is a key pair when one side references only the
 * left input and the other only the right input.
 *
 * @param joinType the join type
 * @param leftKeys key expressions over the left input
 * @param rightKeys key expressions over the right input, in matching order
 * @param condition the remaining conjuncts, or null
 * @param left the left input
 * @param right the right input
 */
public record ExtractEquiJoinKeys(JoinType joinType,
                                  List<Expression> leftKeys,
                                  List<Expression> rightKeys,
                                  Expression condition,
                                  LogicalPlan left,
                                  LogicalPlan right) {

    /**
     * Extracts the keys of a join.
     *
     * @param plan a plan
     * @return the keys, empty if the plan is not a join with at least one key pair
     */
    public static Optional<ExtractEquiJoinKeys> unapply(LogicalPlan plan) {
        if (!(plan instanceof Join)) {
            return Optional.empty();
        }
        Join join = (Join) plan;
        if (join.condition().isEmpty()) {
            return Optional.empty();
        }
        AttributeSet leftOutput = AttributeSet.fromAttributes(join.left().output());
        AttributeSet rightOutput = AttributeSet.fromAttributes(join.right().output());
        List<Expression> leftKeys = new ArrayList<>();
        List<Expression> rightKeys = new ArrayList<>();
        List<Expression> residual = new ArrayList<>();
        for (Expression predicate : Expressions.splitConjunctivePredicates(join.condition().get())) {
            if (predicate instanceof BinaryExpression
                    && ((BinaryExpression) predicate).operator() == BinaryExpression.Operator.EQUAL) {
                BinaryExpression equality = (BinaryExpression) predicate;
                if (canEvaluate(equality.left(), leftOutput) && canEvaluate(equality.right(), rightOutput)) {
                    leftKeys.add(equality.left());
                    rightKeys.add(equality.right());
                    continue;
                }
                if (canEvaluate(equality.left(), rightOutput) && canEvaluate(equality.right(), leftOutput)) {
                    leftKeys.add(equality.right());
                    rightKeys.add(equality.left());
                    continue;
                }
            }
            residual.add(predicate);
        }
        if (leftKeys.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ExtractEquiJoinKeys(join.joinType(), leftKeys, rightKeys,
            Expressions.and(residual).orElse(null), join.left(), join.right()));
    }

    private static boolean canEvaluate(Expression expression, AttributeSet input) {
        AttributeSet references = expression.references();
        return !references.isEmpty() && references.subsetOf(input);
    }
}
