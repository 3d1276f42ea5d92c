package com.relcore.analysis;

import com.relcore.exception.AnalysisException;
import com.relcore.expression.AggregateFunction;
import com.relcore.expression.Alias;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import com.relcore.expression.NamedExpression;
import com.relcore.logical.Aggregate;
import com.relcore.logical.Filter;
import com.relcore.logical.Join;
import com.relcore.logical.LogicalPlan;
import com.relcore.types.BooleanType;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Validates an analyzed plan, reporting the first problem found.
 *
 * <p>Nodes are checked bottom-up, so the error names the innermost offending
 * operator.
 */
public final class CheckAnalysis {

    private CheckAnalysis() {}

    /**
     * Checks that a plan is fully resolved and well typed.
     *
     * @param plan the analyzed plan
     * @throws AnalysisException describing the first problem found
     */
    public static void checkAnalysis(LogicalPlan plan) {
        for (LogicalPlan child : plan.children()) {
            checkAnalysis(child);
        }
        for (Expression expression : plan.expressions()) {
            checkExpression(expression, plan);
        }
        if (plan instanceof Filter) {
            checkBoolean("filter expression", ((Filter) plan).condition());
        } else if (plan instanceof Join) {
            Optional<Expression> condition = ((Join) plan).condition();
            if (condition.isPresent()) {
                checkBoolean("join condition", condition.get());
            }
        } else if (plan instanceof Aggregate) {
            Aggregate aggregate = (Aggregate) plan;
            for (NamedExpression expression : aggregate.aggregateExpressions()) {
                checkValidAggregateExpression(expression, aggregate.groupingExpressions());
            }
        }
        if (!plan.resolved()) {
            throw new AnalysisException("unresolved operator " + plan.simpleString());
        }
    }

    private static void checkExpression(Expression expression, LogicalPlan plan) {
        for (Expression child : expression.children()) {
            checkExpression(child, plan);
        }
        if (expression instanceof UnresolvedAttribute) {
            String inputColumns = plan.childrenOutput().stream()
                .map(AttributeReference::name)
                .collect(Collectors.joining(", "));
            throw new AnalysisException("cannot resolve '%s' given input columns %s"
                .formatted(((UnresolvedAttribute) expression).name(), inputColumns));
        }
        if (expression instanceof UnresolvedFunction) {
            throw new AnalysisException("undefined function " + ((UnresolvedFunction) expression).name());
        }
        if (!expression.resolved()) {
            throw new AnalysisException("cannot resolve '%s'".formatted(expression));
        }
        Optional<String> typeError = expression.checkInputDataTypes();
        if (typeError.isPresent()) {
            throw new AnalysisException("cannot resolve '%s' due to data type mismatch: %s"
                .formatted(expression, typeError.get()));
        }
    }

    private static void checkBoolean(String what, Expression condition) {
        if (!(condition.dataType() instanceof BooleanType)) {
            throw new AnalysisException("%s '%s' of type %s is not a boolean"
                .formatted(what, condition, condition.dataType().typeName()));
        }
    }

    private static void checkValidAggregateExpression(Expression expression, List<Expression> grouping) {
        if (expression instanceof AggregateFunction) {
            return;
        }
        if (expression instanceof Alias) {
            checkValidAggregateExpression(((Alias) expression).child(), grouping);
            return;
        }
        if (grouping.contains(expression)) {
            return;
        }
        if (expression instanceof AttributeReference) {
            throw new AnalysisException(
                "expression '%s' is neither present in the group by, nor is it an aggregate function"
                    .formatted(expression));
        }
        for (Expression child : expression.children()) {
            checkValidAggregateExpression(child, grouping);
        }
    }
}
