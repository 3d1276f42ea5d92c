package com.relcore.session;

import com.relcore.expression.Expression;
import com.relcore.expression.NamedExpression;
import com.relcore.logical.Aggregate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A data frame grouped by a list of expressions, waiting for its aggregates.
 *
 * <p>The output of an aggregation holds the grouping columns followed by the
 * aggregates.
 */
public class GroupedData {

    private final DataFrame df;
    private final List<Expression> groupingExpressions;

    GroupedData(DataFrame df, List<Expression> groupingExpressions) {
        this.df = df;
        this.groupingExpressions = List.copyOf(groupingExpressions);
    }

    public DataFrame agg(Expression... aggregates) {
        List<Expression> output = new ArrayList<>(groupingExpressions);
        output.addAll(Arrays.asList(aggregates));
        List<NamedExpression> aggregateExpressions = DataFrame.named(output);
        return df.withPlan(new Aggregate(df.logicalPlan(), groupingExpressions, aggregateExpressions));
    }

    /**
     * Counts the rows of each group into a column named {@code count}.
     *
     * @return the counts
     */
    public DataFrame count() {
        return agg(Functions.alias(Functions.count(Functions.lit(1)), "count"));
    }
}
