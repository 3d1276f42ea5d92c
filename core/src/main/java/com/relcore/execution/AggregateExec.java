package com.relcore.execution;

import com.relcore.expression.AggregateFunction;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.BoundReference;
import com.relcore.expression.Expression;
import com.relcore.expression.Expressions;
import com.relcore.expression.NamedExpression;
import com.relcore.row.Row;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Hash-based grouping aggregation.
 *
 * <p>Input must be clustered by the grouping expressions, so each group is
 * complete within one partition; a global aggregate needs all rows in a single
 * partition and always produces exactly one row.
 */
public final class AggregateExec extends PhysicalPlan {

    private final List<Expression> groupingExpressions;
    private final List<NamedExpression> aggregateExpressions;

    public AggregateExec(List<Expression> groupingExpressions,
                         List<NamedExpression> aggregateExpressions,
                         PhysicalPlan child) {
        super(child);
        this.groupingExpressions = List.copyOf(groupingExpressions);
        this.aggregateExpressions = List.copyOf(aggregateExpressions);
    }

    public List<Expression> groupingExpressions() {
        return groupingExpressions;
    }

    public List<NamedExpression> aggregateExpressions() {
        return aggregateExpressions;
    }

    public PhysicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        return Expressions.toAttributes(aggregateExpressions);
    }

    @Override
    public Partitioning outputPartitioning() {
        return child().outputPartitioning();
    }

    @Override
    public List<Distribution> requiredChildDistribution() {
        return List.of(groupingExpressions.isEmpty()
            ? Distribution.AllTuples.INSTANCE
            : new Distribution.ClusteredDistribution(groupingExpressions));
    }

    @Override
    public List<Iterator<Row>> execute() {
        List<AttributeReference> input = child().output();

        // Distinct aggregate functions; their results follow the grouping values in the buffer row.
        List<AggregateFunction> functions = new ArrayList<>();
        for (NamedExpression expression : aggregateExpressions) {
            for (Expression e : expression.collect(x -> x instanceof AggregateFunction)) {
                if (!functions.contains(e)) {
                    functions.add((AggregateFunction) e);
                }
            }
        }
        List<AggregateFunction> boundFunctions = Expressions.bindReferences(functions, input);
        Function<Row, Row> groupingProjection = RowIterators.projection(groupingExpressions, input);
        List<Expression> resultExpressions = new ArrayList<>();
        for (NamedExpression expression : aggregateExpressions) {
            resultExpressions.add(rewriteForResult(expression, functions));
        }

        return RowIterators.mapPartitions(child().execute(),
            rows -> aggregate(rows, groupingProjection, boundFunctions, resultExpressions));
    }

    private Expression rewriteForResult(Expression expression, List<AggregateFunction> functions) {
        return expression.transformDown(e -> {
            int grouping = groupingExpressions.indexOf(e);
            if (grouping >= 0) {
                return new BoundReference(grouping, e.dataType(), e.nullable());
            }
            if (e instanceof AggregateFunction) {
                int ordinal = groupingExpressions.size() + functions.indexOf(e);
                return new BoundReference(ordinal, e.dataType(), e.nullable());
            }
            return e;
        });
    }

    private Iterator<Row> aggregate(Iterator<Row> rows,
                                    Function<Row, Row> groupingProjection,
                                    List<AggregateFunction> functions,
                                    List<Expression> resultExpressions) {
        Map<Row, List<AggregateFunction.Buffer>> groups = new LinkedHashMap<>();
        while (rows.hasNext()) {
            Row row = rows.next();
            List<AggregateFunction.Buffer> buffers =
                groups.computeIfAbsent(groupingProjection.apply(row), key -> newBuffers(functions));
            for (int i = 0; i < functions.size(); i++) {
                buffers.get(i).update(functions.get(i).child().eval(row));
            }
        }
        if (groups.isEmpty() && groupingExpressions.isEmpty()) {
            groups.put(Row.EMPTY, newBuffers(functions));
        }

        List<Row> result = new ArrayList<>(groups.size());
        for (Map.Entry<Row, List<AggregateFunction.Buffer>> group : groups.entrySet()) {
            List<Object> values = new ArrayList<>(group.getKey().values());
            for (AggregateFunction.Buffer buffer : group.getValue()) {
                values.add(buffer.result());
            }
            Row buffered = Row.fromList(values);
            Object[] output = new Object[resultExpressions.size()];
            for (int i = 0; i < output.length; i++) {
                output[i] = resultExpressions.get(i).eval(buffered);
            }
            result.add(Row.of(output));
        }
        return result.iterator();
    }

    private static List<AggregateFunction.Buffer> newBuffers(List<AggregateFunction> functions) {
        List<AggregateFunction.Buffer> buffers = new ArrayList<>(functions.size());
        for (AggregateFunction function : functions) {
            buffers.add(function.newBuffer());
        }
        return buffers;
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new AggregateExec(groupingExpressions, aggregateExpressions, newChildren.get(0));
    }

    @Override
    public String argString() {
        return groupingExpressions + ", " + aggregateExpressions;
    }
}
