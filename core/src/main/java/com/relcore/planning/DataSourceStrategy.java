package com.relcore.planning;

import com.relcore.execution.DataSourceScanExec;
import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.RowIterators;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.BinaryExpression;
import com.relcore.expression.Expression;
import com.relcore.expression.Literal;
import com.relcore.expression.UnaryExpression;
import com.relcore.logical.LogicalPlan;
import com.relcore.sources.BaseRelation;
import com.relcore.sources.LogicalRelation;
import com.relcore.sources.PrunedFilteredScan;
import com.relcore.sources.PrunedScan;
import com.relcore.sources.SourceFilter;
import com.relcore.sources.TableScan;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plans scans of external relations, pushing column pruning and simple filters
 * into the relation as far as its scan interface allows.
 */
final class DataSourceStrategy implements Strategy {

    private final SessionPlanner planner;

    DataSourceStrategy(SessionPlanner planner) {
        this.planner = planner;
    }

    @Override
    public List<PhysicalPlan> apply(LogicalPlan plan) {
        PhysicalOperation operation = PhysicalOperation.of(plan);
        if (!(operation.child() instanceof LogicalRelation)) {
            return List.of();
        }
        LogicalRelation logical = (LogicalRelation) operation.child();
        BaseRelation relation = logical.relation();
        boolean codegen = planner.codegenEnabled();
        String description = relation.getClass().getSimpleName();

        if (relation instanceof PrunedFilteredScan) {
            PrunedFilteredScan scan = (PrunedFilteredScan) relation;
            Map<Expression, SourceFilter> translated = new IdentityHashMap<>();
            for (Expression predicate : operation.filters()) {
                translate(predicate).ifPresent(filter -> translated.put(predicate, filter));
            }
            List<SourceFilter> pushed = new ArrayList<>(translated.values());
            List<SourceFilter> unhandled = relation.unhandledFilters(pushed);
            return List.of(planner.pruneFilterProject(
                operation.projectList(),
                operation.filters(),
                filters -> {
                    List<Expression> remaining = new ArrayList<>();
                    for (Expression filter : filters) {
                        SourceFilter source = translated.get(filter);
                        if (source == null || unhandled.contains(source)) {
                            remaining.add(filter);
                        }
                    }
                    return remaining;
                },
                attributes -> new DataSourceScanExec(attributes,
                    () -> scan.buildScan(names(attributes), pushed), description, codegen)));
        }
        if (relation instanceof PrunedScan) {
            PrunedScan scan = (PrunedScan) relation;
            return List.of(planner.pruneFilterProject(
                operation.projectList(),
                operation.filters(),
                filters -> filters,
                attributes -> new DataSourceScanExec(attributes,
                    () -> scan.buildScan(names(attributes)), description, codegen)));
        }
        if (relation instanceof TableScan) {
            TableScan scan = (TableScan) relation;
            List<AttributeReference> relationOutput = logical.output();
            return List.of(planner.pruneFilterProject(
                operation.projectList(),
                operation.filters(),
                filters -> filters,
                attributes -> new DataSourceScanExec(attributes,
                    () -> RowIterators.map(scan.buildScan(), RowIterators.columnPruning(attributes, relationOutput)),
                    description, codegen)));
        }
        return List.of();
    }

    private static List<String> names(List<AttributeReference> attributes) {
        List<String> names = new ArrayList<>(attributes.size());
        for (AttributeReference attribute : attributes) {
            names.add(attribute.name());
        }
        return names;
    }

    /**
     * Translates a predicate comparing a column with a constant.
     *
     * @param predicate the predicate
     * @return the source filter, empty if the predicate has no equivalent
     */
    static Optional<SourceFilter> translate(Expression predicate) {
        if (predicate instanceof UnaryExpression) {
            UnaryExpression unary = (UnaryExpression) predicate;
            if (!(unary.child() instanceof AttributeReference)) {
                return Optional.empty();
            }
            String name = ((AttributeReference) unary.child()).name();
            switch (unary.operator()) {
                case IS_NULL:
                    return Optional.of(new SourceFilter.IsNull(name));
                case IS_NOT_NULL:
                    return Optional.of(new SourceFilter.IsNotNull(name));
                default:
                    return Optional.empty();
            }
        }
        if (!(predicate instanceof BinaryExpression)) {
            return Optional.empty();
        }
        BinaryExpression binary = (BinaryExpression) predicate;
        BinaryExpression.Operator operator = binary.operator();
        Expression attributeSide = binary.left();
        Expression literalSide = binary.right();
        if (binary.left() instanceof Literal && binary.right() instanceof AttributeReference) {
            operator = operator.flip();
            attributeSide = binary.right();
            literalSide = binary.left();
        }
        if (!(attributeSide instanceof AttributeReference) || !(literalSide instanceof Literal)) {
            return Optional.empty();
        }
        Object value = ((Literal) literalSide).value();
        if (value == null) {
            return Optional.empty();
        }
        String name = ((AttributeReference) attributeSide).name();
        switch (operator) {
            case EQUAL:
                return Optional.of(new SourceFilter.EqualTo(name, value));
            case GREATER_THAN:
                return Optional.of(new SourceFilter.GreaterThan(name, value));
            case GREATER_THAN_OR_EQUAL:
                return Optional.of(new SourceFilter.GreaterThanOrEqual(name, value));
            case LESS_THAN:
                return Optional.of(new SourceFilter.LessThan(name, value));
            case LESS_THAN_OR_EQUAL:
                return Optional.of(new SourceFilter.LessThanOrEqual(name, value));
            default:
                return Optional.empty();
        }
    }
}
