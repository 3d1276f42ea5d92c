package com.relcore.cache;

import com.relcore.execution.Partitioning;
import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.RowIterators;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.BinaryExpression;
import com.relcore.expression.Expression;
import com.relcore.expression.Expressions;
import com.relcore.expression.Literal;
import com.relcore.expression.UnaryExpression;
import com.relcore.row.Row;
import com.relcore.types.DataTypes;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans an {@link InMemoryRelation} into a single partition.
 *
 * <p>Predicates comparing a column with a literal are checked against the
 * statistics of each batch, and batches that cannot contain a matching row are
 * skipped. The predicates are not applied to the rows themselves; the planner
 * keeps a filter above this scan.
 */
public final class InMemoryTableScanExec extends PhysicalPlan {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTableScanExec.class);

    private final List<AttributeReference> attributes;
    private final List<Expression> predicates;
    private final InMemoryRelation relation;
    private final boolean codegenEnabled;

    /**
     * Creates a scan.
     *
     * @param attributes the columns to produce, a subset of the relation output
     * @param predicates conjunctive predicates usable to skip batches
     * @param relation the cached relation
     * @param codegenEnabled whether code generation was enabled when planning
     */
    public InMemoryTableScanExec(List<AttributeReference> attributes, List<Expression> predicates,
                                 InMemoryRelation relation, boolean codegenEnabled) {
        this.attributes = List.copyOf(attributes);
        this.predicates = List.copyOf(predicates);
        this.relation = Objects.requireNonNull(relation, "relation must not be null");
        this.codegenEnabled = codegenEnabled;
    }

    public InMemoryRelation relation() {
        return relation;
    }

    public List<Expression> predicates() {
        return predicates;
    }

    @Override
    public List<AttributeReference> output() {
        return attributes;
    }

    @Override
    public Partitioning outputPartitioning() {
        return new Partitioning.UnknownPartitioning(1);
    }

    @Override
    public boolean codegenEnabled() {
        return codegenEnabled;
    }

    /**
     * Returns the cached batches that may contain rows satisfying the predicates.
     *
     * @return the batches to read
     */
    public List<CachedBatch> prunedBatches() {
        List<Predicate<CachedBatch>> filters = new ArrayList<>();
        for (Expression predicate : predicates) {
            statisticsFilter(predicate).ifPresent(filters::add);
        }
        List<CachedBatch> all = relation.cachedBatches();
        List<CachedBatch> selected = new ArrayList<>(all.size());
        for (CachedBatch batch : all) {
            if (filters.stream().allMatch(filter -> filter.test(batch))) {
                selected.add(batch);
            }
        }
        if (selected.size() < all.size()) {
            logger.debug("Skipping {} of {} cached batches", all.size() - selected.size(), all.size());
        }
        return selected;
    }

    @Override
    public List<Iterator<Row>> execute() {
        Function<Row, Row> pruning = RowIterators.columnPruning(attributes, relation.output());
        Iterator<Row> rows = prunedBatches().stream()
            .flatMap(batch -> batch.rows().stream())
            .map(pruning)
            .iterator();
        return List.of(rows);
    }

    private Optional<Predicate<CachedBatch>> statisticsFilter(Expression predicate) {
        if (predicate instanceof UnaryExpression) {
            UnaryExpression unary = (UnaryExpression) predicate;
            int ordinal = ordinalOf(unary.child());
            if (ordinal < 0) {
                return Optional.empty();
            }
            switch (unary.operator()) {
                case IS_NULL:
                    return Optional.of(batch -> batch.statistics().get(ordinal).nullCount() > 0);
                case IS_NOT_NULL:
                    return Optional.of(batch -> {
                        CachedBatch.ColumnStatistics stats = batch.statistics().get(ordinal);
                        return stats.nullCount() < stats.count();
                    });
                default:
                    return Optional.empty();
            }
        }
        if (!(predicate instanceof BinaryExpression)) {
            return Optional.empty();
        }
        BinaryExpression binary = (BinaryExpression) predicate;
        if (binary.operator() == BinaryExpression.Operator.AND) {
            Optional<Predicate<CachedBatch>> left = statisticsFilter(binary.left());
            Optional<Predicate<CachedBatch>> right = statisticsFilter(binary.right());
            if (left.isPresent() && right.isPresent()) {
                return Optional.of(left.get().and(right.get()));
            }
            return left.isPresent() ? left : right;
        }
        if (binary.operator() == BinaryExpression.Operator.OR) {
            Optional<Predicate<CachedBatch>> left = statisticsFilter(binary.left());
            Optional<Predicate<CachedBatch>> right = statisticsFilter(binary.right());
            if (left.isPresent() && right.isPresent()) {
                return Optional.of(left.get().or(right.get()));
            }
            return Optional.empty();
        }
        if (ordinalOf(binary.left()) >= 0 && binary.right() instanceof Literal) {
            return comparison(ordinalOf(binary.left()), binary.operator(), ((Literal) binary.right()).value());
        }
        if (ordinalOf(binary.right()) >= 0 && binary.left() instanceof Literal) {
            return comparison(ordinalOf(binary.right()), binary.operator().flip(), ((Literal) binary.left()).value());
        }
        return Optional.empty();
    }

    private int ordinalOf(Expression expression) {
        if (expression instanceof AttributeReference) {
            return Expressions.indexOf(relation.output(), (AttributeReference) expression);
        }
        return -1;
    }

    private static Optional<Predicate<CachedBatch>> comparison(int ordinal, BinaryExpression.Operator operator,
                                                               Object value) {
        if (value == null) {
            return Optional.empty();
        }
        switch (operator) {
            case EQUAL:
                return Optional.of(batch -> {
                    CachedBatch.ColumnStatistics stats = batch.statistics().get(ordinal);
                    return stats.min() != null
                        && DataTypes.compare(stats.min(), value) <= 0
                        && DataTypes.compare(value, stats.max()) <= 0;
                });
            case LESS_THAN:
                return Optional.of(batch -> lowerBound(batch, ordinal, value, false));
            case LESS_THAN_OR_EQUAL:
                return Optional.of(batch -> lowerBound(batch, ordinal, value, true));
            case GREATER_THAN:
                return Optional.of(batch -> upperBound(batch, ordinal, value, false));
            case GREATER_THAN_OR_EQUAL:
                return Optional.of(batch -> upperBound(batch, ordinal, value, true));
            default:
                return Optional.empty();
        }
    }

    // some value of the column is below (or at) the bound
    private static boolean lowerBound(CachedBatch batch, int ordinal, Object value, boolean inclusive) {
        Object min = batch.statistics().get(ordinal).min();
        if (min == null) {
            return false;
        }
        int cmp = DataTypes.compare(min, value);
        return inclusive ? cmp <= 0 : cmp < 0;
    }

    // some value of the column is above (or at) the bound
    private static boolean upperBound(CachedBatch batch, int ordinal, Object value, boolean inclusive) {
        Object max = batch.statistics().get(ordinal).max();
        if (max == null) {
            return false;
        }
        int cmp = DataTypes.compare(max, value);
        return inclusive ? cmp >= 0 : cmp > 0;
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return this;
    }

    @Override
    public String argString() {
        return predicates.isEmpty()
            ? attributes.toString()
            : attributes + ", " + predicates;
    }
}
