package com.relcore.execution.exchange;

import com.relcore.execution.Partitioning;
import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.RowIterators;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expressions;
import com.relcore.expression.SortOrder;
import com.relcore.row.Row;
import com.relcore.types.DataTypes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redistributes the rows of its child according to a new partitioning.
 *
 * <p>Rows are moved in memory: the child is drained and its rows are assigned
 * to output partitions by key hash, by range, or all to one partition.
 */
public final class Exchange extends PhysicalPlan {

    private static final Logger logger = LoggerFactory.getLogger(Exchange.class);

    private final Partitioning partitioning;

    public Exchange(Partitioning partitioning, PhysicalPlan child) {
        super(child);
        this.partitioning = Objects.requireNonNull(partitioning, "partitioning must not be null");
    }

    public Partitioning partitioning() {
        return partitioning;
    }

    public PhysicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public Partitioning outputPartitioning() {
        return partitioning;
    }

    @Override
    public List<Iterator<Row>> execute() {
        List<Row> rows = RowIterators.collect(child().execute());
        logger.debug("Exchanging {} rows into {}", rows.size(), partitioning);

        if (partitioning instanceof Partitioning.HashPartitioning) {
            Partitioning.HashPartitioning hash = (Partitioning.HashPartitioning) partitioning;
            Function<Row, Row> key = RowIterators.projection(hash.expressions(), child().output());
            List<List<Row>> buckets = buckets(hash.numPartitions());
            for (Row row : rows) {
                buckets.get(Math.floorMod(hashKey(key.apply(row)), hash.numPartitions())).add(row);
            }
            return iterators(buckets);
        }
        if (partitioning instanceof Partitioning.RangePartitioning) {
            Partitioning.RangePartitioning range = (Partitioning.RangePartitioning) partitioning;
            Comparator<Row> ordering =
                SortOrder.ordering(Expressions.bindReferences(range.ordering(), child().output()));
            rows.sort(ordering);
            List<List<Row>> buckets = buckets(range.numPartitions());
            int perPartition = Math.max(1, (rows.size() + range.numPartitions() - 1) / range.numPartitions());
            for (int i = 0; i < rows.size(); i++) {
                buckets.get(Math.min(i / perPartition, range.numPartitions() - 1)).add(rows.get(i));
            }
            return iterators(buckets);
        }
        if (partitioning == Partitioning.SinglePartition.INSTANCE) {
            return List.of(rows.iterator());
        }
        throw new UnsupportedOperationException("Cannot exchange into " + partitioning);
    }

    private static int hashKey(Row key) {
        int hash = 1;
        for (Object value : key.values()) {
            Object normalized = DataTypes.keyOf(value);
            hash = 31 * hash + (normalized == null ? 0 : normalized.hashCode());
        }
        return hash;
    }

    private static List<List<Row>> buckets(int count) {
        List<List<Row>> buckets = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            buckets.add(new ArrayList<>());
        }
        return buckets;
    }

    private static List<Iterator<Row>> iterators(List<List<Row>> buckets) {
        List<Iterator<Row>> partitions = new ArrayList<>(buckets.size());
        for (List<Row> bucket : buckets) {
            partitions.add(bucket.isEmpty() ? Collections.emptyIterator() : bucket.iterator());
        }
        return partitions;
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new Exchange(partitioning, newChildren.get(0));
    }

    @Override
    public String argString() {
        return partitioning.toString();
    }
}
