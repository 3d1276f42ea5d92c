package com.relcore.cache;

import com.relcore.execution.PhysicalPlan;
import com.relcore.expression.AttributeReference;
import com.relcore.logical.LogicalPlan;
import com.relcore.logical.MultiInstanceRelation;
import com.relcore.row.Row;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logical leaf standing for the cached result of a query.
 *
 * <p>The rows are materialized from the child physical plan on the first scan,
 * exactly once, and kept as batches of {@code batchSize} rows. Copies made with
 * {@link #withOutput(List)} or {@link #newInstance()} share the same batches.
 */
public final class InMemoryRelation extends LogicalPlan implements MultiInstanceRelation {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRelation.class);

    private final List<AttributeReference> output;
    private final PhysicalPlan child;
    private final int batchSize;
    private final String tableName;
    private final CachedBatches batches;

    private InMemoryRelation(List<AttributeReference> output, PhysicalPlan child, int batchSize,
                             String tableName, CachedBatches batches) {
        this.output = List.copyOf(output);
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.batchSize = batchSize;
        this.tableName = tableName;
        this.batches = batches;
    }

    /**
     * Creates a relation caching the result of a physical plan.
     *
     * @param batchSize the number of rows per batch
     * @param child the plan whose result is cached
     * @param tableName the cached table, or null for an anonymous query
     * @return the relation
     */
    public static InMemoryRelation create(int batchSize, PhysicalPlan child, String tableName) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        return new InMemoryRelation(child.output(), child, batchSize, tableName, new CachedBatches());
    }

    public PhysicalPlan child() {
        return child;
    }

    public int batchSize() {
        return batchSize;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * Returns a copy producing the same rows under the given attributes.
     *
     * @param newOutput the attributes, positionally matching the current output
     * @return the copy
     */
    public InMemoryRelation withOutput(List<AttributeReference> newOutput) {
        if (newOutput.size() != output.size()) {
            throw new IllegalArgumentException(
                "Output %s does not match cached output %s".formatted(newOutput, output));
        }
        return new InMemoryRelation(newOutput, child, batchSize, tableName, batches);
    }

    @Override
    public InMemoryRelation newInstance() {
        List<AttributeReference> fresh = new ArrayList<>(output.size());
        for (AttributeReference attribute : output) {
            fresh.add(attribute.newInstance());
        }
        return withOutput(fresh);
    }

    /**
     * Returns the cached batches, materializing them on first use.
     *
     * @return the batches
     */
    public List<CachedBatch> cachedBatches() {
        return batches.get(this);
    }

    /**
     * Returns whether the batches have been materialized.
     *
     * @return true once a scan has run
     */
    public boolean isMaterialized() {
        return batches.isLoaded();
    }

    /**
     * Drops the materialized batches; the next scan recomputes them.
     *
     * @return this relation
     */
    public InMemoryRelation recache() {
        batches.clear();
        return this;
    }

    /**
     * Drops the materialized batches.
     */
    public void clear() {
        batches.clear();
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    // copies share their batches
    @Override
    public boolean sameResult(LogicalPlan other) {
        if (!(other instanceof InMemoryRelation)) {
            return false;
        }
        InMemoryRelation relation = (InMemoryRelation) other;
        return relation.batches == batches
            && AttributeReference.dataTypes(relation.output).equals(AttributeReference.dataTypes(output));
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return this;
    }

    @Override
    protected List<Object> args() {
        return Arrays.asList(output, child, tableName);
    }

    @Override
    public String argString() {
        return tableName == null ? output.toString() : output + ", " + tableName;
    }

    /**
     * Batches shared by all copies of one cached relation.
     */
    private static final class CachedBatches {

        private List<CachedBatch> loaded;

        synchronized List<CachedBatch> get(InMemoryRelation relation) {
            if (loaded == null) {
                loaded = build(relation);
            }
            return loaded;
        }

        synchronized boolean isLoaded() {
            return loaded != null;
        }

        synchronized void clear() {
            loaded = null;
        }

        private static List<CachedBatch> build(InMemoryRelation relation) {
            int width = relation.child.output().size();
            List<CachedBatch> result = new ArrayList<>();
            List<Row> current = new ArrayList<>(Math.min(relation.batchSize, 1024));
            int rowCount = 0;
            for (Iterator<Row> rows : relation.child.execute()) {
                while (rows.hasNext()) {
                    current.add(rows.next());
                    rowCount++;
                    if (current.size() == relation.batchSize) {
                        result.add(CachedBatch.of(current, width));
                        current = new ArrayList<>();
                    }
                }
            }
            if (!current.isEmpty()) {
                result.add(CachedBatch.of(current, width));
            }
            logger.info("Materialized cached relation {}: {} rows in {} batches",
                relation.tableName == null ? "<query>" : relation.tableName, rowCount, result.size());
            return result;
        }
    }
}
