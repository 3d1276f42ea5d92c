package com.relcore.sources;

import com.relcore.types.StructType;
import java.util.List;

/**
 * A relation backed by an external data source.
 *
 * <p>Concrete relations also implement one of the scan interfaces
 * ({@link TableScan}, {@link PrunedScan}, {@link PrunedFilteredScan}), which
 * tells the planner how much work it can push down into the source.
 *
 * <p>Two relations describing the same data should be equal, so that cached
 * results built on one are reused for the other.
 */
public abstract class BaseRelation {

    /**
     * Returns the schema of the rows this relation produces.
     *
     * @return the schema
     */
    public abstract StructType schema();

    /**
     * Returns the filters this relation cannot guarantee to apply completely.
     *
     * <p>The planner re-evaluates every returned filter on the scan output. The
     * default returns all of them.
     *
     * @param filters the filters pushed to the relation
     * @return the filters the engine must still evaluate
     */
    public List<SourceFilter> unhandledFilters(List<SourceFilter> filters) {
        return filters;
    }
}
