package com.relcore.sources;

import com.relcore.row.Row;
import java.util.Iterator;
import java.util.List;

/**
 * A relation that can drop unneeded columns and skip rows using simple filters.
 *
 * <p>Filters are advisory: a relation may return rows that do not satisfy them,
 * unless it leaves them out of {@link BaseRelation#unhandledFilters(List)}.
 */
public interface PrunedFilteredScan {

    /**
     * Produces the rows of the relation, restricted to the given columns.
     *
     * @param requiredColumns the column names, in the order the row values must follow
     * @param filters conjunctive filters the relation may use to skip rows
     * @return the rows
     */
    Iterator<Row> buildScan(List<String> requiredColumns, List<SourceFilter> filters);
}
