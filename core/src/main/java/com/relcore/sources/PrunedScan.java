package com.relcore.sources;

import com.relcore.row.Row;
import java.util.Iterator;
import java.util.List;

/**
 * A relation that can drop unneeded columns before returning rows.
 */
public interface PrunedScan {

    /**
     * Produces every row of the relation, restricted to the given columns.
     *
     * @param requiredColumns the column names, in the order the row values must follow
     * @return the rows
     */
    Iterator<Row> buildScan(List<String> requiredColumns);
}
