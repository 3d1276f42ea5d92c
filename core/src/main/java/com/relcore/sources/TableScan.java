package com.relcore.sources;

import com.relcore.row.Row;
import java.util.Iterator;

/**
 * A relation that can only produce all of its columns and rows.
 */
public interface TableScan {

    /**
     * Produces every row of the relation.
     *
     * @return the rows, matching the relation schema
     */
    Iterator<Row> buildScan();
}
