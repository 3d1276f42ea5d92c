package com.relcore.cache;

import com.relcore.row.Row;
import com.relcore.types.DataTypes;
import java.util.ArrayList;
import java.util.List;

/**
 * A batch of cached rows with per-column statistics.
 *
 * @param rows the rows of the batch
 * @param statistics one entry per column
 */
public record CachedBatch(List<Row> rows, List<ColumnStatistics> statistics) {

    public CachedBatch {
        rows = List.copyOf(rows);
        statistics = List.copyOf(statistics);
    }

    /**
     * Bounds and null count of one column within a batch.
     *
     * @param min the smallest non-null value, null if there is none
     * @param max the largest non-null value, null if there is none
     * @param nullCount the number of null values
     * @param count the number of values
     */
    public record ColumnStatistics(Object min, Object max, int nullCount, int count) {
    }

    /**
     * Builds a batch, computing the statistics of every column.
     *
     * @param rows the rows
     * @param width the number of columns
     * @return the batch
     */
    public static CachedBatch of(List<Row> rows, int width) {
        List<ColumnStatistics> statistics = new ArrayList<>(width);
        for (int column = 0; column < width; column++) {
            Object min = null;
            Object max = null;
            int nullCount = 0;
            for (Row row : rows) {
                Object value = row.get(column);
                if (value == null) {
                    nullCount++;
                    continue;
                }
                if (min == null || DataTypes.compare(value, min) < 0) {
                    min = value;
                }
                if (max == null || DataTypes.compare(value, max) > 0) {
                    max = value;
                }
            }
            statistics.add(new ColumnStatistics(min, max, nullCount, rows.size()));
        }
        return new CachedBatch(rows, statistics);
    }

    public int numRows() {
        return rows.size();
    }
}
