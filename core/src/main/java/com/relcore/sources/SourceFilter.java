package com.relcore.sources;

import com.relcore.row.Row;
import com.relcore.types.DataTypes;
import java.util.List;
import java.util.function.Function;

/**
 * A filter that can be pushed down to a data source.
 *
 * <p>Filters name a column of the relation and compare it to a constant.
 * {@link #evaluate(Function)} lets simple relations apply them directly.
 */
public sealed interface SourceFilter {

    /**
     * Returns the column this filter tests.
     *
     * @return the column name
     */
    String attribute();

    /**
     * Tests a row, looking column values up through {@code column}.
     *
     * @param column maps a column name to its value in the row under test
     * @return true if the row passes
     */
    boolean evaluate(Function<String, Object> column);

    /**
     * Tests a row whose values follow the given column order.
     *
     * @param row the row
     * @param columns the column names of the row, in order
     * @return true if the row passes
     */
    default boolean evaluate(Row row, List<String> columns) {
        return evaluate(name -> row.get(columns.indexOf(name)));
    }

    record EqualTo(String attribute, Object value) implements SourceFilter {
        @Override
        public boolean evaluate(Function<String, Object> column) {
            Object v = column.apply(attribute);
            return v != null && DataTypes.compare(v, value) == 0;
        }
    }

    record GreaterThan(String attribute, Object value) implements SourceFilter {
        @Override
        public boolean evaluate(Function<String, Object> column) {
            Object v = column.apply(attribute);
            return v != null && DataTypes.compare(v, value) > 0;
        }
    }

    record GreaterThanOrEqual(String attribute, Object value) implements SourceFilter {
        @Override
        public boolean evaluate(Function<String, Object> column) {
            Object v = column.apply(attribute);
            return v != null && DataTypes.compare(v, value) >= 0;
        }
    }

    record LessThan(String attribute, Object value) implements SourceFilter {
        @Override
        public boolean evaluate(Function<String, Object> column) {
            Object v = column.apply(attribute);
            return v != null && DataTypes.compare(v, value) < 0;
        }
    }

    record LessThanOrEqual(String attribute, Object value) implements SourceFilter {
        @Override
        public boolean evaluate(Function<String, Object> column) {
            Object v = column.apply(attribute);
            return v != null && DataTypes.compare(v, value) <= 0;
        }
    }

    record IsNull(String attribute) implements SourceFilter {
        @Override
        public boolean evaluate(Function<String, Object> column) {
            return column.apply(attribute) == null;
        }
    }

    record IsNotNull(String attribute) implements SourceFilter {
        @Override
        public boolean evaluate(Function<String, Object> column) {
            return column.apply(attribute) != null;
        }
    }
}
