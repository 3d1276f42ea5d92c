package com.relcore.row;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable row of values.
 *
 * <p>Values are positional; their meaning is given by the attribute list of the
 * plan node that produced the row. Null values are allowed.
 */
public final class Row {

    /** Row with no columns. */
    public static final Row EMPTY = new Row(Collections.emptyList());

    private final List<Object> values;

    private Row(List<Object> values) {
        this.values = values;
    }

    /**
     * Creates a row from the given values.
     *
     * @param values the column values (may contain nulls)
     * @return the row
     */
    public static Row of(Object... values) {
        return new Row(Collections.unmodifiableList(Arrays.asList(values.clone())));
    }

    /**
     * Creates a row from a list of values.
     *
     * @param values the column values (may contain nulls)
     * @return the row
     */
    public static Row fromList(List<?> values) {
        return new Row(Collections.unmodifiableList(new ArrayList<>(values)));
    }

    /**
     * Returns the value at the given ordinal.
     *
     * @param ordinal the column position
     * @return the value, possibly null
     */
    public Object get(int ordinal) {
        return values.get(ordinal);
    }

    /**
     * Returns whether the value at the given ordinal is null.
     *
     * @param ordinal the column position
     * @return true if null
     */
    public boolean isNullAt(int ordinal) {
        return values.get(ordinal) == null;
    }

    public int getInt(int ordinal) {
        return ((Number) values.get(ordinal)).intValue();
    }

    public long getLong(int ordinal) {
        return ((Number) values.get(ordinal)).longValue();
    }

    public double getDouble(int ordinal) {
        return ((Number) values.get(ordinal)).doubleValue();
    }

    public String getString(int ordinal) {
        return (String) values.get(ordinal);
    }

    public boolean getBoolean(int ordinal) {
        return (Boolean) values.get(ordinal);
    }

    /**
     * Returns the number of columns.
     *
     * @return the column count
     */
    public int size() {
        return values.size();
    }

    /**
     * Returns the values of this row.
     *
     * @return an unmodifiable list of values
     */
    public List<Object> values() {
        return values;
    }

    /**
     * Returns a new row holding this row's values followed by {@code other}'s.
     *
     * @param other the row to append
     * @return the joined row
     */
    public Row concat(Row other) {
        List<Object> joined = new ArrayList<>(values.size() + other.values.size());
        joined.addAll(values);
        joined.addAll(other.values);
        return new Row(Collections.unmodifiableList(joined));
    }

    /**
     * Returns a row of {@code size} nulls.
     *
     * @param size the column count
     * @return the null row
     */
    public static Row nulls(int size) {
        return new Row(Collections.nCopies(size, null));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
