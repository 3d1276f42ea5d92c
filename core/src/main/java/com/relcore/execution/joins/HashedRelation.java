package com.relcore.execution.joins;

import com.relcore.row.Row;
import com.relcore.types.DataTypes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Rows of the build side of a hash join, indexed by join key.
 *
 * <p>Keys are normalized with {@link DataTypes#keyOf} so that numbers equal
 * across types, such as {@code 1} and {@code 1.0}, find each other. Rows
 * whose key contains a null are kept but never indexed, since a null key
 * matches nothing.
 */
final class HashedRelation {

    private final Map<List<Object>, List<Row>> index = new HashMap<>();
    private final List<Row> all = new ArrayList<>();

    private HashedRelation() {}

    static HashedRelation build(Iterator<Row> rows, Function<Row, Row> keyProjection) {
        HashedRelation relation = new HashedRelation();
        while (rows.hasNext()) {
            Row row = rows.next();
            relation.all.add(row);
            List<Object> key = normalizedKey(keyProjection.apply(row));
            if (key != null) {
                relation.index.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            }
        }
        return relation;
    }

    /**
     * Returns the rows matching a key.
     *
     * @param key the lookup key
     * @return the matching rows, empty if none
     */
    List<Row> get(Row key) {
        List<Object> normalized = normalizedKey(key);
        if (normalized == null) {
            return Collections.emptyList();
        }
        return index.getOrDefault(normalized, Collections.emptyList());
    }

    /**
     * Returns every build row, including those with a null key.
     *
     * @return the rows
     */
    List<Row> rows() {
        return all;
    }

    /**
     * Returns the key in a form usable as a map key, or null when it contains a null.
     *
     * @param key the key values
     * @return the normalized key
     */
    static List<Object> normalizedKey(Row key) {
        List<Object> normalized = new ArrayList<>(key.size());
        for (Object value : key.values()) {
            if (value == null) {
                return null;
            }
            normalized.add(DataTypes.keyOf(value));
        }
        return normalized;
    }
}
