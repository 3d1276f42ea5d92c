package com.relcore.types;

import com.relcore.row.Row;
import java.util.ArrayList;
import java.util.List;

/**
 * Schema of a relation: an ordered list of fields. Rows of a struct are
 * {@link Row}s with one value per field.
 */
public final class StructType implements DataType {

    private final List<StructField> fields;

    public StructType(List<StructField> fields) {
        this.fields = List.copyOf(fields);
    }

    public List<StructField> fields() {
        return fields;
    }

    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (StructField field : fields) {
            names.add(field.name());
        }
        return names;
    }

    /**
     * Checks that a row fits this schema.
     *
     * @param row the row
     * @throws IllegalArgumentException if the arity differs, or a value has the
     *         wrong type or is null in a non-nullable field
     */
    public void validate(Row row) {
        if (row.size() != fields.size()) {
            throw new IllegalArgumentException(
                "Row %s has %d values but the schema has %d fields".formatted(row, row.size(), fields.size()));
        }
        for (int i = 0; i < fields.size(); i++) {
            StructField field = fields.get(i);
            if (!field.accepts(row.get(i))) {
                throw new IllegalArgumentException(
                    "Value %s of row %s does not fit field %s".formatted(row.get(i), row, field));
            }
        }
    }

    @Override
    public String typeName() {
        return "struct";
    }

    @Override
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        if (!(value instanceof Row) || ((Row) value).size() != fields.size()) {
            return false;
        }
        for (int i = 0; i < fields.size(); i++) {
            if (!fields.get(i).accepts(((Row) value).get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StructType && fields.equals(((StructType) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "struct<" + String.join(",", fields.stream().map(f -> f.name() + ":" + f.dataType()).toList()) + ">";
    }
}
