package com.relcore.logical;

import com.relcore.expression.AttributeReference;
import com.relcore.row.Row;
import com.relcore.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a relation backed by rows held in memory.
 *
 * <p>This node is used for {@code createDataFrame(rows, schema)} and for small
 * literal tables. The output attributes are created once, when the relation is
 * built, so every plan that refers to the same instance sees the same ids.
 */
public final class LocalRelation extends LogicalPlan implements MultiInstanceRelation {

    private final List<AttributeReference> output;
    private final List<Row> data;

    /**
     * Creates a local relation.
     *
     * @param output the output attributes
     * @param data the rows, each with one value per output attribute
     */
    public LocalRelation(List<AttributeReference> output, List<Row> data) {
        this.output = List.copyOf(Objects.requireNonNull(output, "output must not be null"));
        this.data = List.copyOf(Objects.requireNonNull(data, "data must not be null"));
        for (Row row : this.data) {
            if (row.size() != this.output.size()) {
                throw new IllegalArgumentException(
                    "Row %s does not match output %s".formatted(row, this.output));
            }
        }
    }

    /**
     * Creates a local relation with fresh attributes for the given schema.
     *
     * @param schema the schema
     * @param data the rows
     * @return the relation
     */
    public static LocalRelation fromSchema(StructType schema, List<Row> data) {
        return new LocalRelation(AttributeReference.fromSchema(schema), data);
    }

    public List<Row> data() {
        return data;
    }

    @Override
    public LocalRelation newInstance() {
        List<AttributeReference> fresh = new ArrayList<>(output.size());
        for (AttributeReference attribute : output) {
            fresh.add(attribute.newInstance());
        }
        return new LocalRelation(fresh, data);
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    /**
     * Compares output data types and rows. Attribute ids are ignored, so a copy
     * made by {@link #newInstance()} has the same result as the original.
     */
    @Override
    public boolean sameResult(LogicalPlan other) {
        if (!(other instanceof LocalRelation)) {
            return false;
        }
        LocalRelation relation = (LocalRelation) other;
        return AttributeReference.dataTypes(relation.output).equals(AttributeReference.dataTypes(output))
            && relation.data.equals(data);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return this;
    }

    @Override
    protected List<Object> args() {
        return List.of(output, data);
    }

    @Override
    public String argString() {
        return output.toString();
    }
}
