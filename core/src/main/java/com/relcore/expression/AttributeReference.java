package com.relcore.expression;

import com.relcore.row.Row;
import com.relcore.types.DataType;
import com.relcore.types.StructField;
import com.relcore.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A resolved reference to a column produced by some plan node.
 *
 * <p>Attribute references appear in:
 * <ul>
 *   <li>the output of every logical and physical plan node</li>
 *   <li>projections, filters, join conditions and grouping expressions after analysis</li>
 * </ul>
 *
 * <p>An attribute is identified by its {@link ExprId}, not by its name: two
 * references to columns named {@code id} coming from different relations are
 * different attributes. Qualifiers (table or alias names) are carried for name
 * resolution only and do not take part in equality.
 */
public final class AttributeReference implements NamedExpression {

    private final String name;
    private final DataType dataType;
    private final boolean nullable;
    private final ExprId exprId;
    private final List<String> qualifiers;

    /**
     * Creates an attribute reference with an explicit id and qualifiers.
     *
     * @param name the column name
     * @param dataType the data type of the column
     * @param nullable whether the column is nullable
     * @param exprId the identity of the column
     * @param qualifiers the table or alias qualifiers
     */
    public AttributeReference(String name, DataType dataType, boolean nullable,
                              ExprId exprId, List<String> qualifiers) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
        this.exprId = Objects.requireNonNull(exprId, "exprId must not be null");
        this.qualifiers = List.copyOf(qualifiers);
    }

    /**
     * Creates an unqualified attribute reference with a fresh id.
     *
     * @param name the column name
     * @param dataType the data type of the column
     * @param nullable whether the column is nullable
     */
    public AttributeReference(String name, DataType dataType, boolean nullable) {
        this(name, dataType, nullable, ExprId.newExprId(), Collections.emptyList());
    }

    /**
     * Creates a nullable, unqualified attribute reference with a fresh id.
     *
     * @param name the column name
     * @param dataType the data type of the column
     */
    public AttributeReference(String name, DataType dataType) {
        this(name, dataType, true);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ExprId exprId() {
        return exprId;
    }

    @Override
    public List<String> qualifiers() {
        return qualifiers;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return this;
    }

    @Override
    public AttributeReference toAttribute() {
        return this;
    }

    @Override
    public AttributeSet references() {
        return AttributeSet.of(this);
    }

    @Override
    public Object eval(Row input) {
        throw new UnsupportedOperationException(
            "Attribute " + this + " must be bound before evaluation");
    }

    /**
     * Returns a copy of this attribute with the given qualifiers.
     *
     * @param newQualifiers the qualifiers
     * @return the requalified attribute (same id)
     */
    public AttributeReference withQualifiers(List<String> newQualifiers) {
        if (qualifiers.equals(newQualifiers)) {
            return this;
        }
        return new AttributeReference(name, dataType, nullable, exprId, newQualifiers);
    }

    /**
     * Returns a copy of this attribute with the given nullability.
     *
     * @param newNullable the nullability
     * @return the copy (same id)
     */
    public AttributeReference withNullability(boolean newNullable) {
        if (nullable == newNullable) {
            return this;
        }
        return new AttributeReference(name, dataType, newNullable, exprId, qualifiers);
    }

    /**
     * Returns a copy of this attribute with a fresh id.
     *
     * @return the new attribute
     */
    public AttributeReference newInstance() {
        return new AttributeReference(name, dataType, nullable, ExprId.newExprId(), qualifiers);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AttributeReference)) return false;
        AttributeReference that = (AttributeReference) obj;
        return exprId.equals(that.exprId) &&
               name.equals(that.name) &&
               dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exprId, name, dataType);
    }

    @Override
    public String toString() {
        return name + "#" + exprId;
    }

    // ==================== Factory Methods ====================

    /**
     * Creates one fresh attribute per field of the schema.
     *
     * @param schema the schema
     * @return the attributes, in field order
     */
    public static List<AttributeReference> fromSchema(StructType schema) {
        List<AttributeReference> result = new ArrayList<>(schema.fields().size());
        for (StructField field : schema.fields()) {
            result.add(new AttributeReference(field.name(), field.dataType(), field.nullable()));
        }
        return result;
    }

    /**
     * Builds the schema described by a list of attributes.
     *
     * @param attributes the attributes
     * @return the schema
     */
    public static StructType toSchema(List<AttributeReference> attributes) {
        List<StructField> fields = new ArrayList<>(attributes.size());
        for (AttributeReference attribute : attributes) {
            fields.add(new StructField(attribute.name(), attribute.dataType(), attribute.nullable()));
        }
        return new StructType(fields);
    }

    /**
     * Returns the data types of a list of attributes, in order.
     *
     * @param attributes the attributes
     * @return the data types
     */
    public static List<DataType> dataTypes(List<AttributeReference> attributes) {
        List<DataType> types = new ArrayList<>(attributes.size());
        for (AttributeReference attribute : attributes) {
            types.add(attribute.dataType());
        }
        return types;
    }
}
