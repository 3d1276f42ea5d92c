package com.relcore.expression;

import com.relcore.row.Row;
import com.relcore.types.DataType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Gives a name to the result of a child expression.
 *
 * <p>Examples:
 * <pre>
 *   SELECT price * quantity AS total
 *   df.select(alias(count(col("id")), "n"))
 * </pre>
 *
 * <p>Every alias owns a fresh {@link ExprId}; the attribute it produces keeps
 * that id so parents can refer to it.
 */
public final class Alias implements NamedExpression {

    private final Expression child;
    private final String name;
    private final ExprId exprId;
    private final List<String> qualifiers;

    /**
     * Creates an alias with an explicit id.
     *
     * @param child the aliased expression
     * @param name the output name
     * @param exprId the identity of the produced column
     * @param qualifiers the qualifiers of the produced column
     */
    public Alias(Expression child, String name, ExprId exprId, List<String> qualifiers) {
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.exprId = Objects.requireNonNull(exprId, "exprId must not be null");
        this.qualifiers = List.copyOf(qualifiers);
    }

    /**
     * Creates an alias with a fresh id.
     *
     * @param child the aliased expression
     * @param name the output name
     */
    public Alias(Expression child, String name) {
        this(child, name, ExprId.newExprId(), Collections.emptyList());
    }

    public Expression child() {
        return child;
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
        return child.dataType();
    }

    @Override
    public boolean nullable() {
        return child.nullable();
    }

    @Override
    public List<Expression> children() {
        return List.of(child);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return new Alias(newChildren.get(0), name, exprId, qualifiers);
    }

    @Override
    public AttributeReference toAttribute() {
        if (!resolved()) {
            throw new IllegalStateException("Cannot create an attribute for unresolved alias " + this);
        }
        return new AttributeReference(name, child.dataType(), child.nullable(), exprId, qualifiers);
    }

    @Override
    public Object eval(Row input) {
        return child.eval(input);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Alias)) return false;
        Alias that = (Alias) obj;
        return child.equals(that.child) &&
               name.equals(that.name) &&
               exprId.equals(that.exprId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, name, exprId);
    }

    @Override
    public String toString() {
        return child + " AS " + name + "#" + exprId;
    }
}
