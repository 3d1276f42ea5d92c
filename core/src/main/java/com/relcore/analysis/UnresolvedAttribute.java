package com.relcore.analysis;

import com.relcore.expression.AttributeReference;
import com.relcore.expression.ExprId;
import com.relcore.expression.Expression;
import com.relcore.expression.NamedExpression;
import com.relcore.row.Row;
import com.relcore.types.DataType;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A column referred to by name that has not been bound to an input attribute yet.
 *
 * <p>Names may be qualified: {@code "orders.id"} has the name parts
 * {@code [orders, id]}.
 *
 * @param nameParts the dotted name, split into parts
 */
public record UnresolvedAttribute(List<String> nameParts) implements NamedExpression {

    public UnresolvedAttribute {
        nameParts = List.copyOf(nameParts);
        if (nameParts.isEmpty()) {
            throw new IllegalArgumentException("nameParts must not be empty");
        }
    }

    /**
     * Creates an unresolved attribute from a dotted name.
     *
     * @param name the name, e.g. {@code "id"} or {@code "orders.id"}
     * @return the unresolved attribute
     */
    public static UnresolvedAttribute quoted(String name) {
        return new UnresolvedAttribute(Arrays.asList(name.split("\\.")));
    }

    @Override
    public String name() {
        return String.join(".", nameParts);
    }

    @Override
    public ExprId exprId() {
        throw Unresolved.invalidCall("exprId", this);
    }

    @Override
    public List<String> qualifiers() {
        throw Unresolved.invalidCall("qualifiers", this);
    }

    @Override
    public AttributeReference toAttribute() {
        throw Unresolved.invalidCall("toAttribute", this);
    }

    @Override
    public DataType dataType() {
        throw Unresolved.invalidCall("dataType", this);
    }

    @Override
    public boolean nullable() {
        throw Unresolved.invalidCall("nullable", this);
    }

    @Override
    public boolean resolved() {
        return false;
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
    public Object eval(Row input) {
        throw Unresolved.invalidCall("eval", this);
    }

    @Override
    public String toString() {
        return "'" + name();
    }
}
