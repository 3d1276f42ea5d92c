package com.relcore.analysis;

import com.relcore.expression.AttributeReference;
import com.relcore.expression.ExprId;
import com.relcore.expression.Expression;
import com.relcore.expression.NamedExpression;
import com.relcore.row.Row;
import com.relcore.types.DataType;
import java.util.List;

/**
 * An unnamed expression in a projection or aggregation list.
 *
 * <p>Once the child is resolved the analyzer replaces this node with an
 * {@link com.relcore.expression.Alias} named after the child's rendering.
 *
 * @param child the expression to name
 */
public record UnresolvedAlias(Expression child) implements NamedExpression {

    @Override
    public String name() {
        throw Unresolved.invalidCall("name", this);
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
        return List.of(child);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return new UnresolvedAlias(newChildren.get(0));
    }

    @Override
    public Object eval(Row input) {
        throw Unresolved.invalidCall("eval", this);
    }

    @Override
    public String toString() {
        return child.toString();
    }
}
