package com.relcore.analysis;

import com.relcore.expression.AttributeReference;
import com.relcore.expression.ExprId;
import com.relcore.expression.Expression;
import com.relcore.expression.NamedExpression;
import com.relcore.row.Row;
import com.relcore.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents {@code *} or {@code table.*} in a projection list.
 *
 * <p>Expanded by the analyzer into the matching attributes of the input.
 *
 * @param target the qualifier to restrict to, or null for all input columns
 */
public record UnresolvedStar(String target) implements NamedExpression {

    /**
     * Expands this star against the input attributes.
     *
     * @param input the attributes available to the projection
     * @param resolver the name matching policy
     * @return the selected attributes, in input order
     */
    public List<NamedExpression> expand(List<AttributeReference> input, Resolver resolver) {
        List<NamedExpression> expanded = new ArrayList<>();
        for (AttributeReference attribute : input) {
            if (target == null) {
                expanded.add(attribute);
                continue;
            }
            for (String qualifier : attribute.qualifiers()) {
                if (resolver.resolve(qualifier, target)) {
                    expanded.add(attribute);
                    break;
                }
            }
        }
        return expanded;
    }

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
        return target == null ? "*" : target + ".*";
    }
}
