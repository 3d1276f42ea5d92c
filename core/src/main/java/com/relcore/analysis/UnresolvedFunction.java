package com.relcore.analysis;

import com.relcore.expression.Expression;
import com.relcore.row.Row;
import com.relcore.types.DataType;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A function call referred to by name, looked up in the
 * {@link FunctionRegistry} during analysis.
 *
 * @param name the function name
 * @param children the arguments
 */
public record UnresolvedFunction(String name, List<Expression> children) implements Expression {

    public UnresolvedFunction {
        children = List.copyOf(children);
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
    public Expression withNewChildren(List<Expression> newChildren) {
        return new UnresolvedFunction(name, newChildren);
    }

    @Override
    public Object eval(Row input) {
        throw Unresolved.invalidCall("eval", this);
    }

    @Override
    public String toString() {
        return "'" + name + children.stream().map(Object::toString)
            .collect(Collectors.joining(", ", "(", ")"));
    }
}
