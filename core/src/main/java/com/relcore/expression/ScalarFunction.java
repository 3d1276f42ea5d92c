package com.relcore.expression;

import com.relcore.row.Row;
import com.relcore.types.DataType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A resolved call of a scalar function implemented by a Java function.
 *
 * <p>Built-in functions and user-defined functions registered through the
 * function registry both resolve to this node. The implementation receives the
 * evaluated arguments, which may contain nulls.
 */
public final class ScalarFunction implements Expression {

    private final String name;
    private final List<Expression> children;
    private final DataType returnType;
    private final Function<List<Object>, Object> function;

    /**
     * Creates a scalar function call.
     *
     * @param name the function name
     * @param children the arguments
     * @param returnType the result type
     * @param function the implementation
     */
    public ScalarFunction(String name, List<Expression> children, DataType returnType,
                          Function<List<Object>, Object> function) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.children = List.copyOf(children);
        this.returnType = Objects.requireNonNull(returnType, "returnType must not be null");
        this.function = Objects.requireNonNull(function, "function must not be null");
    }

    public String name() {
        return name;
    }

    @Override
    public DataType dataType() {
        return returnType;
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public List<Expression> children() {
        return children;
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return new ScalarFunction(name, newChildren, returnType, function);
    }

    @Override
    public Object eval(Row input) {
        List<Object> args = new ArrayList<>(children.size());
        for (Expression child : children) {
            args.add(child.eval(input));
        }
        return function.apply(args);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ScalarFunction)) return false;
        ScalarFunction that = (ScalarFunction) obj;
        return name.equals(that.name) &&
               children.equals(that.children) &&
               returnType.equals(that.returnType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, children, returnType);
    }

    @Override
    public String toString() {
        return name + children.stream().map(Object::toString)
            .collect(Collectors.joining(", ", "(", ")"));
    }
}
