package com.relcore.expression;

import com.relcore.row.Row;
import com.relcore.types.DataType;
import java.util.Collections;
import java.util.List;

/**
 * A reference to an input column by position.
 *
 * <p>Produced by {@link Expressions#bindReference} just before execution, and by
 * canonicalisation when comparing plans structurally.
 *
 * @param ordinal the input column position
 * @param dataType the data type of the column
 * @param nullable whether the column is nullable
 */
public record BoundReference(int ordinal, DataType dataType, boolean nullable) implements Expression {

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
        return input.get(ordinal);
    }

    @Override
    public String toString() {
        return "input[" + ordinal + "]";
    }
}
