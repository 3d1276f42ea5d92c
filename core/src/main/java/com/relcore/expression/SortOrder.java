package com.relcore.expression;

import com.relcore.row.Row;
import com.relcore.types.DataType;
import com.relcore.types.DataTypes;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One key of an ORDER BY clause. Nulls sort first in ascending order and last in
 * descending order.
 *
 * @param child the sort key
 * @param ascending the direction
 */
public record SortOrder(Expression child, boolean ascending) implements Expression {

    public SortOrder {
        Objects.requireNonNull(child, "child must not be null");
    }

    /**
     * Builds a row comparator from bound sort orders.
     *
     * @param orders the sort keys, bound to the input of the sort
     * @return the comparator
     */
    public static Comparator<Row> ordering(List<SortOrder> orders) {
        return (a, b) -> {
            for (SortOrder order : orders) {
                Object left = order.child.eval(a);
                Object right = order.child.eval(b);
                int cmp;
                if (left == null && right == null) {
                    cmp = 0;
                } else if (left == null) {
                    cmp = -1;
                } else if (right == null) {
                    cmp = 1;
                } else {
                    cmp = DataTypes.compare(left, right);
                }
                if (cmp != 0) {
                    return order.ascending ? cmp : -cmp;
                }
            }
            return 0;
        };
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
        return new SortOrder(newChildren.get(0), ascending);
    }

    @Override
    public Object eval(Row input) {
        throw new UnsupportedOperationException("SortOrder cannot be evaluated");
    }

    @Override
    public String toString() {
        return child + (ascending ? " ASC" : " DESC");
    }
}
