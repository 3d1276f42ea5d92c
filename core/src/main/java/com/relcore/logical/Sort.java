package com.relcore.logical;

import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import com.relcore.expression.SortOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing a sort operation (ORDER BY clause).
 *
 * <p>A global sort orders the whole result; a non-global sort only orders the
 * rows within each partition.
 */
public final class Sort extends LogicalPlan {

    private final List<SortOrder> order;
    private final boolean global;

    /**
     * Creates a sort node.
     *
     * @param child the child node
     * @param order the sort orders (must not be empty)
     * @param global whether the whole result must be ordered
     */
    public Sort(LogicalPlan child, List<SortOrder> order, boolean global) {
        super(child);
        this.order = List.copyOf(Objects.requireNonNull(order, "order must not be null"));
        this.global = global;

        if (this.order.isEmpty()) {
            throw new IllegalArgumentException("order must not be empty");
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public List<SortOrder> order() {
        return order;
    }

    public boolean global() {
        return global;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public List<Expression> expressions() {
        return new ArrayList<>(order);
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> f) {
        List<SortOrder> next = mapAll(order, f);
        return next == order ? this : new Sort(child(), next, global);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return new Sort(newChildren.get(0), order, global);
    }

    @Override
    protected List<Object> args() {
        return List.of(order, global);
    }

    @Override
    public String argString() {
        return order + ", " + global;
    }
}
