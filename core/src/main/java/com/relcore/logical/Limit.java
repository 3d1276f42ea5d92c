package com.relcore.logical;

import com.relcore.expression.AttributeReference;
import java.util.List;

/**
 * Logical plan node representing a LIMIT clause.
 */
public final class Limit extends LogicalPlan {

    private final int limit;

    /**
     * Creates a limit node.
     *
     * @param child the child node
     * @param limit the maximum number of rows to return (must be non-negative)
     */
    public Limit(LogicalPlan child, int limit) {
        super(child);
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative");
        }
        this.limit = limit;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public int limit() {
        return limit;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return new Limit(newChildren.get(0), limit);
    }

    @Override
    protected List<Object> args() {
        return List.of(limit);
    }

    @Override
    public String argString() {
        return String.valueOf(limit);
    }
}
