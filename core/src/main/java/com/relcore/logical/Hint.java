package com.relcore.logical;

import com.relcore.expression.AttributeReference;
import java.util.List;
import java.util.Objects;

/**
 * Marker node carrying a query hint the engine does not act on.
 *
 * <p>Hints are removed right after analysis, before the cache lookup, so they
 * never prevent a cached plan from matching.
 */
public final class Hint extends LogicalPlan {

    private final String name;

    public Hint(String name, LogicalPlan child) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return new Hint(name, newChildren.get(0));
    }

    @Override
    protected List<Object> args() {
        return List.of(name);
    }

    @Override
    public String argString() {
        return name;
    }
}
