package com.relcore.logical;

import com.relcore.expression.AttributeReference;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node that names its child.
 *
 * <p>The output attributes of the child are re-qualified with the alias, so
 * {@code alias.column} resolves against them. Subqueries carry no runtime
 * meaning and are removed by the optimizer.
 */
public final class Subquery extends LogicalPlan {

    private final String alias;

    /**
     * Creates a subquery node.
     *
     * @param alias the name given to the child
     * @param child the child node
     */
    public Subquery(String alias, LogicalPlan child) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        if (alias.isEmpty()) {
            throw new IllegalArgumentException("alias must not be empty");
        }
    }

    public String alias() {
        return alias;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        List<String> qualifiers = List.of(alias);
        List<AttributeReference> output = new ArrayList<>();
        for (AttributeReference attribute : child().output()) {
            output.add(attribute.withQualifiers(qualifiers));
        }
        return output;
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return new Subquery(alias, newChildren.get(0));
    }

    @Override
    protected List<Object> args() {
        return List.of(alias);
    }

    @Override
    public String argString() {
        return alias;
    }
}
