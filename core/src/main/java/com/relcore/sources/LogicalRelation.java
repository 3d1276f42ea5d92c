package com.relcore.sources;

import com.relcore.expression.AttributeReference;
import com.relcore.logical.LogicalPlan;
import com.relcore.logical.MultiInstanceRelation;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan leaf wrapping a {@link BaseRelation}.
 *
 * <p>Output attributes are created once per instance. Two logical relations
 * have the same result when their base relations are equal.
 */
public final class LogicalRelation extends LogicalPlan implements MultiInstanceRelation {

    private final BaseRelation relation;
    private final List<AttributeReference> output;

    public LogicalRelation(BaseRelation relation) {
        this.relation = Objects.requireNonNull(relation, "relation must not be null");
        this.output = AttributeReference.fromSchema(relation.schema());
    }

    public BaseRelation relation() {
        return relation;
    }

    @Override
    public LogicalRelation newInstance() {
        return new LogicalRelation(relation);
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    @Override
    public boolean sameResult(LogicalPlan other) {
        return other instanceof LogicalRelation
            && ((LogicalRelation) other).relation.equals(relation);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return this;
    }

    @Override
    protected List<Object> args() {
        return List.of(relation);
    }

    @Override
    public String argString() {
        return relation.getClass().getSimpleName() + output;
    }
}
