package com.relcore.analysis;

import com.relcore.expression.AttributeReference;
import com.relcore.logical.LogicalPlan;
import java.util.Arrays;
import java.util.List;

/**
 * A reference to a table by name, replaced by the catalog's plan during analysis.
 */
public final class UnresolvedRelation extends LogicalPlan {

    private final List<String> tableIdentifier;
    private final String alias;

    /**
     * Creates a table reference.
     *
     * @param tableIdentifier the table identifier
     * @param alias an alias for the relation, or null
     */
    public UnresolvedRelation(List<String> tableIdentifier, String alias) {
        this.tableIdentifier = List.copyOf(tableIdentifier);
        this.alias = alias;
        if (this.tableIdentifier.isEmpty()) {
            throw new IllegalArgumentException("tableIdentifier must not be empty");
        }
    }

    public UnresolvedRelation(String tableName) {
        this(List.of(tableName), null);
    }

    public List<String> tableIdentifier() {
        return tableIdentifier;
    }

    public String alias() {
        return alias;
    }

    public String tableName() {
        return String.join(".", tableIdentifier);
    }

    @Override
    public List<AttributeReference> output() {
        throw Unresolved.invalidCall("output", this);
    }

    @Override
    public boolean resolved() {
        return false;
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return this;
    }

    @Override
    protected List<Object> args() {
        return Arrays.asList(tableIdentifier, alias);
    }

    @Override
    public String argString() {
        return alias == null ? tableName() : tableName() + " AS " + alias;
    }
}
