package com.relcore.execution;

import com.relcore.expression.AttributeReference;
import com.relcore.logical.LocalRelation;
import com.relcore.row.Row;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Scans the rows of a {@link LocalRelation}, keeping only the requested columns.
 */
public final class LocalTableScanExec extends PhysicalPlan {

    private final List<AttributeReference> attributes;
    private final LocalRelation relation;
    private final boolean codegenEnabled;

    /**
     * Creates a scan.
     *
     * @param attributes the columns to produce, a subset of the relation output
     * @param relation the relation
     * @param codegenEnabled whether code generation was enabled when planning
     */
    public LocalTableScanExec(List<AttributeReference> attributes, LocalRelation relation, boolean codegenEnabled) {
        this.attributes = List.copyOf(attributes);
        this.relation = Objects.requireNonNull(relation, "relation must not be null");
        this.codegenEnabled = codegenEnabled;
    }

    public LocalRelation relation() {
        return relation;
    }

    @Override
    public List<AttributeReference> output() {
        return attributes;
    }

    @Override
    public Partitioning outputPartitioning() {
        return new Partitioning.UnknownPartitioning(1);
    }

    @Override
    public boolean codegenEnabled() {
        return codegenEnabled;
    }

    @Override
    public List<Iterator<Row>> execute() {
        return List.of(RowIterators.map(relation.data().iterator(),
            RowIterators.columnPruning(attributes, relation.output())));
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return this;
    }

    @Override
    public String argString() {
        return attributes.toString();
    }
}
