package com.relcore.execution;

import com.relcore.expression.AttributeReference;
import com.relcore.row.Row;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Reads rows from an external relation.
 *
 * <p>The scan is started anew on every execution; the rows it returns must
 * follow the order of {@link #output()}.
 */
public final class DataSourceScanExec extends PhysicalPlan {

    private final List<AttributeReference> attributes;
    private final Supplier<Iterator<Row>> scan;
    private final String description;
    private final boolean codegenEnabled;

    /**
     * Creates a scan.
     *
     * @param attributes the columns produced
     * @param scan starts the scan
     * @param description the relation and pushed filters, for plan dumps
     * @param codegenEnabled whether code generation was enabled when planning
     */
    public DataSourceScanExec(List<AttributeReference> attributes, Supplier<Iterator<Row>> scan,
                              String description, boolean codegenEnabled) {
        this.attributes = List.copyOf(attributes);
        this.scan = Objects.requireNonNull(scan, "scan must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.codegenEnabled = codegenEnabled;
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
        return List.of(scan.get());
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return this;
    }

    @Override
    public String argString() {
        return attributes + ", " + description;
    }
}
