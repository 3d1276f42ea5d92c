package com.relcore.execution;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relcore.expression.AttributeReference;
import com.relcore.row.Row;
import com.relcore.trees.TreeNode;
import com.relcore.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Base class for executable operators.
 *
 * <p>A physical plan is produced from an optimized logical plan by the planner
 * and prepared for execution by inserting exchanges where the partitioning of
 * a child does not meet the requirement of its parent.
 *
 * <p>{@link #execute()} returns one lazily evaluated iterator per output
 * partition. Operators never share state between calls, so a plan can be
 * executed more than once.
 */
public abstract class PhysicalPlan extends TreeNode<PhysicalPlan> {

    protected PhysicalPlan() {
        super();
    }

    protected PhysicalPlan(PhysicalPlan child) {
        super(child);
    }

    protected PhysicalPlan(List<PhysicalPlan> children) {
        super(children);
    }

    /**
     * Returns the attributes produced by this operator.
     *
     * @return the output attributes
     */
    public abstract List<AttributeReference> output();

    /**
     * Executes this operator.
     *
     * @return one row iterator per output partition
     */
    public abstract List<Iterator<Row>> execute();

    /**
     * Returns how the output of this operator is partitioned.
     *
     * @return the output partitioning
     */
    public Partitioning outputPartitioning() {
        return new Partitioning.UnknownPartitioning(0);
    }

    /**
     * Returns, for each child, the distribution this operator needs its input in.
     *
     * @return one distribution per child
     */
    public List<Distribution> requiredChildDistribution() {
        return Collections.nCopies(children.size(), Distribution.UnspecifiedDistribution.INSTANCE);
    }

    /**
     * Returns whether this plan was planned with code generation enabled.
     *
     * <p>Leaf operators record the setting they were planned with; other
     * operators report it when any child does.
     *
     * @return true if code generation is enabled
     */
    public boolean codegenEnabled() {
        for (PhysicalPlan child : children) {
            if (child.codegenEnabled()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the output schema of this operator.
     *
     * @return the schema
     */
    public StructType schema() {
        return AttributeReference.toSchema(output());
    }

    /**
     * Executes this operator and collects every row, partition by partition.
     *
     * @return the rows
     */
    public List<Row> executeCollect() {
        List<Row> rows = new ArrayList<>();
        for (Iterator<Row> partition : execute()) {
            partition.forEachRemaining(rows::add);
        }
        return rows;
    }

    @Override
    protected void describeJson(ObjectNode node) {
        node.put("partitioning", outputPartitioning().toString());
        ArrayNode output = node.putArray("output");
        for (AttributeReference attribute : output()) {
            output.add(attribute.toString());
        }
    }
}
