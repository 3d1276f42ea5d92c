package com.relcore.execution;

import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expressions;
import com.relcore.expression.NamedExpression;
import com.relcore.row.Row;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * Evaluates the projection list against every input row.
 */
public final class ProjectExec extends PhysicalPlan {

    private final List<NamedExpression> projectList;

    public ProjectExec(List<? extends NamedExpression> projectList, PhysicalPlan child) {
        super(child);
        this.projectList = List.copyOf(projectList);
    }

    public List<NamedExpression> projectList() {
        return projectList;
    }

    public PhysicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        return Expressions.toAttributes(projectList);
    }

    @Override
    public Partitioning outputPartitioning() {
        return child().outputPartitioning();
    }

    @Override
    public List<Iterator<Row>> execute() {
        Function<Row, Row> projection = RowIterators.projection(projectList, child().output());
        return RowIterators.mapPartitions(child().execute(), rows -> RowIterators.map(rows, projection));
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        return new ProjectExec(projectList, newChildren.get(0));
    }

    @Override
    public String argString() {
        return projectList.toString();
    }
}
