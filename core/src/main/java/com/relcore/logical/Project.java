package com.relcore.logical;

import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import com.relcore.expression.Expressions;
import com.relcore.expression.NamedExpression;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing a projection (SELECT clause).
 *
 * <p>This node selects and potentially transforms columns from its child node.
 * Every element of the projection list is named, so the output of a project
 * is exactly the attributes of its list.
 *
 * <p>Examples:
 * <pre>
 *   df.select(col("name"), col("age"))
 *   df.select(alias(mul(col("price"), lit(1.1)), "gross"))
 * </pre>
 */
public final class Project extends LogicalPlan {

    private final List<NamedExpression> projectList;

    /**
     * Creates a projection node.
     *
     * @param child the child node
     * @param projectList the projection expressions
     */
    public Project(LogicalPlan child, List<? extends NamedExpression> projectList) {
        super(child);
        this.projectList = List.copyOf(Objects.requireNonNull(projectList, "projectList must not be null"));

        if (this.projectList.isEmpty()) {
            throw new IllegalArgumentException("projectList must not be empty");
        }
    }

    public List<NamedExpression> projectList() {
        return projectList;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        return Expressions.toAttributes(projectList);
    }

    @Override
    public List<Expression> expressions() {
        return new ArrayList<>(projectList);
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> f) {
        List<NamedExpression> next = mapAll(projectList, f);
        return next == projectList ? this : new Project(child(), next);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return new Project(newChildren.get(0), projectList);
    }

    @Override
    protected List<Object> args() {
        return List.of(projectList);
    }

    @Override
    public String argString() {
        return projectList.toString();
    }
}
