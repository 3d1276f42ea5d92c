package com.relcore.planning;

import com.relcore.command.RunnableCommand;
import com.relcore.execution.ExecutedCommandExec;
import com.relcore.execution.FilterExec;
import com.relcore.execution.LimitExec;
import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.ProjectExec;
import com.relcore.execution.SortExec;
import com.relcore.logical.Filter;
import com.relcore.logical.Limit;
import com.relcore.logical.LogicalPlan;
import com.relcore.logical.Project;
import com.relcore.logical.Sort;
import com.relcore.logical.Subquery;
import com.relcore.session.Session;
import java.util.List;

/**
 * One-to-one planning of the operators no earlier strategy claimed.
 */
final class BasicOperators implements Strategy {

    private final SessionPlanner planner;
    private final Session session;

    BasicOperators(SessionPlanner planner, Session session) {
        this.planner = planner;
        this.session = session;
    }

    @Override
    public List<PhysicalPlan> apply(LogicalPlan plan) {
        if (plan instanceof RunnableCommand) {
            return List.of(new ExecutedCommandExec((RunnableCommand) plan, session));
        }
        if (plan instanceof Project) {
            Project project = (Project) plan;
            return List.of(new ProjectExec(project.projectList(), planner.planLater(project.child())));
        }
        if (plan instanceof Filter) {
            Filter filter = (Filter) plan;
            return List.of(new FilterExec(filter.condition(), planner.planLater(filter.child())));
        }
        if (plan instanceof Sort) {
            Sort sort = (Sort) plan;
            return List.of(new SortExec(sort.order(), sort.global(), planner.planLater(sort.child())));
        }
        if (plan instanceof Limit) {
            Limit limit = (Limit) plan;
            return List.of(new LimitExec(limit.limit(), planner.planLater(limit.child())));
        }
        if (plan instanceof Subquery) {
            return List.of(planner.planLater(((Subquery) plan).child()));
        }
        return List.of();
    }
}
