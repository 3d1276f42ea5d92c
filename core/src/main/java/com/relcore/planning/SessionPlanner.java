package com.relcore.planning;

import com.relcore.execution.FilterExec;
import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.ProjectExec;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.AttributeSet;
import com.relcore.expression.Expression;
import com.relcore.expression.Expressions;
import com.relcore.expression.NamedExpression;
import com.relcore.session.Session;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The planner of a session: extra strategies first, then the built-in ones.
 *
 * <p>The strategy list is fixed when the planner is built.
 */
public class SessionPlanner extends QueryPlanner {

    private final Session session;
    private final List<Strategy> strategies;

    public SessionPlanner(Session session, List<Strategy> extraStrategies) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        List<Strategy> all = new ArrayList<>(extraStrategies);
        all.add(new DataSourceStrategy(this));
        all.add(new TakeOrdered(this));
        all.add(new HashAggregation(this));
        all.add(new LeftSemiJoin(this));
        all.add(new HashJoin(this));
        all.add(new InMemoryScans(this));
        all.add(new LocalTableScans(this));
        all.add(new BasicOperators(this, session));
        all.add(new CartesianProduct(this));
        all.add(new BroadcastNestedLoopJoin(this));
        this.strategies = Collections.unmodifiableList(all);
    }

    @Override
    public List<Strategy> strategies() {
        return strategies;
    }

    public boolean codegenEnabled() {
        return session.conf().codegenEnabled();
    }

    public int numPartitions() {
        return session.conf().numShufflePartitions();
    }

    /**
     * Builds a scan with the filters and projection above it, reading no more
     * columns than needed.
     *
     * <p>When the projection only selects columns, and the filters only read
     * selected columns, the scan produces the projected columns directly and no
     * projection is added. Otherwise the scan produces every column referenced
     * by either list and a projection is added on top.
     *
     * @param projectList the output expressions
     * @param filterPredicates the conjuncts to apply
     * @param prunePushedDownFilters returns the predicates the scan does not already apply
     * @param scanBuilder builds a scan producing the given columns
     * @return the physical plan
     */
    public PhysicalPlan pruneFilterProject(List<NamedExpression> projectList,
                                           List<Expression> filterPredicates,
                                           Function<List<Expression>, List<Expression>> prunePushedDownFilters,
                                           Function<List<AttributeReference>, PhysicalPlan> scanBuilder) {
        AttributeSet projectSet = AttributeSet.referencedBy(projectList);
        AttributeSet filterSet = AttributeSet.referencedBy(filterPredicates);
        Optional<Expression> filterCondition = Expressions.and(prunePushedDownFilters.apply(filterPredicates));

        List<AttributeReference> projectedAttributes = new ArrayList<>();
        for (NamedExpression expression : projectList) {
            if (expression instanceof AttributeReference) {
                projectedAttributes.add((AttributeReference) expression);
            }
        }
        boolean onlyAttributes = projectedAttributes.size() == projectList.size();

        if (onlyAttributes
                && AttributeSet.fromAttributes(projectedAttributes).equals(projectSet)
                && filterSet.subsetOf(projectSet)) {
            PhysicalPlan scan = scanBuilder.apply(projectedAttributes);
            return filterCondition.isPresent() ? new FilterExec(filterCondition.get(), scan) : scan;
        }

        PhysicalPlan scan = scanBuilder.apply(projectSet.union(filterSet).toList());
        PhysicalPlan filtered = filterCondition.isPresent() ? new FilterExec(filterCondition.get(), scan) : scan;
        return new ProjectExec(projectList, filtered);
    }
}
