package com.relcore.planning;

import com.relcore.exception.PlanningException;
import com.relcore.execution.PhysicalPlan;
import com.relcore.logical.LogicalPlan;
import java.util.Iterator;
import java.util.List;

/**
 * Turns logical plans into physical plans by trying an ordered list of strategies.
 *
 * <p>Candidates are produced lazily: a strategy is only applied once every
 * earlier strategy has been tried and its candidates consumed. The first
 * candidate is the one the query runs with.
 */
public abstract class QueryPlanner {

    /**
     * Returns the strategies, in the order they are tried.
     *
     * @return the strategies
     */
    public abstract List<Strategy> strategies();

    /**
     * Returns the candidate physical plans for a logical plan. Every call starts
     * again from the first strategy.
     *
     * @param plan the logical plan
     * @return the candidates, never empty
     * @throws PlanningException if no strategy produces a candidate
     */
    public Iterator<PhysicalPlan> plan(LogicalPlan plan) {
        Iterator<PhysicalPlan> candidates = strategies().stream()
            .flatMap(strategy -> strategy.apply(plan).stream())
            .iterator();
        if (!candidates.hasNext()) {
            throw new PlanningException("No plan for " + plan.simpleString());
        }
        return candidates;
    }

    /**
     * Plans a subtree with the first candidate.
     *
     * @param plan the logical subtree
     * @return its physical plan
     * @throws PlanningException if no strategy produces a candidate
     */
    public PhysicalPlan planLater(LogicalPlan plan) {
        return plan(plan).next();
    }
}
