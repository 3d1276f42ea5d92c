package com.relcore.optimizer;

import com.relcore.logical.LogicalPlan;
import com.relcore.rules.Rule;
import com.relcore.rules.RuleExecutor;
import java.util.ArrayList;
import java.util.List;

/**
 * Default logical optimizer.
 *
 * <p>Subquery wrappers are removed once, then filters are combined and pushed
 * towards the leaves until the plan stops changing.
 */
public class Optimizer extends RuleExecutor<LogicalPlan> {

    /** Iteration limit of the fixed-point batches. */
    public static final int MAX_ITERATIONS = 100;

    private final List<Batch<LogicalPlan>> batches;

    public Optimizer() {
        this(List.of());
    }

    /**
     * Creates an optimizer that runs extra rules after the default ones.
     *
     * @param extraRules rules appended, as a fixed-point batch, after the default batches
     */
    public Optimizer(List<Rule<LogicalPlan>> extraRules) {
        List<Batch<LogicalPlan>> all = new ArrayList<>(List.of(
            new Batch<>("Remove SubQueries", new Once(), List.of(
                new EliminateSubqueries())),
            new Batch<>("Filter Pushdown", new FixedPoint(MAX_ITERATIONS), List.of(
                new CombineFilters(),
                new CombineLimits(),
                new PushPredicateThroughProject(),
                new PushPredicateThroughJoin()))));
        if (!extraRules.isEmpty()) {
            all.add(new Batch<>("User Provided Optimizers", new FixedPoint(MAX_ITERATIONS), extraRules));
        }
        this.batches = List.copyOf(all);
    }

    @Override
    protected List<Batch<LogicalPlan>> batches() {
        return batches;
    }
}
