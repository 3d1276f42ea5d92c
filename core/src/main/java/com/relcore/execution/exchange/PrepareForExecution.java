package com.relcore.execution.exchange;

import com.relcore.execution.PhysicalPlan;
import com.relcore.rules.Rule;
import com.relcore.rules.RuleExecutor;
import java.util.List;
import java.util.Objects;

/**
 * Prepares a selected physical plan for execution by running the exchange
 * rule exactly once.
 */
public class PrepareForExecution extends RuleExecutor<PhysicalPlan> {

    private final List<Batch<PhysicalPlan>> batches;

    /**
     * Creates the preparation pass.
     *
     * @param exchangeRule the redistribution rule, normally {@link AddExchange}
     */
    public PrepareForExecution(Rule<PhysicalPlan> exchangeRule) {
        Objects.requireNonNull(exchangeRule, "exchangeRule must not be null");
        this.batches = List.of(new Batch<>("Add exchange", new Once(), List.of(exchangeRule)));
    }

    @Override
    protected List<Batch<PhysicalPlan>> batches() {
        return batches;
    }
}
