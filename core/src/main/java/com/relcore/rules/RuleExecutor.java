package com.relcore.rules;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies batches of rules to a plan.
 *
 * <p>Batches run in order. Within a batch every rule is applied in sequence;
 * a {@link Once} batch makes a single pass, a {@link FixedPoint} batch repeats
 * the pass until the plan stops changing or the iteration limit is reached.
 *
 * <p>Example usage:
 * <pre>
 *   LogicalPlan optimized = optimizer.execute(plan);
 * </pre>
 *
 * @param <T> the plan type
 */
public abstract class RuleExecutor<T> {

    private static final Logger logger = LoggerFactory.getLogger(RuleExecutor.class);

    /**
     * How many times a batch is run.
     */
    public sealed interface Strategy permits Once, FixedPoint {

        int maxIterations();
    }

    /**
     * Run the batch exactly once.
     */
    public record Once() implements Strategy {

        @Override
        public int maxIterations() {
            return 1;
        }
    }

    /**
     * Run the batch until the plan stops changing, at most {@code maxIterations} times.
     *
     * @param maxIterations the iteration limit
     */
    public record FixedPoint(int maxIterations) implements Strategy {

        public FixedPoint {
            if (maxIterations < 1) {
                throw new IllegalArgumentException("maxIterations must be positive");
            }
        }
    }

    /**
     * A named, ordered group of rules sharing a strategy.
     *
     * @param name the batch name (for logging)
     * @param strategy how often the batch runs
     * @param rules the rules, applied in order
     * @param <T> the plan type
     */
    public record Batch<T>(String name, Strategy strategy, List<Rule<T>> rules) {

        public Batch {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(strategy, "strategy must not be null");
            rules = List.copyOf(rules);
        }
    }

    /**
     * Returns the batches this executor runs.
     *
     * @return the batches, in order
     */
    protected abstract List<Batch<T>> batches();

    /**
     * Runs every batch against the plan.
     *
     * @param plan the input plan
     * @return the transformed plan
     */
    public T execute(T plan) {
        T current = plan;
        for (Batch<T> batch : batches()) {
            T batchStart = current;
            int iteration = 1;
            while (true) {
                T lastPlan = current;
                for (Rule<T> rule : batch.rules()) {
                    T result = rule.apply(current);
                    if (result != current && logger.isTraceEnabled()) {
                        logger.trace("Applied rule {} in batch {}:\n{}", rule.ruleName(), batch.name(), result);
                    }
                    current = result;
                }
                if (current == lastPlan || current.equals(lastPlan)) {
                    break;
                }
                if (iteration >= batch.strategy().maxIterations()) {
                    if (batch.strategy() instanceof FixedPoint) {
                        logger.warn("Max iterations ({}) reached for batch {}",
                            iteration, batch.name());
                    }
                    break;
                }
                iteration++;
            }
            if (current != batchStart) {
                logger.debug("Batch {} changed the plan after {} iteration(s)", batch.name(), iteration);
            }
        }
        return current;
    }
}
