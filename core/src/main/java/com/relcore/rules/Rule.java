package com.relcore.rules;

/**
 * A transformation of a plan tree.
 *
 * <p>Rules transform a plan into an equivalent plan. A rule that does not apply
 * must return its argument unchanged (the same instance), which is how the
 * {@link RuleExecutor} detects that a fixed point has been reached.
 *
 * <p>Rules should be idempotent: applying the same rule twice should not cause
 * further changes after the first application.
 *
 * @param <T> the plan type
 */
@FunctionalInterface
public interface Rule<T> {

    /**
     * Applies this rule to a plan.
     *
     * @param plan the input plan
     * @return the transformed plan, or the input if the rule does not apply
     */
    T apply(T plan);

    /**
     * Returns the name of this rule.
     *
     * <p>Used for logging and debugging.
     *
     * @return the rule name
     */
    default String ruleName() {
        return getClass().getSimpleName();
    }
}
