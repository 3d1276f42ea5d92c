package com.relcore.exception;

/**
 * Thrown when no planning strategy produces a physical plan for a logical plan.
 *
 * <p>This indicates a logical operator shape the planner does not support.
 */
public class PlanningException extends RuntimeException {

    public PlanningException(String message) {
        super(message);
    }
}
