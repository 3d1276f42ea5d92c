package com.relcore.session;

import com.relcore.execution.PhysicalPlan;
import com.relcore.row.Row;
import java.util.Iterator;

/**
 * Runs prepared physical plans.
 */
@FunctionalInterface
public interface ExecutionEngine {

    /**
     * Executes a plan. Each call runs the plan again.
     *
     * @param plan the prepared plan
     * @return the result rows
     */
    Iterator<Row> execute(PhysicalPlan plan);
}
