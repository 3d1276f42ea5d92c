package com.relcore.session;

import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.RowIterators;
import com.relcore.row.Row;
import java.util.Iterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs plans in the calling thread, returning the partitions one after another.
 */
public class LocalExecutionEngine implements ExecutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(LocalExecutionEngine.class);

    @Override
    public Iterator<Row> execute(PhysicalPlan plan) {
        logger.debug("Executing plan:\n{}", plan);
        return plan.execute().stream()
            .flatMap(RowIterators::stream)
            .iterator();
    }
}
