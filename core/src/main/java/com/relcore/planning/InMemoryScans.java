package com.relcore.planning;

import com.relcore.cache.InMemoryRelation;
import com.relcore.cache.InMemoryTableScanExec;
import com.relcore.execution.PhysicalPlan;
import com.relcore.logical.LogicalPlan;
import java.util.List;

/**
 * Plans scans of cached data. Every filter is also handed to the scan, which
 * uses it to skip batches; the filter is still applied to the rows.
 */
final class InMemoryScans implements Strategy {

    private final SessionPlanner planner;

    InMemoryScans(SessionPlanner planner) {
        this.planner = planner;
    }

    @Override
    public List<PhysicalPlan> apply(LogicalPlan plan) {
        PhysicalOperation operation = PhysicalOperation.of(plan);
        if (!(operation.child() instanceof InMemoryRelation)) {
            return List.of();
        }
        InMemoryRelation relation = (InMemoryRelation) operation.child();
        boolean codegen = planner.codegenEnabled();
        return List.of(planner.pruneFilterProject(
            operation.projectList(),
            operation.filters(),
            filters -> filters,
            attributes -> new InMemoryTableScanExec(attributes, operation.filters(), relation, codegen)));
    }
}
