package com.relcore.planning;

import com.relcore.execution.LocalTableScanExec;
import com.relcore.execution.PhysicalPlan;
import com.relcore.logical.LocalRelation;
import com.relcore.logical.LogicalPlan;
import java.util.List;

final class LocalTableScans implements Strategy {

    private final SessionPlanner planner;

    LocalTableScans(SessionPlanner planner) {
        this.planner = planner;
    }

    @Override
    public List<PhysicalPlan> apply(LogicalPlan plan) {
        PhysicalOperation operation = PhysicalOperation.of(plan);
        if (!(operation.child() instanceof LocalRelation)) {
            return List.of();
        }
        LocalRelation relation = (LocalRelation) operation.child();
        boolean codegen = planner.codegenEnabled();
        return List.of(planner.pruneFilterProject(
            operation.projectList(),
            operation.filters(),
            filters -> filters,
            attributes -> new LocalTableScanExec(attributes, relation, codegen)));
    }
}
