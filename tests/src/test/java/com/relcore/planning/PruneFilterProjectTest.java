package com.relcore.planning;

import com.relcore.execution.FilterExec;
import com.relcore.execution.LocalTableScanExec;
import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.ProjectExec;
import com.relcore.expression.Alias;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import com.relcore.expression.NamedExpression;
import com.relcore.logical.LocalRelation;
import com.relcore.row.Row;
import com.relcore.session.Functions;
import com.relcore.test.Fixtures;
import com.relcore.test.TestBase;
import com.relcore.test.TestCategories;
import com.relcore.types.IntegerType;
import com.relcore.types.StructField;
import com.relcore.types.StructType;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Tests for the filter/project pruning shared by every scan-producing strategy.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Filter/Project Pruning Tests")
public class PruneFilterProjectTest extends TestBase {

    private SessionPlanner planner;
    private LocalRelation relation;
    private AttributeReference colA;
    private AttributeReference colB;
    private AttributeReference colC;
    private List<List<AttributeReference>> requestedScans;
    private Function<List<AttributeReference>, PhysicalPlan> scanBuilder;

    @Override
    protected void doSetUp() {
        planner = Fixtures.session().planner();
        relation = LocalRelation.fromSchema(new StructType(List.of(
                new StructField("a", IntegerType.get()),
                new StructField("b", IntegerType.get()),
                new StructField("c", IntegerType.get()))),
            List.of(Row.of(1, -1, 10), Row.of(2, 5, 20)));
        colA = relation.output().get(0);
        colB = relation.output().get(1);
        colC = relation.output().get(2);
        requestedScans = new ArrayList<>();
        scanBuilder = attributes -> {
            requestedScans.add(attributes);
            return new LocalTableScanExec(attributes, relation, false);
        };
    }

    @Test
    @DisplayName("Selecting columns without filters yields the bare scan")
    void testNoPruningNeeded() {
        logStep("Given: projection [a, b] and no filters");
        List<NamedExpression> projectList = List.of(colA, colB);

        logStep("When: pruning");
        PhysicalPlan plan = planner.pruneFilterProject(projectList, List.of(), f -> f, scanBuilder);

        logStep("Then: the result is exactly scan([a, b])");
        assertThat(plan).isInstanceOf(LocalTableScanExec.class);
        assertThat(plan.output()).containsExactly(colA, colB);
        assertThat(requestedScans).containsExactly(List.of(colA, colB));
    }

    @Test
    @DisplayName("Filter on an unprojected column yields Project(Filter(scan))")
    void testProjectionRequired() {
        logStep("Given: projection [a] and filter b > 0");
        Expression filter = Functions.gt(colB, Functions.lit(0));

        logStep("When: pruning");
        PhysicalPlan plan = planner.pruneFilterProject(List.of(colA), List.of(filter), f -> f, scanBuilder);

        logStep("Then: Project([a], Filter(b > 0, scan([a, b])))");
        assertThat(plan).isInstanceOf(ProjectExec.class);
        ProjectExec project = (ProjectExec) plan;
        assertThat(project.projectList()).containsExactly(colA);
        assertThat(project.child()).isInstanceOf(FilterExec.class);
        FilterExec filterExec = (FilterExec) project.child();
        assertThat(filterExec.condition()).isEqualTo(filter);
        assertThat(filterExec.child()).isInstanceOf(LocalTableScanExec.class);
        assertThat(filterExec.child().output()).containsExactly(colA, colB);

        assertThat(plan.executeCollect()).containsExactly(Row.of(2));
    }

    @Test
    @DisplayName("Filter on a projected column needs no projection")
    void testFilterWithinProjection() {
        Expression filter = Functions.gt(colB, Functions.lit(0));

        PhysicalPlan plan = planner.pruneFilterProject(List.of(colA, colB), List.of(filter), f -> f, scanBuilder);

        assertThat(plan).isInstanceOf(FilterExec.class);
        assertThat(((FilterExec) plan).child().output()).containsExactly(colA, colB);
        assertThat(plan.executeCollect()).containsExactly(Row.of(2, 5));
    }

    @Test
    @DisplayName("Filters already applied by the scan are not re-applied")
    void testPushedDownFiltersPruned() {
        Expression filter = Functions.gt(colB, Functions.lit(0));

        PhysicalPlan plan = planner.pruneFilterProject(List.of(colA), List.of(filter), f -> List.of(), scanBuilder);

        assertThat(plan).isInstanceOf(ProjectExec.class);
        assertThat(((ProjectExec) plan).child()).isInstanceOf(LocalTableScanExec.class);
        assertThat(((ProjectExec) plan).child().output()).containsExactly(colA, colB);
    }

    @Test
    @DisplayName("Computed projections read only the referenced columns")
    void testComputedProjection() {
        NamedExpression sum = new Alias(Functions.add(colA, colC), "a_plus_c");

        PhysicalPlan plan = planner.pruneFilterProject(List.of(sum), List.of(), f -> f, scanBuilder);

        assertThat(plan).isInstanceOf(ProjectExec.class);
        assertThat(requestedScans).containsExactly(List.of(colA, colC));
        assertThat(plan.executeCollect()).containsExactly(Row.of(11), Row.of(22));
    }
}
