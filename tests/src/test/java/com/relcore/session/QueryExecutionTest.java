package com.relcore.session;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relcore.analysis.UnresolvedRelation;
import com.relcore.exception.AnalysisException;
import com.relcore.exception.PlanningException;
import com.relcore.execution.PhysicalPlan;
import com.relcore.expression.AttributeReference;
import com.relcore.logical.Filter;
import com.relcore.logical.LocalRelation;
import com.relcore.logical.LogicalPlan;
import com.relcore.logical.Project;
import com.relcore.row.Row;
import com.relcore.sources.BaseRelation;
import com.relcore.sources.TableScan;
import com.relcore.test.Fixtures;
import com.relcore.test.TestBase;
import com.relcore.test.TestCategories;
import com.relcore.types.StructType;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;
import static com.relcore.session.Functions.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tests for the staged query pipeline.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("QueryExecution Tests")
public class QueryExecutionTest extends TestBase {

    private LocalRelation people;

    @Override
    protected void doSetUp() {
        people = LocalRelation.fromSchema(Fixtures.PEOPLE_SCHEMA, Fixtures.PEOPLE);
    }

    /** A resolved leaf that no strategy can plan. */
    private static final class UnplannableLeaf extends LogicalPlan {
        @Override
        public List<AttributeReference> output() {
            return List.of();
        }

        @Override
        protected List<Object> args() {
            return List.of();
        }

        @Override
        public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
            return this;
        }

        @Override
        public String argString() {
            return "";
        }
    }

    /** Counts how often its rows are produced. */
    private static final class CountingRelation extends BaseRelation implements TableScan {
        final AtomicInteger scans = new AtomicInteger();

        @Override
        public StructType schema() {
            return Fixtures.PEOPLE_SCHEMA;
        }

        @Override
        public Iterator<Row> buildScan() {
            scans.incrementAndGet();
            return Fixtures.PEOPLE.iterator();
        }
    }

    @Nested
    @DisplayName("Memoization")
    class MemoizationTests {

        @Test
        @DisplayName("Physical plan is computed once and the planner is not consulted again")
        void testSparkPlanMemoized() {
            AtomicInteger strategyCalls = new AtomicInteger();
            Session session = Session.builder()
                .extraStrategy(plan -> {
                    strategyCalls.incrementAndGet();
                    return List.of();
                })
                .build();
            QueryExecution execution = session.executePlan(new Filter(people, gt(people.output().get(2), lit(30))));

            logStep("When: forcing the physical plan twice");
            PhysicalPlan first = execution.sparkPlan();
            int callsAfterFirst = strategyCalls.get();
            PhysicalPlan second = execution.sparkPlan();

            logStep("Then: the same candidate is returned without re-planning");
            assertThat(second).isSameAs(first);
            assertThat(callsAfterFirst).isPositive();
            assertThat(strategyCalls.get()).isEqualTo(callsAfterFirst);
        }

        @Test
        @DisplayName("Every stage returns the same instance on repeated access")
        void testAllStagesMemoized() {
            QueryExecution execution = Fixtures.session().executePlan(people);

            assertThat(execution.analyzed()).isSameAs(execution.analyzed());
            assertThat(execution.withCachedData()).isSameAs(execution.withCachedData());
            assertThat(execution.optimizedPlan()).isSameAs(execution.optimizedPlan());
            assertThat(execution.executedPlan()).isSameAs(execution.executedPlan());
            assertThat(execution.toRows()).isSameAs(execution.toRows());
        }

        @Test
        @DisplayName("A failed stage rethrows the same failure")
        void testFailureMemoized() {
            QueryExecution execution = Fixtures.session().executePlan(new UnplannableLeaf());

            Throwable first = catchThrowable(execution::sparkPlan);
            Throwable second = catchThrowable(execution::sparkPlan);

            assertThat(first).isInstanceOf(PlanningException.class);
            assertThat(second).isSameAs(first);
            assertThat(catchThrowable(execution::executedPlan)).isSameAs(first);
        }

        @Test
        @DisplayName("Iterating the rows twice runs the plan twice")
        void testToRowsReexecutes() {
            Session session = Fixtures.session();
            CountingRelation relation = new CountingRelation();
            QueryExecution execution = session.baseRelationToDataFrame(relation).queryExecution();

            List<Row> firstRun = new ArrayList<>();
            execution.toRows().forEach(firstRun::add);
            List<Row> secondRun = new ArrayList<>();
            execution.toRows().forEach(secondRun::add);

            assertThat(firstRun).containsExactlyElementsOf(Fixtures.PEOPLE);
            assertThat(secondRun).containsExactlyElementsOf(firstRun);
            assertThat(relation.scans.get()).isEqualTo(2);
        }

        @Test
        @TestCategories.Concurrency
        @DisplayName("Concurrent first access computes each stage once")
        void testConcurrentFirstAccess() throws Exception {
            AtomicInteger strategyCalls = new AtomicInteger();
            Session session = Session.builder()
                .extraStrategy(plan -> {
                    strategyCalls.incrementAndGet();
                    return List.of();
                })
                .build();
            QueryExecution execution = session.executePlan(people);
            int threads = 8;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            try {
                List<Future<PhysicalPlan>> results = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return execution.executedPlan();
                    }));
                }
                start.countDown();

                PhysicalPlan expected = results.get(0).get(10, TimeUnit.SECONDS);
                for (Future<PhysicalPlan> result : results) {
                    assertThat(result.get(10, TimeUnit.SECONDS)).isSameAs(expected);
                }
                assertThat(strategyCalls.get()).isEqualTo(1);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Rendering")
    class RenderingTests {

        @Test
        @DisplayName("Dump shows every stage of a successful query")
        void testSuccessfulDump() {
            String dump = Fixtures.session()
                .executePlan(new Project(people, List.of(people.output().get(1))))
                .toString();

            assertThat(dump)
                .contains("== Parsed Logical Plan ==")
                .contains("== Analyzed Logical Plan ==")
                .contains("== Optimized Logical Plan ==")
                .contains("== Physical Plan ==")
                .contains("LocalTableScanExec")
                .contains("Code Generation: false");
        }

        @Test
        @DisplayName("Planning failure leaves earlier stages visible")
        void testPlanningFailureDump() {
            QueryExecution execution = Fixtures.session().executePlan(new UnplannableLeaf());

            String dump = execution.toString();

            assertThat(dump).contains("== Analyzed Logical Plan ==\nUnplannableLeaf");
            assertThat(dump).contains("== Optimized Logical Plan ==\nUnplannableLeaf");
            assertThat(dump).contains("== Physical Plan ==\n" + PlanningException.class.getName());
            assertThat(execution.simpleString()).contains("No plan for");
        }

        @Test
        @DisplayName("Analysis failure is rendered in place of every later stage")
        void testAnalysisFailureDump() {
            QueryExecution execution = Fixtures.session().executePlan(new UnresolvedRelation("missing"));

            String dump = execution.toString();

            assertThat(dump).contains("== Parsed Logical Plan ==\nUnresolvedRelation");
            assertThat(dump).contains("Table not found: missing");
            assertThatThrownBy(execution::analyzed).isInstanceOf(AnalysisException.class);
        }

        @Test
        @DisplayName("JSON rendering reports a failed stage as an error")
        void testJsonWithFailure() {
            ObjectNode json = Fixtures.session().executePlan(new UnplannableLeaf()).toJson();

            assertThat(json.has("parsed")).isTrue();
            assertThat(json.get("analyzed").get("node").asText()).isEqualTo("UnplannableLeaf");
            assertThat(json.get("physical").get("error").asText()).contains("No plan for");
        }

        @Test
        @DisplayName("JSON rendering includes partitioning of the physical plan")
        void testJsonPhysical() {
            ObjectNode json = Fixtures.session().executePlan(people).toJson();

            assertThat(json.get("physical").get("node").asText()).isEqualTo("LocalTableScanExec");
            assertThat(json.get("physical").has("partitioning")).isTrue();
        }
    }
}
