package com.relcore.planning;

import com.relcore.exception.PlanningException;
import com.relcore.execution.LocalTableScanExec;
import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.TakeOrderedExec;
import com.relcore.execution.joins.CartesianProductExec;
import com.relcore.execution.joins.LeftSemiJoinHashExec;
import com.relcore.execution.joins.NestedLoopJoinExec;
import com.relcore.execution.joins.ShuffledHashJoinExec;
import com.relcore.expression.AttributeReference;
import com.relcore.logical.Join;
import com.relcore.logical.Limit;
import com.relcore.logical.LocalRelation;
import com.relcore.logical.LogicalPlan;
import com.relcore.logical.Sort;
import com.relcore.session.Functions;
import com.relcore.session.Session;
import com.relcore.test.Fixtures;
import com.relcore.test.TestBase;
import com.relcore.test.TestCategories;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tests for strategy selection in the session planner.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("QueryPlanner Tests")
public class QueryPlannerTest extends TestBase {

    private LocalRelation people;
    private LocalRelation depts;

    @Override
    protected void doSetUp() {
        people = LocalRelation.fromSchema(Fixtures.PEOPLE_SCHEMA, Fixtures.PEOPLE);
        depts = LocalRelation.fromSchema(Fixtures.DEPTS_SCHEMA, Fixtures.DEPTS);
    }

    /** A leaf no built-in strategy knows. */
    private static final class UnknownLeaf extends LogicalPlan {
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

    @Nested
    @DisplayName("Selection")
    class SelectionTests {

        @Test
        @DisplayName("Plan without a matching strategy fails with PlanningException")
        void testNoStrategyMatches() {
            SessionPlanner planner = Fixtures.session().planner();

            assertThatThrownBy(() -> planner.plan(new UnknownLeaf()))
                .isInstanceOf(PlanningException.class)
                .hasMessageContaining("No plan for");
        }

        @Test
        @DisplayName("Unplannable subtree fails the whole plan")
        void testUnplannableChild() {
            SessionPlanner planner = Fixtures.session().planner();
            LogicalPlan plan = new Limit(new UnknownLeaf(), 1);

            assertThatThrownBy(() -> planner.plan(plan)).isInstanceOf(PlanningException.class);
        }

        @Test
        @DisplayName("Extra strategies are tried before built-in ones")
        void testExtraStrategiesFirst() {
            PhysicalPlan custom = new LocalTableScanExec(people.output(), people, false);
            Session session = Session.builder()
                .extraStrategy(plan -> plan instanceof LocalRelation ? List.of(custom) : List.of())
                .build();

            assertThat(session.planner().strategies()).hasSize(11);
            assertThat(session.planner().plan(people).next()).isSameAs(custom);
        }

        @Test
        @DisplayName("Strategy list cannot be modified")
        void testStrategiesUnmodifiable() {
            SessionPlanner planner = Fixtures.session().planner();

            assertThatThrownBy(() -> planner.strategies().add(plan -> List.of()))
                .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("Later strategies run only when the iterator advances past earlier candidates")
        void testLazyCandidates() {
            AtomicInteger late = new AtomicInteger();
            Session session = Session.builder()
                .extraStrategy(plan -> List.of(new LocalTableScanExec(people.output(), people, false)))
                .extraStrategy(plan -> {
                    late.incrementAndGet();
                    return List.of();
                })
                .build();

            Iterator<PhysicalPlan> candidates = session.planner().plan(people);
            candidates.next();
            assertThat(late.get()).isZero();

            candidates.hasNext();
            assertThat(late.get()).isEqualTo(1);

            session.planner().plan(people).next();
            assertThat(late.get()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Built-in Strategies")
    class BuiltInStrategyTests {

        private SessionPlanner planner;

        @BeforeEach
        void setUp() {
            planner = Fixtures.session().planner();
        }

        @Test
        @DisplayName("Limit over a global sort becomes TakeOrdered")
        void testTakeOrdered() {
            LogicalPlan plan = new Limit(
                new Sort(people, List.of(Functions.desc(people.output().get(2))), true), 2);

            PhysicalPlan physical = planner.plan(plan).next();

            assertThat(physical).isInstanceOf(TakeOrderedExec.class);
            assertThat(((TakeOrderedExec) physical).limit()).isEqualTo(2);
        }

        @Test
        @DisplayName("Equi-join becomes a shuffled hash join")
        void testHashJoin() {
            LogicalPlan plan = new Join(people, depts, Join.JoinType.LEFT,
                Functions.eq(people.output().get(3), depts.output().get(0)));

            assertThat(planner.plan(plan).next()).isInstanceOf(ShuffledHashJoinExec.class);
        }

        @Test
        @DisplayName("Equi left semi join becomes a left semi hash join")
        void testLeftSemiJoin() {
            LogicalPlan plan = new Join(people, depts, Join.JoinType.LEFT_SEMI,
                Functions.eq(depts.output().get(0), people.output().get(3)));

            assertThat(planner.plan(plan).next()).isInstanceOf(LeftSemiJoinHashExec.class);
        }

        @Test
        @DisplayName("Join without a condition becomes a cartesian product")
        void testCartesianProduct() {
            LogicalPlan plan = new Join(people, depts, Join.JoinType.INNER, null);

            assertThat(planner.plan(plan).next()).isInstanceOf(CartesianProductExec.class);
        }

        @Test
        @DisplayName("Outer join without equality keys becomes a nested loop join")
        void testNestedLoopJoin() {
            LogicalPlan plan = new Join(people, depts, Join.JoinType.FULL,
                Functions.lt(people.output().get(3), depts.output().get(0)));

            assertThat(planner.plan(plan).next()).isInstanceOf(NestedLoopJoinExec.class);
        }
    }
}
