package com.relcore.execution.exchange;

import com.relcore.execution.AggregateExec;
import com.relcore.execution.FilterExec;
import com.relcore.execution.LocalTableScanExec;
import com.relcore.execution.Partitioning;
import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.SortExec;
import com.relcore.execution.joins.ShuffledHashJoinExec;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import com.relcore.logical.Join.JoinType;
import com.relcore.logical.LocalRelation;
import com.relcore.row.Row;
import com.relcore.session.SQLConf;
import com.relcore.test.Fixtures;
import com.relcore.test.TestBase;
import com.relcore.test.TestCategories;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;
import static com.relcore.session.Functions.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Tests for {@link AddExchange}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("AddExchange Tests")
public class AddExchangeTest extends TestBase {

    private AddExchange rule;
    private LocalRelation people;
    private LocalRelation depts;
    private PhysicalPlan peopleScan;
    private PhysicalPlan deptsScan;

    @Override
    protected void doSetUp() {
        SQLConf conf = new SQLConf();
        conf.setConf(SQLConf.SHUFFLE_PARTITIONS, "4");
        rule = new AddExchange(conf);
        people = LocalRelation.fromSchema(Fixtures.PEOPLE_SCHEMA, Fixtures.PEOPLE);
        depts = LocalRelation.fromSchema(Fixtures.DEPTS_SCHEMA, Fixtures.DEPTS);
        peopleScan = new LocalTableScanExec(people.output(), people, false);
        deptsScan = new LocalTableScanExec(depts.output(), depts, false);
    }

    private AttributeReference dept() {
        return people.output().get(3);
    }

    private static List<Row> rows(PhysicalPlan plan) {
        List<Row> rows = new ArrayList<>();
        for (Iterator<Row> partition : plan.execute()) {
            partition.forEachRemaining(rows::add);
        }
        return rows;
    }

    @Test
    @DisplayName("Grouped aggregation gets a hash exchange on its grouping keys")
    void testClusteredAggregate() {
        PhysicalPlan plan = new AggregateExec(List.of(dept()),
            List.of(dept(), alias(count(lit(1)), "c")), peopleScan);

        PhysicalPlan prepared = rule.apply(plan);

        PhysicalPlan child = prepared.children().get(0);
        assertThat(child).isInstanceOf(Exchange.class);
        assertThat(((Exchange) child).partitioning())
            .isEqualTo(new Partitioning.HashPartitioning(List.<Expression>of(dept()), 4));
        assertThat(rows(prepared)).containsExactlyInAnyOrder(Row.of(10, 2L), Row.of(20, 2L), Row.of(30, 1L));
    }

    @Test
    @DisplayName("Global aggregation gets a single-partition exchange")
    void testGlobalAggregate() {
        PhysicalPlan plan = new AggregateExec(List.of(), List.of(alias(count(lit(1)), "c")), peopleScan);

        PhysicalPlan prepared = rule.apply(plan);

        assertThat(((Exchange) prepared.children().get(0)).partitioning())
            .isEqualTo(Partitioning.SinglePartition.INSTANCE);
        assertThat(rows(prepared)).containsExactly(Row.of(5L));
    }

    @Test
    @DisplayName("Global sort gets a range exchange and stays ordered across partitions")
    void testGlobalSort() {
        PhysicalPlan plan = new SortExec(List.of(desc(people.output().get(0))), true, peopleScan);

        PhysicalPlan prepared = rule.apply(plan);

        assertThat(((Exchange) prepared.children().get(0)).partitioning())
            .isInstanceOf(Partitioning.RangePartitioning.class);
        List<Object> ids = new ArrayList<>();
        for (Row row : rows(prepared)) {
            ids.add(row.get(0));
        }
        assertThat(ids).containsExactly(5, 4, 3, 2, 1);
    }

    @Test
    @DisplayName("Both sides of a shuffled join are hash partitioned on their keys")
    void testJoinSides() {
        PhysicalPlan plan = new ShuffledHashJoinExec(List.of(dept()), List.of(depts.output().get(0)),
            JoinType.INNER, null, peopleScan, deptsScan);

        PhysicalPlan prepared = rule.apply(plan);

        assertThat(prepared.children()).allSatisfy(side -> assertThat(side).isInstanceOf(Exchange.class));
        assertThat(rows(prepared)).hasSize(4);
    }

    @Test
    @DisplayName("Operators without requirements are left alone")
    void testNoRequirement() {
        PhysicalPlan plan = new FilterExec(gt(dept(), lit(10)), peopleScan);

        assertThat(rule.apply(plan)).isSameAs(plan);
    }

    @Test
    @DisplayName("Applying the rule twice adds nothing")
    void testIdempotent() {
        PhysicalPlan plan = new AggregateExec(List.of(dept()),
            List.of(dept(), alias(count(lit(1)), "c")), peopleScan);

        PhysicalPlan once = rule.apply(plan);

        assertThat(rule.apply(once)).isSameAs(once);
    }
}
