package com.relcore.session;

import com.relcore.exception.AnalysisException;
import com.relcore.logical.Join.JoinType;
import com.relcore.row.Row;
import com.relcore.test.Fixtures;
import com.relcore.test.TestBase;
import com.relcore.test.TestCategories;
import com.relcore.types.DoubleType;
import com.relcore.types.IntegerType;
import com.relcore.types.StructField;
import com.relcore.types.StructType;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;
import static com.relcore.session.Functions.*;

import java.util.ArrayList;
import java.util.List;

/**
 * End-to-end tests for the data frame API.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("DataFrame Tests")
public class DataFrameTest extends TestBase {

    private Session session;
    private DataFrame people;
    private DataFrame depts;

    @Override
    protected void doSetUp() {
        session = Fixtures.session();
        people = Fixtures.people(session);
        depts = Fixtures.depts(session);
    }

    private static List<Object> column(List<Row> rows, int ordinal) {
        List<Object> values = new ArrayList<>();
        for (Row row : rows) {
            values.add(row.get(ordinal));
        }
        return values;
    }

    @Nested
    @DisplayName("Projection and Filtering")
    class ProjectionTests {

        @Test
        @DisplayName("Columns follow the schema")
        void testColumns() {
            assertThat(people.columns()).containsExactly("id", "name", "age", "dept");
            assertThat(people.select("name", "id").columns()).containsExactly("name", "id");
        }

        @Test
        @DisplayName("Filter drops rows whose condition is false or null")
        void testFilter() {
            List<Row> rows = people.filter(gt(col("age"), lit(30))).select("name").collect();

            assertThat(rows).containsExactlyInAnyOrder(Row.of("alice"), Row.of("carol"));
        }

        @Test
        @DisplayName("Computed columns are evaluated per row")
        void testComputedColumn() {
            List<Row> rows = people
                .filter(isNotNull(col("age")))
                .select(col("name"), alias(add(col("age"), lit(1)), "next_age"))
                .collect();

            logData("rows", rows);
            assertThat(rows).containsExactlyInAnyOrder(
                Row.of("alice", 35), Row.of("bob", 20), Row.of("carol", 46), Row.of("erin", 29));
        }

        @Test
        @DisplayName("Resolving an unknown column name fails eagerly")
        void testUnknownColumn() {
            assertThatThrownBy(() -> people.col("salary"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("salary")
                .hasMessageContaining("id, name, age, dept");
            assertThatThrownBy(() -> people.select("salary"))
                .isInstanceOf(AnalysisException.class);
        }

        @Test
        @DisplayName("Resolved columns can be reused across data frames")
        void testResolvedColumn() {
            List<Row> rows = people.filter(eq(people.col("id"), lit(3))).select(people.col("name")).collect();

            assertThat(rows).containsExactly(Row.of("carol"));
        }

        @Test
        @DisplayName("Built-in and registered functions are applied")
        void testFunctions() {
            session.udf().register("plus_one", IntegerType.get(),
                args -> args.get(0) == null ? null : (Integer) args.get(0) + 1);

            List<Row> rows = people
                .filter(eq(col("id"), lit(2)))
                .select(alias(upper(col("name")), "upper_name"), alias(callUdf("plus_one", col("id")), "next_id"))
                .collect();

            assertThat(rows).containsExactly(Row.of("BOB", 3));
        }
    }

    @Nested
    @DisplayName("Joins")
    class JoinTests {

        private DataFrame joined(JoinType joinType) {
            return people.join(depts, eq(col("dept"), col("dept_id")), joinType);
        }

        @Test
        @DisplayName("Inner join keeps matching pairs")
        void testInnerJoin() {
            List<Row> rows = joined(JoinType.INNER).select("name", "dept_name").collect();

            assertThat(rows).containsExactlyInAnyOrder(
                Row.of("alice", "eng"), Row.of("bob", "eng"),
                Row.of("carol", "sales"), Row.of("dave", "sales"));
        }

        @Test
        @DisplayName("Left outer join pads unmatched left rows with nulls")
        void testLeftOuterJoin() {
            List<Row> rows = joined(JoinType.LEFT).select("name", "dept_name").collect();

            assertThat(rows).hasSize(5).contains(Row.of("erin", null));
        }

        @Test
        @DisplayName("Right outer join pads unmatched right rows with nulls")
        void testRightOuterJoin() {
            List<Row> rows = joined(JoinType.RIGHT).select("name", "dept_name").collect();

            assertThat(rows).hasSize(5).contains(Row.of(null, "legal"));
        }

        @Test
        @DisplayName("Full outer join pads both sides")
        void testFullOuterJoin() {
            List<Row> rows = joined(JoinType.FULL).select("name", "dept_name").collect();

            assertThat(rows).hasSize(6).contains(Row.of("erin", null), Row.of(null, "legal"));
        }

        @Test
        @DisplayName("Left semi join returns each matching left row once")
        void testLeftSemiJoin() {
            DataFrame semi = joined(JoinType.LEFT_SEMI);

            assertThat(semi.columns()).containsExactly("id", "name", "age", "dept");
            assertThat(column(semi.collect(), 0)).containsExactlyInAnyOrder(1, 2, 3, 4);
        }

        @Test
        @DisplayName("Join without condition is a cartesian product")
        void testCartesianJoin() {
            assertThat(people.join(depts).count()).isEqualTo(15L);
        }

        @Test
        @DisplayName("Non-equi join condition is evaluated per pair")
        void testNonEquiJoin() {
            long count = people.join(depts, lt(col("dept"), col("dept_id"))).count();

            assertThat(count).isEqualTo(7L);
        }

        @Test
        @DisplayName("Self join through aliases keeps both sides apart")
        void testSelfJoin() {
            DataFrame pairs = people.as("a")
                .join(people.as("b"), and(eq(col("a.dept"), col("b.dept")), lt(col("a.id"), col("b.id"))))
                .select(col("a.name"), col("b.name"));

            assertThat(pairs.collect()).containsExactlyInAnyOrder(
                Row.of("alice", "bob"), Row.of("carol", "dave"));
        }

        @Test
        @DisplayName("Equi-join matches int and double keys that compare equal")
        void testMixedNumericJoin() {
            DataFrame ints = session.createDataFrame(List.of(Row.of(1), Row.of(2)),
                new StructType(List.of(new StructField("a", IntegerType.get(), false))));
            DataFrame doubles = session.createDataFrame(List.of(Row.of(1.0), Row.of(3.0)),
                new StructType(List.of(new StructField("b", DoubleType.get(), false))));

            assertThat(ints.filter(eq(col("a"), lit(1.0))).collect()).containsExactly(Row.of(1));
            assertThat(ints.join(doubles, eq(col("a"), col("b"))).collect())
                .containsExactly(Row.of(1, 1.0));
            assertThat(ints.join(doubles).filter(eq(col("a"), col("b"))).collect())
                .containsExactly(Row.of(1, 1.0));
        }
    }

    @Nested
    @DisplayName("Aggregation, Ordering and Limits")
    class AggregationTests {

        @Test
        @DisplayName("Grouped count")
        void testGroupedCount() {
            List<Row> rows = people.groupBy("dept").count().collect();

            assertThat(rows).containsExactlyInAnyOrder(Row.of(10, 2L), Row.of(20, 2L), Row.of(30, 1L));
        }

        @Test
        @DisplayName("Aggregates skip nulls")
        void testAggregatesSkipNulls() {
            List<Row> rows = people.groupBy("dept")
                .agg(alias(sum(col("age")), "total"), alias(max(col("age")), "oldest"), alias(avg(col("age")), "mean"))
                .collect();

            assertThat(rows).containsExactlyInAnyOrder(
                Row.of(10, 53L, 34, 26.5),
                Row.of(20, 45L, 45, 45.0),
                Row.of(30, 28L, 28, 28.0));
        }

        @Test
        @DisplayName("Global aggregate over the whole frame")
        void testGlobalAggregate() {
            List<Row> rows = people.agg(alias(min(col("age")), "youngest"), alias(count(col("age")), "known")).collect();

            assertThat(rows).containsExactly(Row.of(19, 4L));
        }

        @Test
        @DisplayName("Count of an empty result is zero")
        void testEmptyCount() {
            assertThat(people.filter(gt(col("id"), lit(100))).count()).isZero();
        }

        @Test
        @DisplayName("Ascending sort puts nulls first")
        void testAscendingSort() {
            List<Row> rows = people.orderBy(col("age")).select("name").collect();

            assertThat(column(rows, 0)).containsExactly("dave", "bob", "erin", "alice", "carol");
        }

        @Test
        @DisplayName("Descending sort puts nulls last")
        void testDescendingSort() {
            List<Row> rows = people.orderBy(desc(col("age"))).select("name").collect();

            assertThat(column(rows, 0)).containsExactly("carol", "alice", "erin", "bob", "dave");
        }

        @Test
        @DisplayName("Sort followed by limit returns the top rows")
        void testTopK() {
            DataFrame top = people.orderBy(desc(col("id"))).limit(2);

            assertThat(top.explain(false)).contains("TakeOrderedExec");
            assertThat(column(top.collect(), 1)).containsExactly("erin", "dave");
        }

        @Test
        @DisplayName("Limit without order caps the row count")
        void testLimit() {
            assertThat(people.limit(3).collect()).hasSize(3);
            assertThat(people.limit(0).collect()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Tables and Rendering")
    class TableTests {

        @Test
        @DisplayName("Registered frames are queryable by name")
        void testRegisterTempTable() {
            people.filter(lt(col("age"), lit(30))).registerTempTable("young");

            assertThat(column(session.table("young").collect(), 1)).containsExactlyInAnyOrder("bob", "erin");
        }

        @Test
        @DisplayName("Extended explain renders every stage")
        void testExplain() {
            String plan = people.filter(gt(col("age"), lit(30))).explain(true);

            assertThat(plan).contains("== Parsed Logical Plan ==").contains("FilterExec");
        }

        @Test
        @DisplayName("String form lists names and types")
        void testToString() {
            assertThat(depts.toString()).startsWith("[dept_id: ").contains("dept_name: ");
        }
    }
}
