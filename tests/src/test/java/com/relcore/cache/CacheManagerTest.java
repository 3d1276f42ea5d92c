package com.relcore.cache;

import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.RowIterators;
import com.relcore.logical.LocalRelation;
import com.relcore.row.Row;
import com.relcore.session.DataFrame;
import com.relcore.session.QueryExecution;
import com.relcore.session.SQLConf;
import com.relcore.session.Session;
import com.relcore.test.Fixtures;
import com.relcore.test.TestBase;
import com.relcore.test.TestCategories;

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

/**
 * Tests for {@link CacheManager}.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("CacheManager Tests")
public class CacheManagerTest extends TestBase {

    private Session session;

    @Override
    protected void doSetUp() {
        session = Session.builder()
            .config(SQLConf.SHUFFLE_PARTITIONS, "4")
            .config(SQLConf.COLUMN_BATCH_SIZE, "2")
            .build();
        Fixtures.people(session).registerTempTable("people");
    }

    private static List<InMemoryTableScanExec> inMemoryScans(DataFrame df) {
        List<InMemoryTableScanExec> scans = new ArrayList<>();
        for (PhysicalPlan plan : df.queryExecution().executedPlan().collect(p -> p instanceof InMemoryTableScanExec)) {
            scans.add((InMemoryTableScanExec) plan);
        }
        return scans;
    }

    @Nested
    @DisplayName("Caching Tables")
    class CachingTableTests {

        @Test
        @DisplayName("Cached table is reported as cached")
        void testIsCached() {
            assertThat(session.isCached("people")).isFalse();

            session.cacheTable("people");

            assertThat(session.isCached("people")).isTrue();
        }

        @Test
        @DisplayName("Caching is lazy until the first scan")
        void testLazyMaterialization() {
            session.cacheTable("people");
            InMemoryRelation relation = session.cacheManager()
                .lookupCachedData(session.table("people"))
                .orElseThrow()
                .cachedRepresentation();
            assertThat(relation.isMaterialized()).isFalse();

            logStep("When: querying the cached table");
            session.table("people").collect();

            assertThat(relation.isMaterialized()).isTrue();
            assertThat(relation.cachedBatches()).hasSize(3);
        }

        @Test
        @DisplayName("Queries over a cached table read the cache and return the same rows")
        void testQueryUsesCache() {
            List<Row> before = session.table("people").filter(gt(col("age"), lit(20))).collect();

            session.cacheTable("people");
            DataFrame after = session.table("people").filter(gt(col("age"), lit(20)));

            assertThat(inMemoryScans(after)).hasSize(1);
            assertThat(after.collect()).containsExactlyInAnyOrderElementsOf(before);
        }

        @Test
        @DisplayName("Both sides of a self join read the cached table")
        void testSelfJoinUsesCache() {
            session.cacheTable("people");
            DataFrame people = session.table("people");
            DataFrame pairs = people.as("x").join(people.as("y"), eq(col("x.id"), col("y.id")));

            assertThat(inMemoryScans(pairs)).hasSize(2);
            assertThat(pairs.collect()).hasSize(5);
        }

        @Test
        @DisplayName("A fresh copy of a local relation has the same result as the original")
        void testLocalRelationCopySameResult() {
            LocalRelation relation = (LocalRelation) Fixtures.people(session).queryExecution().analyzed()
                .find(p -> p instanceof LocalRelation)
                .orElseThrow();
            LocalRelation copy = relation.newInstance();

            assertThat(copy.output().get(0).exprId()).isNotEqualTo(relation.output().get(0).exprId());
            assertThat(copy.sameResult(relation)).isTrue();
            assertThat(Fixtures.depts(session).queryExecution().analyzed().sameResult(relation)).isFalse();
        }

        @Test
        @DisplayName("Substitution keeps the output attributes of the analyzed plan")
        void testSubstitutionPreservesOutput() {
            session.cacheTable("people");
            QueryExecution execution = session.table("people").select("name", "age").queryExecution();

            assertThat(execution.withCachedData().output()).isEqualTo(execution.analyzed().output());
            assertThat(execution.withCachedData().find(p -> p instanceof InMemoryRelation)).isPresent();
        }

        @Test
        @DisplayName("Caching the same data twice keeps a single entry")
        void testDuplicateCache() {
            session.cacheTable("people");
            session.cacheTable("people");

            session.uncacheTable("people");

            assertThat(session.isCached("people")).isFalse();
            assertThat(session.cacheManager().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Uncaching a table that is not cached or does not exist does nothing")
        void testUncacheNoop() {
            assertThatCode(() -> session.uncacheTable("people")).doesNotThrowAnyException();
            assertThatCode(() -> session.uncacheTable("missing")).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Dropping a temp table removes its cache entry")
        void testDropTempTableUncaches() {
            session.cacheTable("people");

            session.dropTempTable("people");

            assertThat(session.cacheManager().isEmpty()).isTrue();
            assertThat(session.catalog().tableExists("people")).isFalse();
        }

        @Test
        @DisplayName("Clearing the cache drops every entry")
        void testClearCache() {
            Fixtures.depts(session).registerTempTable("depts");
            session.cacheTable("people");
            session.cacheTable("depts");

            session.clearCache();

            assertThat(session.isCached("people")).isFalse();
            assertThat(session.isCached("depts")).isFalse();
        }
    }

    @Nested
    @DisplayName("Caching Queries")
    class CachingQueryTests {

        @Test
        @DisplayName("A cached derived frame is reused by an equivalent query")
        void testDerivedFrameReused() {
            DataFrame adults = session.table("people").filter(geq(col("age"), lit(21)));
            adults.cache();

            DataFrame again = session.table("people").filter(geq(col("age"), lit(21)));

            assertThat(inMemoryScans(again)).hasSize(1);
            assertThat(again.count()).isEqualTo(3L);
        }

        @Test
        @DisplayName("Unpersisting removes the entry")
        void testUnpersist() {
            DataFrame adults = session.table("people").filter(geq(col("age"), lit(21)));
            adults.cache();

            adults.unpersist();

            assertThat(session.cacheManager().lookupCachedData(adults)).isEmpty();
        }

        @Test
        @DisplayName("Invalidation drops the materialized batches of dependent entries")
        void testInvalidateCache() {
            session.cacheTable("people");
            DataFrame people = session.table("people");
            people.collect();
            InMemoryRelation relation = session.cacheManager()
                .lookupCachedData(people).orElseThrow().cachedRepresentation();
            assertThat(relation.isMaterialized()).isTrue();

            session.cacheManager().invalidateCache(people.queryExecution().analyzed());

            assertThat(relation.isMaterialized()).isFalse();
            assertThat(people.count()).isEqualTo(5L);
        }
    }

    @Nested
    @DisplayName("Batch Pruning")
    class BatchPruningTests {

        @Test
        @DisplayName("Batches whose statistics exclude the predicate are skipped")
        void testRangePruning() {
            session.cacheTable("people");
            DataFrame query = session.table("people").filter(gt(col("id"), lit(4)));

            List<InMemoryTableScanExec> scans = inMemoryScans(query);

            assertThat(scans).hasSize(1);
            assertThat(scans.get(0).prunedBatches()).hasSize(1);
            assertThat(query.collect()).containsExactly(Row.of(5, "erin", 28, 30));
        }

        @Test
        @DisplayName("Null checks use null counts")
        void testNullPruning() {
            session.cacheTable("people");
            DataFrame query = session.table("people").filter(isNull(col("age")));

            assertThat(inMemoryScans(query).get(0).prunedBatches()).hasSize(1);
            assertThat(query.collect()).containsExactly(Row.of(4, "dave", null, 20));
        }

        @Test
        @DisplayName("Predicates on computed values keep every batch")
        void testUnprunablePredicate() {
            session.cacheTable("people");
            DataFrame query = session.table("people").filter(gt(add(col("id"), lit(1)), lit(5)));

            assertThat(inMemoryScans(query).get(0).prunedBatches()).hasSize(3);
            assertThat(query.collect()).containsExactly(Row.of(5, "erin", 28, 30));
        }

        @Test
        @DisplayName("Scan produces the single partition it reports")
        void testScanPartitioning() {
            session.cacheTable("people");
            InMemoryTableScanExec scan = inMemoryScans(session.table("people")).get(0);

            List<Iterator<Row>> partitions = scan.execute();

            assertThat(scan.outputPartitioning().numPartitions()).isEqualTo(1);
            assertThat(partitions).hasSize(1);
            assertThat(RowIterators.collect(partitions)).hasSize(5);
        }
    }

    @Nested
    @TestCategories.Concurrency
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Concurrent cache and uncache on distinct tables keep the last state per table")
        void testConcurrentCacheAndUncache() throws Exception {
            int threads = 8;
            for (int i = 0; i < threads; i++) {
                session.createDataFrame(List.of(Row.of(i, "t" + i, i, i)), Fixtures.PEOPLE_SCHEMA)
                    .registerTempTable("t" + i);
            }
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            try {
                List<Future<Long>> counts = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    String name = "t" + i;
                    boolean keep = i % 2 == 0;
                    counts.add(pool.submit(() -> {
                        start.await();
                        session.cacheTable(name);
                        long count = session.table(name).count();
                        if (!keep) {
                            session.uncacheTable(name);
                        }
                        return count;
                    }));
                }
                start.countDown();

                for (Future<Long> count : counts) {
                    assertThat(count.get(10, TimeUnit.SECONDS)).isEqualTo(1L);
                }
            } finally {
                pool.shutdownNow();
            }
            for (int i = 0; i < threads; i++) {
                assertThat(session.isCached("t" + i)).as("t%d cached", i).isEqualTo(i % 2 == 0);
            }
        }
    }
}
