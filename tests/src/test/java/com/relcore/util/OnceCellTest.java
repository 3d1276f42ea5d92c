package com.relcore.util;

import com.relcore.test.TestBase;
import com.relcore.test.TestCategories;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tests for {@link OnceCell}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("OnceCell Tests")
public class OnceCellTest extends TestBase {

    @Test
    @DisplayName("Value is computed on first access only")
    void testComputedOnce() {
        AtomicInteger calls = new AtomicInteger();
        OnceCell<String> cell = new OnceCell<>(() -> "v" + calls.incrementAndGet());

        assertThat(cell.state()).isEqualTo(OnceCell.State.UNINITIALIZED);
        assertThat(cell.peek()).isEmpty();
        assertThat(cell.get()).isEqualTo("v1");
        assertThat(cell.get()).isEqualTo("v1");
        assertThat(calls.get()).isEqualTo(1);
        assertThat(cell.isReady()).isTrue();
        assertThat(cell.peek()).contains("v1");
    }

    @Test
    @DisplayName("Failure is remembered and rethrown")
    void testFailureRemembered() {
        AtomicInteger calls = new AtomicInteger();
        OnceCell<String> cell = new OnceCell<>(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        Throwable first = catchThrowable(cell::get);
        Throwable second = catchThrowable(cell::get);

        assertThat(first).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        assertThat(second).isSameAs(first);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(cell.state()).isEqualTo(OnceCell.State.FAILED);
    }

    @Test
    @DisplayName("Reading a cell from its own computation is rejected")
    void testRecursiveAccess() {
        AtomicReference<OnceCell<String>> self = new AtomicReference<>();
        self.set(new OnceCell<>(() -> self.get().get()));

        assertThatThrownBy(() -> self.get().get())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Recursive");
    }

    @Test
    @TestCategories.Concurrency
    @DisplayName("Racing readers share one computation")
    void testConcurrentReaders() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch computing = new CountDownLatch(1);
        OnceCell<Object> cell = new OnceCell<>(() -> {
            calls.incrementAndGet();
            computing.countDown();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return new Object();
        });
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Object>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(cell::get));
            }

            Object expected = results.get(0).get(10, TimeUnit.SECONDS);
            for (Future<Object> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isSameAs(expected);
            }
            assertThat(computing.getCount()).isZero();
            assertThat(calls.get()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
