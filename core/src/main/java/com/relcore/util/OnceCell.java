package com.relcore.util;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A value computed at most once, on first access.
 *
 * <p>A cell moves from uninitialised to computing to either ready or failed.
 * When several threads race to read an uninitialised cell, one computes the
 * value and the others wait for it; all of them observe the same result. A
 * runtime exception thrown by the supplier is remembered and rethrown to every
 * later caller without recomputing.
 *
 * <p>Example usage:
 * <pre>
 *   private final OnceCell&lt;LogicalPlan&gt; analyzed = new OnceCell&lt;&gt;(() -&gt; analyzer.execute(logical));
 *   ...
 *   LogicalPlan plan = analyzed.get();
 * </pre>
 *
 * @param <T> the value type
 */
public final class OnceCell<T> {

    /**
     * Lifecycle of a cell.
     */
    public enum State {
        UNINITIALIZED,
        COMPUTING,
        READY,
        FAILED
    }

    private final Supplier<T> supplier;
    private final Object lock = new Object();

    private volatile State state = State.UNINITIALIZED;
    private Thread computingThread;
    private T value;
    private RuntimeException failure;

    public OnceCell(Supplier<T> supplier) {
        this.supplier = Objects.requireNonNull(supplier, "supplier must not be null");
    }

    /**
     * Returns the value, computing it on first access.
     *
     * @return the value
     * @throws RuntimeException the failure of the computation, on every call after it failed
     * @throws IllegalStateException if the computation reads its own cell
     */
    public T get() {
        if (state == State.READY) {
            return value;
        }
        synchronized (lock) {
            while (state == State.COMPUTING) {
                if (computingThread == Thread.currentThread()) {
                    throw new IllegalStateException("Recursive initialization of a once-cell");
                }
                try {
                    lock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for a once-cell", e);
                }
            }
            if (state == State.READY) {
                return value;
            }
            if (state == State.FAILED) {
                throw failure;
            }
            state = State.COMPUTING;
            computingThread = Thread.currentThread();
        }

        State outcome = State.UNINITIALIZED;
        try {
            T computed = supplier.get();
            synchronized (lock) {
                value = computed;
                outcome = State.READY;
            }
            return computed;
        } catch (RuntimeException e) {
            synchronized (lock) {
                failure = e;
                outcome = State.FAILED;
            }
            throw e;
        } finally {
            synchronized (lock) {
                // an Error leaves the cell uninitialised so a later call can retry
                state = outcome;
                computingThread = null;
                lock.notifyAll();
            }
        }
    }

    /**
     * Returns the current state.
     *
     * @return the state
     */
    public State state() {
        return state;
    }

    /**
     * Returns whether the value has been computed successfully.
     *
     * @return true if the cell is ready
     */
    public boolean isReady() {
        return state == State.READY;
    }

    /**
     * Returns the value if it has already been computed, without computing it.
     *
     * @return the value, or empty if the cell is not ready
     */
    public Optional<T> peek() {
        return state == State.READY ? Optional.ofNullable(value) : Optional.empty();
    }
}
