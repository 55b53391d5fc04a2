package com.cajunsystems.synccell;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a cell operation that may suspend.
 * An operation that did not suspend returns an already completed reply.
 * Provides three tiers of API:
 * 1. Simple: get() - just blocks and returns the value
 * 2. Safe: await() - returns Result for explicit error handling
 * 3. Advanced: future() - access the underlying CompletableFuture
 *
 * <p>The timed variants only bound how long the caller waits. The operation stays queued
 * inside the cell and still takes effect when it is woken.
 */
public interface Reply<T> {

    // ========== TIER 1: SIMPLE API ==========

    /**
     * Blocks until the operation completes and returns its value.
     * Throws unchecked SyncCellException if the operation failed.
     */
    T get();

    /**
     * Blocks until the operation completes or the timeout expires.
     * @throws TimeoutException if the timeout expires first
     * @throws SyncCellException if the operation failed
     */
    T get(Duration timeout) throws TimeoutException;

    // ========== TIER 2: SAFE API ==========

    /**
     * Blocks until the operation completes and returns a Result.
     */
    Result<T> await();

    /**
     * Blocks until the operation completes or the timeout expires.
     * Returns a failed Result holding a TimeoutException on timeout.
     */
    Result<T> await(Duration timeout);

    /**
     * Non-blocking check. Returns empty if the operation is still suspended.
     */
    Optional<Result<T>> poll();

    /**
     * Returns true once the operation has completed, successfully or not.
     */
    boolean isDone();

    // ========== TIER 3: ADVANCED API ==========

    /**
     * Access the underlying CompletableFuture for composition.
     */
    CompletableFuture<T> future();

    // ========== COMPOSITION ==========

    <U> Reply<U> map(Function<? super T, ? extends U> fn);

    <U> Reply<U> flatMap(Function<? super T, Reply<U>> fn);

    /**
     * Register callbacks for success and failure. Non-blocking.
     */
    void onComplete(Consumer<? super T> onSuccess, Consumer<Throwable> onFailure);

    // ========== FACTORY METHODS ==========

    static <T> Reply<T> from(CompletableFuture<T> future) {
        return new PendingReply<>(future);
    }

    static <T> Reply<T> completed(T value) {
        return new PendingReply<>(CompletableFuture.completedFuture(value));
    }

    static <T> Reply<T> failed(Throwable error) {
        return new PendingReply<>(CompletableFuture.failedFuture(error));
    }
}
