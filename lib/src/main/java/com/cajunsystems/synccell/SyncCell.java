package com.cajunsystems.synccell;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A single-slot synchronized cell that is either empty or holds exactly one value.
 *
 * <p>Tasks coordinate through the cell by taking, putting and reading its value:
 * <ul>
 *   <li>{@link #take()} empties the cell, suspending while it is empty</li>
 *   <li>{@link #put(Object)} fills the cell, suspending while it is full</li>
 *   <li>{@link #read()} observes the value without removing it, suspending while empty</li>
 *   <li>{@link #modify(UnaryOperator)} takes, transforms and puts back the value</li>
 * </ul>
 *
 * <p>A suspended operation is represented by an incomplete {@link Reply}. The cell keeps one
 * FIFO queue per kind of suspended operation and completes the oldest one of a kind when a
 * transition allows it. Each transition wakes at most one putter (on take), one taker and
 * one reader (on put, see {@link ReaderWakeup} for readers).
 *
 * <p>The slot and the three queues are guarded by a lock owned by the cell, so independent
 * cells never contend. Replies of woken operations are completed after the lock is released,
 * on the waking thread or on the configured completion executor. When a woken continuation
 * calls back into a cell on the waking thread, the wakeups it causes are deferred until it
 * returns and then run in order by the outermost call.
 *
 * <p>Usage:
 * <pre>{@code
 * SyncCell<Integer> counter = SyncCell.newFull(0);
 * counter.modify(n -> n + 1).get();
 *
 * SyncCell<String> handoff = SyncCell.newEmpty();
 * Reply<String> received = handoff.take();   // suspended
 * handoff.put("hello");                      // wakes the taker
 * received.get();                            // "hello"
 * }</pre>
 *
 * @param <T> The type of the value held by the cell
 */
public final class SyncCell<T> {

    private static final Logger logger = LoggerFactory.getLogger(SyncCell.class);

    // Inline wakeups pending on the current thread, shared by all cells
    private static final ThreadLocal<Deque<Runnable>> INLINE_WAKEUPS = new ThreadLocal<>();

    private final String name;
    private final HandoffMode handoffMode;
    private final ReaderWakeup readerWakeup;
    private final Executor completionExecutor;

    private final ReentrantLock lock = new ReentrantLock();
    // null means empty
    private volatile T value;
    private final Deque<CompletableFuture<T>> takers = new ArrayDeque<>();
    private final Deque<PendingPut<T>> putters = new ArrayDeque<>();
    private final Deque<CompletableFuture<T>> readers = new ArrayDeque<>();

    private SyncCell(T initialValue, SyncCellConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.name = config.getName();
        this.handoffMode = config.getHandoffMode();
        this.readerWakeup = config.getReaderWakeup();
        this.completionExecutor = config.getCompletionExecutor();
        this.value = initialValue;
    }

    /**
     * Creates an empty cell with default configuration.
     *
     * @param <T> The value type
     * @return A new empty cell
     */
    public static <T> SyncCell<T> newEmpty() {
        return newEmpty(new SyncCellConfig());
    }

    /**
     * Creates an empty cell.
     *
     * @param config The cell configuration
     * @param <T> The value type
     * @return A new empty cell
     */
    public static <T> SyncCell<T> newEmpty(SyncCellConfig config) {
        return new SyncCell<>(null, config);
    }

    /**
     * Creates a cell holding the given value, with default configuration.
     *
     * @param value The initial value
     * @param <T> The value type
     * @return A new full cell
     */
    public static <T> SyncCell<T> newFull(T value) {
        return newFull(value, new SyncCellConfig());
    }

    /**
     * Creates a cell holding the given value.
     *
     * @param value The initial value
     * @param config The cell configuration
     * @param <T> The value type
     * @return A new full cell
     */
    public static <T> SyncCell<T> newFull(T value, SyncCellConfig config) {
        Objects.requireNonNull(value, "value cannot be null");
        return new SyncCell<>(value, config);
    }

    /**
     * Removes the value from the cell.
     *
     * <p>If the cell is full it is emptied and, if a put is suspended, the oldest one is
     * resumed and refills the cell with its value. The returned reply is already complete
     * with the value the cell held. If the cell is empty the take is queued and the reply
     * completes when a later put delivers a value to it.
     *
     * @return A reply with the taken value
     */
    public Reply<T> take() {
        List<Runnable> wakeups = new ArrayList<>(1);
        T taken;
        lock.lock();
        try {
            taken = value;
            if (taken == null) {
                CompletableFuture<T> pending = new CompletableFuture<>();
                takers.addLast(pending);
                logger.debug("Cell '{}' is empty, take suspended ({} takers waiting)", name, takers.size());
                return Reply.from(pending);
            }
            value = null;
            refillFromPutter(wakeups);
        } finally {
            lock.unlock();
        }
        resume(wakeups);
        return Reply.completed(taken);
    }

    /**
     * Puts a value into the cell.
     *
     * <p>If the cell is empty the value is written, the oldest suspended taker (if any) and
     * the oldest suspended reader (if any) receive it, and the returned reply is already
     * complete. With {@link HandoffMode#RETAIN_SLOT} the cell stays full after handing the
     * value to a taker. If the cell is full the put is queued and completes when a later
     * take makes room for it.
     *
     * @param newValue The value to put, not null
     * @return A reply that completes once the value is in the cell or handed to a taker
     */
    public Reply<Void> put(T newValue) {
        Objects.requireNonNull(newValue, "value cannot be null");
        List<Runnable> wakeups = new ArrayList<>(2);
        lock.lock();
        try {
            if (value != null) {
                CompletableFuture<Void> pending = new CompletableFuture<>();
                putters.addLast(new PendingPut<>(newValue, pending));
                logger.debug("Cell '{}' is full, put suspended ({} putters waiting)", name, putters.size());
                return Reply.from(pending);
            }
            fill(newValue, wakeups);
        } finally {
            lock.unlock();
        }
        resume(wakeups);
        return Reply.completed(null);
    }

    /**
     * Reads the value without removing it.
     *
     * <p>If the cell is full the returned reply is already complete with the current value
     * and nothing changes. If the cell is empty the read is queued until a put fills the cell.
     *
     * @return A reply with the value
     */
    public Reply<T> read() {
        lock.lock();
        try {
            T current = value;
            if (current != null) {
                return Reply.completed(current);
            }
            CompletableFuture<T> pending = new CompletableFuture<>();
            readers.addLast(pending);
            logger.debug("Cell '{}' is empty, read suspended ({} readers waiting)", name, readers.size());
            return Reply.from(pending);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the value, applies the function and puts the result back.
     *
     * <p>The cell is empty while the function runs, so concurrent takes and reads wait for the
     * modification to finish. If the function throws, the reply fails with that exception and
     * the cell stays empty: nothing puts a value back on the caller's behalf.
     *
     * @param fn The function computing the new value
     * @return A reply that completes once the new value has been put
     */
    public Reply<Void> modify(UnaryOperator<T> fn) {
        Objects.requireNonNull(fn, "fn cannot be null");
        return modifyAsync(current -> CompletableFuture.completedFuture(fn.apply(current)));
    }

    /**
     * Takes the value, applies the asynchronous function and puts the result back once the
     * returned stage completes. Failure handling is the same as for {@link #modify(UnaryOperator)}.
     *
     * @param fn The function computing the new value
     * @return A reply that completes once the new value has been put
     */
    public Reply<Void> modifyAsync(Function<? super T, ? extends CompletionStage<T>> fn) {
        Objects.requireNonNull(fn, "fn cannot be null");
        CompletableFuture<Void> modified = take().future()
                .thenCompose(fn)
                .thenCompose(updated -> put(updated).future());
        modified.whenComplete((ignored, error) -> {
            if (error != null) {
                logger.warn("Modification of cell '{}' failed, cell left empty", name, error);
            }
        });
        return Reply.from(modified);
    }

    /**
     * Replaces the value, returning the previous one.
     * Equivalent to a take followed by a put of the new value.
     *
     * @param newValue The value to put, not null
     * @return A reply with the previous value, completed once the new value has been put
     */
    public Reply<T> swap(T newValue) {
        Objects.requireNonNull(newValue, "value cannot be null");
        return take().flatMap(previous -> put(newValue).map(ignored -> previous));
    }

    /**
     * Takes the value if the cell is full, without ever suspending.
     * A suspended put is resumed exactly as for {@link #take()}.
     *
     * @return The taken value, or empty if the cell was empty
     */
    public Optional<T> tryTake() {
        List<Runnable> wakeups = new ArrayList<>(1);
        T taken;
        lock.lock();
        try {
            taken = value;
            if (taken == null) {
                return Optional.empty();
            }
            value = null;
            refillFromPutter(wakeups);
        } finally {
            lock.unlock();
        }
        resume(wakeups);
        return Optional.of(taken);
    }

    /**
     * Puts the value if the cell is empty, without ever suspending.
     * Suspended takers and readers are woken exactly as for {@link #put(Object)}.
     *
     * @param newValue The value to put, not null
     * @return true if the value was accepted, false if the cell was full
     */
    public boolean tryPut(T newValue) {
        Objects.requireNonNull(newValue, "value cannot be null");
        List<Runnable> wakeups = new ArrayList<>(2);
        lock.lock();
        try {
            if (value != null) {
                return false;
            }
            fill(newValue, wakeups);
        } finally {
            lock.unlock();
        }
        resume(wakeups);
        return true;
    }

    /**
     * Reads the value if the cell is full, without ever suspending.
     *
     * @return The current value, or empty if the cell is empty
     */
    public Optional<T> tryRead() {
        lock.lock();
        try {
            return Optional.ofNullable(value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns whether the cell is currently empty.
     * This is an unsynchronized snapshot that may be stale as soon as it returns.
     *
     * @return true if the cell holds no value
     */
    public boolean isEmpty() {
        return value == null;
    }

    /**
     * Gets the number of suspended takes.
     *
     * @return The taker queue depth
     */
    public int pendingTakes() {
        lock.lock();
        try {
            return takers.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets the number of suspended puts.
     *
     * @return The putter queue depth
     */
    public int pendingPuts() {
        lock.lock();
        try {
            return putters.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets the number of suspended reads.
     *
     * @return The reader queue depth
     */
    public int pendingReads() {
        lock.lock();
        try {
            return readers.size();
        } finally {
            lock.unlock();
        }
    }

    public String name() {
        return name;
    }

    public HandoffMode handoffMode() {
        return handoffMode;
    }

    public ReaderWakeup readerWakeup() {
        return readerWakeup;
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "SyncCell{" +
                    "name='" + name + '\'' +
                    ", state=" + (value == null ? "EMPTY" : "FULL") +
                    ", takers=" + takers.size() +
                    ", putters=" + putters.size() +
                    ", readers=" + readers.size() +
                    '}';
        } finally {
            lock.unlock();
        }
    }

    // Must hold lock. The slot has just been emptied.
    private void refillFromPutter(List<Runnable> wakeups) {
        PendingPut<T> putter = putters.pollFirst();
        if (putter == null) {
            return;
        }
        value = putter.value();
        wakeups.add(() -> putter.completion().complete(null));
        logger.debug("Cell '{}' refilled by suspended put ({} putters waiting)", name, putters.size());
    }

    // Must hold lock. The slot is empty.
    private void fill(T newValue, List<Runnable> wakeups) {
        CompletableFuture<T> taker = takers.pollFirst();
        if (taker == null || handoffMode == HandoffMode.RETAIN_SLOT) {
            value = newValue;
        }
        if (taker != null) {
            wakeups.add(() -> taker.complete(newValue));
            logger.debug("Cell '{}' handed value to suspended take ({} takers waiting)", name, takers.size());
        }
        if (readerWakeup == ReaderWakeup.ALL) {
            int woken = readers.size();
            CompletableFuture<T> reader;
            while ((reader = readers.pollFirst()) != null) {
                CompletableFuture<T> next = reader;
                wakeups.add(() -> next.complete(newValue));
            }
            if (woken > 0) {
                logger.debug("Cell '{}' woke {} suspended reads", name, woken);
            }
        } else {
            CompletableFuture<T> reader = readers.pollFirst();
            if (reader != null) {
                wakeups.add(() -> reader.complete(newValue));
                logger.debug("Cell '{}' woke suspended read ({} readers waiting)", name, readers.size());
            }
        }
    }

    // Must not hold lock.
    private void resume(List<Runnable> wakeups) {
        for (Runnable wakeup : wakeups) {
            if (completionExecutor == null) {
                runInline(wakeup);
                continue;
            }
            try {
                completionExecutor.execute(wakeup);
            } catch (RuntimeException e) {
                logger.warn("Completion executor did not accept wakeup for cell '{}', completing inline", name, e);
                runInline(wakeup);
            }
        }
    }

    // Woken continuations may call back into a cell on this thread. Those wakeups are queued
    // and run by the outermost call, so chains of any length run in a loop on a bounded stack.
    private void runInline(Runnable wakeup) {
        Deque<Runnable> queued = INLINE_WAKEUPS.get();
        if (queued != null) {
            queued.addLast(wakeup);
            return;
        }
        queued = new ArrayDeque<>();
        queued.addLast(wakeup);
        INLINE_WAKEUPS.set(queued);
        try {
            Runnable next;
            while ((next = queued.pollFirst()) != null) {
                try {
                    next.run();
                } catch (RuntimeException e) {
                    logger.warn("Inline wakeup failed", e);
                }
            }
        } finally {
            INLINE_WAKEUPS.remove();
        }
    }

    private record PendingPut<V>(V value, CompletableFuture<Void> completion) {
    }
}
