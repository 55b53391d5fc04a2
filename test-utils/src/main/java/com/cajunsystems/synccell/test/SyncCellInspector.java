package com.cajunsystems.synccell.test;

import com.cajunsystems.synccell.SyncCell;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Inspector for examining a cell's slot and wait queues during testing.
 * Lets a test wait until tasks running on other threads have actually suspended
 * before it performs the transition that should wake them.
 *
 * <p>Usage:
 * <pre>{@code
 * SyncCell<Integer> cell = SyncCell.newEmpty();
 * SyncCellInspector<Integer> inspector = SyncCellInspector.create(cell);
 *
 * executor.submit(() -> cell.take().get());
 * inspector.awaitPendingTakes(1, Duration.ofSeconds(1));
 *
 * cell.put(42);
 * assertEquals(0, inspector.pendingTakes());
 * }</pre>
 *
 * @param <T> the value type of the cell
 */
public class SyncCellInspector<T> {

    private static final long POLL_INTERVAL_MS = 5;

    private final SyncCell<T> cell;

    private SyncCellInspector(SyncCell<T> cell) {
        this.cell = cell;
    }

    /**
     * Creates an inspector for the given cell.
     *
     * @param <T> the value type
     * @param cell the cell to inspect
     * @return a SyncCellInspector instance
     */
    public static <T> SyncCellInspector<T> create(SyncCell<T> cell) {
        Objects.requireNonNull(cell, "cell cannot be null");
        return new SyncCellInspector<>(cell);
    }

    public int pendingTakes() {
        return cell.pendingTakes();
    }

    public int pendingPuts() {
        return cell.pendingPuts();
    }

    public int pendingReads() {
        return cell.pendingReads();
    }

    public boolean isEmpty() {
        return cell.isEmpty();
    }

    /**
     * Gets the current value without suspending.
     *
     * @return the value, or empty if the cell is empty
     */
    public Optional<T> value() {
        return cell.tryRead();
    }

    /**
     * Waits until exactly the given number of takes are suspended.
     *
     * @param expected the expected taker queue depth
     * @param timeout the maximum time to wait
     * @return true if the depth was reached, false on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitPendingTakes(int expected, Duration timeout) throws InterruptedException {
        return awaitCondition(() -> cell.pendingTakes() == expected, timeout);
    }

    /**
     * Waits until exactly the given number of puts are suspended.
     *
     * @param expected the expected putter queue depth
     * @param timeout the maximum time to wait
     * @return true if the depth was reached, false on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitPendingPuts(int expected, Duration timeout) throws InterruptedException {
        return awaitCondition(() -> cell.pendingPuts() == expected, timeout);
    }

    /**
     * Waits until exactly the given number of reads are suspended.
     *
     * @param expected the expected reader queue depth
     * @param timeout the maximum time to wait
     * @return true if the depth was reached, false on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitPendingReads(int expected, Duration timeout) throws InterruptedException {
        return awaitCondition(() -> cell.pendingReads() == expected, timeout);
    }

    /**
     * Waits until the cell is full.
     *
     * @param timeout the maximum time to wait
     * @return true if the cell became full, false on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitFull(Duration timeout) throws InterruptedException {
        return awaitCondition(() -> !cell.isEmpty(), timeout);
    }

    /**
     * Gets a snapshot of the cell's state.
     *
     * @return a CellSnapshot
     */
    public CellSnapshot<T> snapshot() {
        return new CellSnapshot<>(
            cell.tryRead(),
            cell.pendingTakes(),
            cell.pendingPuts(),
            cell.pendingReads()
        );
    }

    private static boolean awaitCondition(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long endTime = System.currentTimeMillis() + timeout.toMillis();

        while (System.currentTimeMillis() < endTime) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(POLL_INTERVAL_MS);
        }

        return condition.getAsBoolean();
    }

    /**
     * Snapshot of a cell at a point in time. The fields are read one after another,
     * so a snapshot taken while other threads use the cell may mix two states.
     *
     * @param value the slot content, empty if the cell was empty
     * @param pendingTakes the number of suspended takes
     * @param pendingPuts the number of suspended puts
     * @param pendingReads the number of suspended reads
     */
    public record CellSnapshot<T>(
        Optional<T> value,
        int pendingTakes,
        int pendingPuts,
        int pendingReads
    ) {
        public boolean isIdle() {
            return pendingTakes == 0 && pendingPuts == 0 && pendingReads == 0;
        }
    }
}
