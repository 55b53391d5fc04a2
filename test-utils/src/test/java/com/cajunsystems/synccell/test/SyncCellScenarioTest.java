package com.cajunsystems.synccell.test;

import com.cajunsystems.synccell.HandoffMode;
import com.cajunsystems.synccell.Reply;
import com.cajunsystems.synccell.SyncCell;
import com.cajunsystems.synccell.SyncCellConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Multi-task scenarios driven through the inspector, the way application tests use it.
 */
@Timeout(value = 20, unit = TimeUnit.SECONDS)
class SyncCellScenarioTest {

    private static final Duration WAIT = Duration.ofSeconds(2);

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void takeThenPutHandsOffValueAndKeepsItInCell() throws Exception {
        SyncCell<Integer> cell = SyncCell.newEmpty();
        SyncCellInspector<Integer> inspector = SyncCellInspector.create(cell);

        Future<Integer> taskA = executor.submit(() -> cell.take().get());
        assertTrue(inspector.awaitPendingTakes(1, WAIT));

        Future<?> taskB = executor.submit(() -> cell.put(42).get());
        taskB.get(2, TimeUnit.SECONDS);

        assertEquals(42, taskA.get(2, TimeUnit.SECONDS));
        // Default handoff leaves the delivered value in the cell
        assertEquals(Optional.of(42), inspector.value());
        assertTrue(inspector.snapshot().isIdle());
    }

    @Test
    void takeThenPutLeavesCellEmptyWhenSlotIsBypassed() throws Exception {
        SyncCell<Integer> cell = SyncCell.newEmpty(new SyncCellConfig().setHandoffMode(HandoffMode.BYPASS_SLOT));
        SyncCellInspector<Integer> inspector = SyncCellInspector.create(cell);

        Future<Integer> taskA = executor.submit(() -> cell.take().get());
        assertTrue(inspector.awaitPendingTakes(1, WAIT));
        cell.put(42).get();

        assertEquals(42, taskA.get(2, TimeUnit.SECONDS));
        assertTrue(inspector.isEmpty());
    }

    @Test
    void onlyTheFirstOfTwoSuspendedTakersIsWoken() throws Exception {
        SyncCell<String> cell = SyncCell.newEmpty();
        SyncCellInspector<String> inspector = SyncCellInspector.create(cell);

        Reply<String> first = cell.take();
        Reply<String> second = cell.take();
        assertEquals(2, inspector.pendingTakes());

        cell.put("v");

        assertEquals("v", AsyncAssertion.awaitReply(first, WAIT));
        AsyncAssertion.assertStillPending(second, Duration.ofMillis(100));
        assertEquals(1, inspector.pendingTakes());
    }

    @Test
    void readDoesNotConsumeValue() {
        SyncCell<String> cell = SyncCell.newEmpty();
        SyncCellInspector<String> inspector = SyncCellInspector.create(cell);
        cell.put("v");

        assertEquals("v", AsyncAssertion.awaitReply(cell.read(), WAIT));
        assertEquals("v", AsyncAssertion.awaitReply(cell.read(), WAIT));
        assertTrue(inspector.snapshot().isIdle());
        assertEquals("v", AsyncAssertion.awaitReply(cell.take(), WAIT));
        assertTrue(inspector.isEmpty());
    }

    @Test
    void concurrentModificationsSerialize() throws Exception {
        SyncCell<Integer> cell = SyncCell.newFull(0, new SyncCellConfig().setHandoffMode(HandoffMode.BYPASS_SLOT));
        SyncCellInspector<Integer> inspector = SyncCellInspector.create(cell);

        Future<?> first = executor.submit(() -> cell.modify(n -> {
            AsyncAssertion.eventually(() -> cell.pendingTakes() == 1, WAIT);
            return n + 1;
        }).get());
        Future<?> second = executor.submit(() -> {
            AsyncAssertion.eventually(cell::isEmpty, WAIT);
            return cell.modify(n -> n + 1).get();
        });

        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);

        assertEquals(Optional.of(2), inspector.value());
        assertTrue(inspector.snapshot().isIdle());
    }
}
