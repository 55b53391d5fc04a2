package com.cajunsystems.synccell;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Configuration for a {@link SyncCell}.
 * A cell copies these settings when it is created, so one config can be reused
 * for many cells and changed afterwards without affecting existing cells.
 */
public class SyncCellConfig {
    // Default values for cell configuration
    public static final String DEFAULT_NAME = "sync-cell";
    public static final HandoffMode DEFAULT_HANDOFF_MODE = HandoffMode.RETAIN_SLOT;
    public static final ReaderWakeup DEFAULT_READER_WAKEUP = ReaderWakeup.HEAD_ONLY;

    private String name;
    private HandoffMode handoffMode;
    private ReaderWakeup readerWakeup;
    private Executor completionExecutor;

    /**
     * Creates a new SyncCellConfig with default values.
     */
    public SyncCellConfig() {
        this.name = DEFAULT_NAME;
        this.handoffMode = DEFAULT_HANDOFF_MODE;
        this.readerWakeup = DEFAULT_READER_WAKEUP;
        this.completionExecutor = null;
    }

    /**
     * Sets the name used in log output and in {@code toString()}.
     *
     * @param name The cell name
     * @return This SyncCellConfig instance
     */
    public SyncCellConfig setName(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        return this;
    }

    /**
     * Sets what happens to the slot when a put hands its value to a suspended taker.
     *
     * @param handoffMode The handoff mode
     * @return This SyncCellConfig instance
     */
    public SyncCellConfig setHandoffMode(HandoffMode handoffMode) {
        this.handoffMode = Objects.requireNonNull(handoffMode, "handoffMode cannot be null");
        return this;
    }

    /**
     * Sets how many suspended readers an empty-to-full put wakes.
     *
     * @param readerWakeup The reader wakeup policy
     * @return This SyncCellConfig instance
     */
    public SyncCellConfig setReaderWakeup(ReaderWakeup readerWakeup) {
        this.readerWakeup = Objects.requireNonNull(readerWakeup, "readerWakeup cannot be null");
        return this;
    }

    /**
     * Sets the executor that completes the replies of woken operations.
     * When null (the default) a woken operation is completed on the thread that
     * performed the waking transition, right after the cell lock is released.
     *
     * @param completionExecutor The executor, or null to complete inline
     * @return This SyncCellConfig instance
     */
    public SyncCellConfig setCompletionExecutor(Executor completionExecutor) {
        this.completionExecutor = completionExecutor;
        return this;
    }

    public String getName() {
        return name;
    }

    public HandoffMode getHandoffMode() {
        return handoffMode;
    }

    public ReaderWakeup getReaderWakeup() {
        return readerWakeup;
    }

    /**
     * Gets the completion executor.
     *
     * @return The executor, or null if woken operations complete inline
     */
    public Executor getCompletionExecutor() {
        return completionExecutor;
    }

    @Override
    public String toString() {
        return "SyncCellConfig{" +
                "name='" + name + '\'' +
                ", handoffMode=" + handoffMode +
                ", readerWakeup=" + readerWakeup +
                ", completionExecutor=" + completionExecutor +
                '}';
    }
}
