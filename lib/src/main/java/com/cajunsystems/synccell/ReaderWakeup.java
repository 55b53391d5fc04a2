package com.cajunsystems.synccell;

/**
 * Defines how many suspended readers an empty-to-full {@code put} wakes.
 */
public enum ReaderWakeup {
    /**
     * Wake only the oldest suspended reader. The others stay suspended until the next
     * empty-to-full transition. Default.
     */
    HEAD_ONLY,

    /**
     * Wake every suspended reader with the newly written value.
     */
    ALL
}
