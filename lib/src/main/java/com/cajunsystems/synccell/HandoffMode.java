package com.cajunsystems.synccell;

/**
 * Defines what happens to the slot when a {@code put} hands its value directly to a
 * suspended taker.
 *
 * <ul>
 *   <li>{@link #RETAIN_SLOT} - the slot keeps the handed-off value (default)</li>
 *   <li>{@link #BYPASS_SLOT} - the value goes to the taker only and the slot stays empty</li>
 * </ul>
 */
public enum HandoffMode {
    /**
     * The put writes its value into the slot, then delivers the same value to the head taker
     * without clearing the slot. The woken taker and the next reader or taker of the cell
     * both observe that value.
     * Default, matching the classic callback-queue implementation of the cell.
     */
    RETAIN_SLOT,

    /**
     * The value is delivered to the head taker and never lands in the slot.
     * The cell is still empty after the handoff, so overlapping {@code modify} calls
     * serialize without a parked put.
     */
    BYPASS_SLOT
}
