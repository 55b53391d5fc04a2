package com.cajunsystems.synccell;

/**
 * Unchecked exception thrown when a blocking wait on a cell operation fails,
 * typically because the function passed to {@code modify} failed.
 */
public class SyncCellException extends RuntimeException {

    public SyncCellException(String message) {
        super(message);
    }

    public SyncCellException(String message, Throwable cause) {
        super(message, cause);
    }

    public SyncCellException(Throwable cause) {
        super(cause);
    }
}
