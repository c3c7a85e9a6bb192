package io.taskledger.core;

/**
 * Root of the unchecked exceptions raised by the task store.
 * <p>
 * Every failure surfaces synchronously to the immediate caller; nothing in the
 * store retries or swallows these.
 */
public class TaskLedgerException extends RuntimeException {

    public TaskLedgerException(String message) {
        super(message);
    }

    public TaskLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
