package io.taskledger.storage;

import io.taskledger.core.TaskLedgerException;

/**
 * The collection document on disk cannot be trusted: checksum missing or
 * mismatched, content unparseable, or a record malformed.
 * <p>
 * Treat as a data-loss-risk event. The store never repairs the file.
 */
public class IntegrityException extends TaskLedgerException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
