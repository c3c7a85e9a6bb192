package io.taskledger.storage;

import io.taskledger.core.TaskLedgerException;

/** Underlying read or write failure of a store file. */
public class StorageException extends TaskLedgerException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
