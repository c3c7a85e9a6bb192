package io.taskledger.storage;

import io.taskledger.core.TaskLedgerException;

/** A create was attempted with an id that is already present. */
public class DuplicateIdException extends TaskLedgerException {
    private final String id;

    public DuplicateIdException(String id) {
        super("Task with id " + id + " already exists");
        this.id = id;
    }

    public String id() {
        return id;
    }
}
