package io.taskledger.core;

/**
 * A proposed value was rejected before anything was mutated:
 * unknown status, unknown priority, or an unknown / read-only field name.
 */
public class ValidationException extends TaskLedgerException {

    public ValidationException(String message) {
        super(message);
    }
}
