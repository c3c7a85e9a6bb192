package io.taskledger.core;

import java.util.Objects;

/**
 * Before/after pair for one field of an accepted update.
 * Enum values are carried by name.
 */
public record FieldChange(String previous, String next) {
    public FieldChange {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(next, "next");
    }
}
