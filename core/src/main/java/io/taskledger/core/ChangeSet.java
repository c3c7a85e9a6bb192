package io.taskledger.core;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result of {@link Task#update}: the fields that actually changed, plus the
 * version and update time the task ended up with.
 * <p>
 * An empty change-set means the update was a no-op: the task was not touched,
 * so {@link #version()} and {@link #updatedAt()} are meaningless (0 / null).
 */
public final class ChangeSet {
    private static final ChangeSet EMPTY = new ChangeSet(Map.of(), 0, null);

    private final Map<TaskField, FieldChange> changes;
    private final int version;
    private final Instant updatedAt;

    private ChangeSet(Map<TaskField, FieldChange> changes, int version, Instant updatedAt) {
        this.changes = changes;
        this.version = version;
        this.updatedAt = updatedAt;
    }

    static ChangeSet of(Map<TaskField, FieldChange> changes, int version, Instant updatedAt) {
        if (changes.isEmpty()) return EMPTY;
        return new ChangeSet(Collections.unmodifiableMap(new EnumMap<>(changes)), version, updatedAt);
    }

    public static ChangeSet empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    /** Changed fields in declaration order of {@link TaskField}. */
    public Map<TaskField, FieldChange> changes() {
        return changes;
    }

    public int version() {
        return version;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "ChangeSet" + changes + " -> v" + version;
    }
}
