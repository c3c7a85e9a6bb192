// file: src/main/java/io/taskledger/core/Task.java
package io.taskledger.core;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One task item tracked by the store.
 * <p>
 * Fields:
 *  - id:          opaque identifier, assigned at creation, never changes.
 *  - title, description, assignee: free-form text.
 *  - status, priority: validated enums.
 *  - version:     starts at 1, +1 for every update that changes at least one field.
 *  - createdAt:   fixed at construction.
 *  - updatedAt:   equals createdAt at construction, advances on every versioned update.
 * <p>
 * Invariants:
 *  - version == accepted mutations + 1; a no-op update leaves the task untouched.
 *  - updatedAt strictly increases with version, even if the clock did not move.
 * <p>
 * Instances are mutable and not thread safe; the repository hands out fresh
 * copies decoded from disk and never shares them across operations.
 */
public final class Task {
    private final String id;
    private String title;
    private String description;
    private String assignee;
    private TaskStatus status;
    private TaskPriority priority;
    private int version;
    private final Instant createdAt;
    private Instant updatedAt;

    private Task(
            String id,
            String title,
            String description,
            String assignee,
            TaskStatus status,
            TaskPriority priority,
            int version,
            Instant createdAt,
            Instant updatedAt
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = Objects.requireNonNull(title, "title");
        this.description = Objects.requireNonNull(description, "description");
        this.assignee = Objects.requireNonNull(assignee, "assignee");
        this.status = Objects.requireNonNull(status, "status");
        this.priority = Objects.requireNonNull(priority, "priority");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
        if (version < 1) throw new IllegalArgumentException("version must be >= 1, got " + version);
        this.version = version;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }

    /** New PENDING / MEDIUM task with a random id. */
    public static Task create(String title, String description, String assignee) {
        return builder().title(title).description(description).assignee(assignee).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Rebuild a task exactly as it was persisted. No defaults are applied.
     */
    public static Task restore(
            String id,
            String title,
            String description,
            String assignee,
            TaskStatus status,
            TaskPriority priority,
            int version,
            Instant createdAt,
            Instant updatedAt
    ) {
        return new Task(id, title, description, assignee, status, priority, version, createdAt, updatedAt);
    }

    /**
     * Apply a partial update.
     * <p>
     * Steps:
     *  1) For each proposed field, compare with the current value.
     *  2) Collect the ones that differ into a change-set.
     *  3) If anything changed: apply all of them, bump version, advance updatedAt.
     *  4) Otherwise leave the task untouched and return {@link ChangeSet#empty()}.
     *
     * @param update proposed values, already validated
     * @param now    current time from the caller's clock
     */
    public ChangeSet update(TaskUpdate update, Instant now) {
        Objects.requireNonNull(update, "update");
        Objects.requireNonNull(now, "now");

        Map<TaskField, FieldChange> changes = new EnumMap<>(TaskField.class);
        for (TaskField field : update.fields()) {
            Object current = valueOf(field);
            Object proposed = update.value(field);
            if (!current.equals(proposed)) {
                changes.put(field, new FieldChange(text(current), text(proposed)));
            }
        }
        if (changes.isEmpty()) {
            return ChangeSet.empty();
        }

        for (TaskField field : changes.keySet()) {
            apply(field, update.value(field));
        }
        version++;
        updatedAt = now.isAfter(updatedAt) ? now : updatedAt.plusNanos(1);
        return ChangeSet.of(changes, version, updatedAt);
    }

    /** Independent copy with identical field values. */
    public Task copy() {
        return new Task(id, title, description, assignee, status, priority, version, createdAt, updatedAt);
    }

    /** Current value of a field: {@code String}, {@link TaskStatus} or {@link TaskPriority}. */
    public Object valueOf(TaskField field) {
        return switch (field) {
            case TITLE -> title;
            case DESCRIPTION -> description;
            case ASSIGNEE -> assignee;
            case STATUS -> status;
            case PRIORITY -> priority;
        };
    }

    private void apply(TaskField field, Object value) {
        switch (field) {
            case TITLE -> title = (String) value;
            case DESCRIPTION -> description = (String) value;
            case ASSIGNEE -> assignee = (String) value;
            case STATUS -> status = (TaskStatus) value;
            case PRIORITY -> priority = (TaskPriority) value;
        }
    }

    private static String text(Object value) {
        return value instanceof Enum<?> e ? e.name() : (String) value;
    }

    public String id() { return id; }

    public String title() { return title; }

    public String description() { return description; }

    public String assignee() { return assignee; }

    public TaskStatus status() { return status; }

    public TaskPriority priority() { return priority; }

    public int version() { return version; }

    public Instant createdAt() { return createdAt; }

    public Instant updatedAt() { return updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Task t)) return false;
        return version == t.version
                && id.equals(t.id)
                && title.equals(t.title)
                && description.equals(t.description)
                && assignee.equals(t.assignee)
                && status == t.status
                && priority == t.priority
                && createdAt.equals(t.createdAt)
                && updatedAt.equals(t.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, description, assignee, status, priority, version, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "Task(id=" + (id.length() > 8 ? id.substring(0, 8) : id)
                + ", title='" + title + "', status=" + status + ", priority=" + priority
                + ", assignee='" + assignee + "', version=" + version + ")";
    }

    /**
     * Builder for new tasks. Defaults: PENDING, MEDIUM, random UUID id, UTC system clock.
     */
    public static final class Builder {
        private String id;
        private String title;
        private String description;
        private String assignee;
        private TaskStatus status = TaskStatus.PENDING;
        private TaskPriority priority = TaskPriority.MEDIUM;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder assignee(String assignee) {
            this.assignee = assignee;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = Objects.requireNonNull(status, "status");
            return this;
        }

        /** @throws ValidationException for an unknown status name */
        public Builder status(String raw) {
            return status(TaskStatus.parse(raw));
        }

        public Builder priority(TaskPriority priority) {
            this.priority = Objects.requireNonNull(priority, "priority");
            return this;
        }

        /** @throws ValidationException for an unknown priority name */
        public Builder priority(String raw) {
            return priority(TaskPriority.parse(raw));
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Task build() {
            String taskId = (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
            Instant now = clock.instant();
            return new Task(taskId, title, description, assignee, status, priority, 1, now, now);
        }
    }
}
