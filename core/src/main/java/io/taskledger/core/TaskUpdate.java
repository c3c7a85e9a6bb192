package io.taskledger.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Typed partial update of a task: only the fields that were set are proposed.
 * <p>
 * Values are validated when the update is built, so by the time
 * {@link Task#update} sees it every proposed value is already acceptable and
 * the update applies completely or not at all.
 */
public final class TaskUpdate {
    private final Map<TaskField, Object> proposed;

    private TaskUpdate(Map<TaskField, Object> proposed) {
        this.proposed = Collections.unmodifiableMap(new EnumMap<>(proposed));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build an update from wire-name / text pairs, e.g. {@code {"status": "DONE"}}.
     *
     * @throws ValidationException on an unknown field name or an invalid status / priority;
     *                             nothing is returned in that case
     */
    public static TaskUpdate parse(Map<String, String> raw) {
        Builder b = builder();
        for (Map.Entry<String, String> e : raw.entrySet()) {
            b.set(TaskField.fromWireName(e.getKey()), e.getValue());
        }
        return b.build();
    }

    public Set<TaskField> fields() {
        return proposed.keySet();
    }

    public boolean isEmpty() {
        return proposed.isEmpty();
    }

    /** Proposed value: a {@code String}, {@link TaskStatus} or {@link TaskPriority}. */
    Object value(TaskField field) {
        return proposed.get(field);
    }

    @Override
    public String toString() {
        return "TaskUpdate" + proposed;
    }

    public static final class Builder {
        private final Map<TaskField, Object> proposed = new EnumMap<>(TaskField.class);

        private Builder() {
        }

        public Builder title(String title) {
            proposed.put(TaskField.TITLE, Objects.requireNonNull(title, "title"));
            return this;
        }

        public Builder description(String description) {
            proposed.put(TaskField.DESCRIPTION, Objects.requireNonNull(description, "description"));
            return this;
        }

        public Builder assignee(String assignee) {
            proposed.put(TaskField.ASSIGNEE, Objects.requireNonNull(assignee, "assignee"));
            return this;
        }

        public Builder status(TaskStatus status) {
            proposed.put(TaskField.STATUS, Objects.requireNonNull(status, "status"));
            return this;
        }

        public Builder priority(TaskPriority priority) {
            proposed.put(TaskField.PRIORITY, Objects.requireNonNull(priority, "priority"));
            return this;
        }

        /** Set a field from its text form; status and priority are parsed here. */
        public Builder set(TaskField field, String raw) {
            switch (field) {
                case TITLE -> title(raw);
                case DESCRIPTION -> description(raw);
                case ASSIGNEE -> assignee(raw);
                case STATUS -> status(TaskStatus.parse(raw));
                case PRIORITY -> priority(TaskPriority.parse(raw));
            }
            return this;
        }

        public TaskUpdate build() {
            return new TaskUpdate(proposed);
        }
    }
}
