package io.taskledger.core;

/**
 * Closed set of task fields a caller may change through {@link Task#update}.
 * <p>
 * The wire name is the key used in documents, change-sets and on the command line.
 * Identity, version and timestamps are deliberately absent: they are owned by the task.
 */
public enum TaskField {
    TITLE("title"),
    DESCRIPTION("description"),
    ASSIGNEE("assignee"),
    STATUS("status"),
    PRIORITY("priority");

    private final String wireName;

    TaskField(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @throws ValidationException for names that are unknown or not updatable
     */
    public static TaskField fromWireName(String name) {
        for (TaskField f : values()) {
            if (f.wireName.equals(name)) return f;
        }
        throw new ValidationException("Field cannot be updated: " + name);
    }
}
