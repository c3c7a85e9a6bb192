package io.taskledger.core;

/**
 * Optional equality filters for listing tasks. A null component matches anything;
 * non-null components are combined with AND.
 */
public record TaskFilter(TaskStatus status, TaskPriority priority, String assignee) {

    private static final TaskFilter ALL = new TaskFilter(null, null, null);

    public static TaskFilter all() {
        return ALL;
    }

    public TaskFilter withStatus(TaskStatus s) {
        return new TaskFilter(s, priority, assignee);
    }

    public TaskFilter withPriority(TaskPriority p) {
        return new TaskFilter(status, p, assignee);
    }

    public TaskFilter withAssignee(String a) {
        return new TaskFilter(status, priority, a);
    }

    public boolean matches(Task task) {
        if (status != null && task.status() != status) return false;
        if (priority != null && task.priority() != priority) return false;
        return assignee == null || assignee.equals(task.assignee());
    }
}
