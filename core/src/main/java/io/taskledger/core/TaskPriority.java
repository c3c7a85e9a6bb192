package io.taskledger.core;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Urgency of a task. */
public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Parse a priority name as it appears on the wire or on the command line.
     *
     * @throws ValidationException if {@code raw} is not one of the constants (case-sensitive)
     */
    public static TaskPriority parse(String raw) {
        if (raw != null) {
            for (TaskPriority p : values()) {
                if (p.name().equals(raw)) return p;
            }
        }
        throw new ValidationException("Invalid priority: " + raw + ". Use: " + names());
    }

    static String names() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "));
    }
}
