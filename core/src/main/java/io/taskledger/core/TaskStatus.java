package io.taskledger.core;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Lifecycle state of a task. */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    DONE,
    CANCELLED;

    /**
     * Parse a status name as it appears on the wire or on the command line.
     *
     * @throws ValidationException if {@code raw} is not one of the constants (case-sensitive)
     */
    public static TaskStatus parse(String raw) {
        if (raw != null) {
            for (TaskStatus s : values()) {
                if (s.name().equals(raw)) return s;
            }
        }
        throw new ValidationException("Invalid status: " + raw + ". Use: " + names());
    }

    static String names() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "));
    }
}
