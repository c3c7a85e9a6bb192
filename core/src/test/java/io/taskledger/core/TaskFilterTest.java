package io.taskledger.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskFilterTest {

    @Test
    void empty_filter_matches_everything() {
        assertTrue(TaskFilter.all().matches(Task.create("t", "d", "a")));
    }

    @Test
    void components_are_combined_with_and() {
        Task t = Task.builder().title("t").description("d").assignee("Eve")
                .priority(TaskPriority.HIGH).build();

        assertTrue(TaskFilter.all().withPriority(TaskPriority.HIGH).matches(t));
        assertTrue(TaskFilter.all().withPriority(TaskPriority.HIGH).withAssignee("Eve").matches(t));
        assertFalse(TaskFilter.all().withPriority(TaskPriority.HIGH).withAssignee("Frank").matches(t));
        assertFalse(TaskFilter.all().withStatus(TaskStatus.DONE).matches(t));
    }
}
