package io.taskledger.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskledger.core.ChangeSet;
import io.taskledger.core.Task;
import io.taskledger.core.TaskPriority;
import io.taskledger.core.TaskStatus;
import io.taskledger.core.TaskUpdate;
import io.taskledger.core.Timestamps;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskCodecTest {

    private final SteppingClock clock =
            new SteppingClock(Instant.parse("2026-10-19T10:00:00.123456789Z"), Duration.ofNanos(1_001));

    @Test
    void encode_then_decode_preserves_every_field() {
        Task t = Task.builder()
                .title("Write docs").description("API and guides: ünïcode").assignee("Carlos")
                .status(TaskStatus.IN_PROGRESS).priority(TaskPriority.CRITICAL)
                .clock(clock).build();
        t.update(TaskUpdate.builder().status(TaskStatus.DONE).build(), clock.instant());

        ObjectNode n = TaskCodec.encode(t);
        assertEquals("2026-10-19T10:00:00.123456789Z", n.get("created_at").asText());
        assertEquals(2, n.get("version").asInt());

        Task back = TaskCodec.decode(n);
        assertEquals(t, back);
        assertEquals(t.updatedAt(), back.updatedAt());
    }

    @Test
    void decode_rejects_missing_fields_and_bad_enums() {
        ObjectNode n = TaskCodec.encode(Task.create("a", "b", "c"));

        ObjectNode noVersion = n.deepCopy();
        noVersion.remove("version");
        assertThrows(IntegrityException.class, () -> TaskCodec.decode(noVersion));

        ObjectNode badStatus = n.deepCopy();
        badStatus.put("status", "ARCHIVED");
        assertThrows(IntegrityException.class, () -> TaskCodec.decode(badStatus));

        ObjectNode badTime = n.deepCopy();
        badTime.put("created_at", "yesterday");
        assertThrows(IntegrityException.class, () -> TaskCodec.decode(badTime));
    }

    @Test
    void change_set_carries_previous_new_version_and_time() {
        Task t = Task.builder().title("a").description("b").assignee("c").clock(clock).build();
        ChangeSet cs = t.update(TaskUpdate.builder().status(TaskStatus.IN_PROGRESS).build(), clock.instant());

        ObjectNode n = TaskCodec.encodeChangeSet(cs);
        assertEquals("PENDING", n.at("/changes/status/previous").asText());
        assertEquals("IN_PROGRESS", n.at("/changes/status/new").asText());
        assertEquals(2, n.get("version").asInt());
        assertEquals(Timestamps.format(t.updatedAt()), n.get("updated_at").asText());
    }
}
