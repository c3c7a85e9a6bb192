package io.taskledger.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskledger.core.Task;
import io.taskledger.core.TaskFilter;
import io.taskledger.core.TaskPriority;
import io.taskledger.core.TaskStatus;
import io.taskledger.core.TaskUpdate;
import io.taskledger.storage.audit.AuditEntry;
import io.taskledger.storage.audit.AuditOperation;
import io.taskledger.storage.audit.AuditQuery;
import io.taskledger.storage.audit.FileAuditLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileTaskRepositoryTest {

    @TempDir Path dir;

    private Path dataFile;
    private FileAuditLog audit;
    private FileTaskRepository repo;

    @BeforeEach
    void setUp() {
        var clock = new SteppingClock(Instant.parse("2026-10-19T09:00:00Z"), Duration.ofMillis(1));
        dataFile = dir.resolve("data/tasks.json");
        audit = new FileAuditLog(dir.resolve("data/audit.log"), clock);
        repo = new FileTaskRepository(dataFile, audit, clock);
    }

    private static Task task(String title, String assignee) {
        return Task.create(title, "Desc", assignee);
    }

    @Test
    void constructor_initializes_valid_empty_document() {
        assertTrue(Files.exists(dataFile));
        assertTrue(repo.checkIntegrity().valid());
        assertTrue(repo.list(TaskFilter.all()).isEmpty());
    }

    @Test
    void created_task_can_be_read_back() {
        Task t = task("New task", "Pedro");
        assertSame(t, repo.create(t, "admin"));

        Task back = repo.get(t.id()).orElseThrow();
        assertEquals(t, back);
        assertEquals("New task", back.title());
    }

    @Test
    void create_is_audited_with_full_snapshot() {
        Task t = task("New task", "Pedro");
        repo.create(t, "admin");

        List<AuditEntry> h = repo.history(t.id());
        assertEquals(1, h.size());
        assertEquals(AuditOperation.CREATE, h.get(0).operation());
        assertEquals("admin", h.get(0).actor());
        assertEquals(t, TaskCodec.decode(h.get(0).details().get("record")));
    }

    @Test
    void duplicate_id_is_rejected_and_document_unchanged() throws Exception {
        repo.create(Task.builder().id("test-id-123").title("Task").description("D").assignee("Ana").build(), null);
        byte[] before = Files.readAllBytes(dataFile);

        Task dup = Task.builder().id("test-id-123").title("Other").description("D").assignee("Ana").build();
        var ex = assertThrows(DuplicateIdException.class, () -> repo.create(dup, null));
        assertEquals("test-id-123", ex.id());

        assertArrayEquals(before, Files.readAllBytes(dataFile));
        assertEquals(1, repo.history("test-id-123").size());
    }

    @Test
    void list_applies_filters_with_and_semantics_in_document_order() {
        Task t1 = Task.builder().title("Task 1").description("D").assignee("Joao").priority(TaskPriority.HIGH).build();
        Task t2 = Task.builder().title("Task 2").description("D").assignee("Maria").priority(TaskPriority.LOW).build();
        Task t3 = Task.builder().title("Task 3").description("D").assignee("Maria").priority(TaskPriority.HIGH).build();
        repo.create(t1, null);
        repo.create(t2, null);
        repo.create(t3, null);

        assertEquals(List.of(t1, t2, t3), repo.list(TaskFilter.all()));
        assertEquals(List.of(t1, t3), repo.list(TaskFilter.all().withPriority(TaskPriority.HIGH)));
        assertEquals(List.of(t3), repo.list(new TaskFilter(null, TaskPriority.HIGH, "Maria")));
        assertEquals(List.of(), repo.list(TaskFilter.all().withStatus(TaskStatus.DONE)));
    }

    @Test
    void update_bumps_version_persists_and_audits() {
        Task t = task("Task", "Carlos");
        repo.create(t, null);

        Task updated = repo.update(t.id(), "admin",
                TaskUpdate.builder().status(TaskStatus.DONE).build()).orElseThrow();

        assertEquals(TaskStatus.DONE, updated.status());
        assertEquals(2, updated.version());
        assertEquals(updated, repo.get(t.id()).orElseThrow());

        AuditEntry latest = repo.history(t.id()).get(0);
        assertEquals(AuditOperation.UPDATE, latest.operation());
        assertEquals("DONE", latest.details().at("/changes/status/new").asText());
        assertEquals(2, latest.details().get("version").asInt());
    }

    @Test
    void no_op_update_writes_nothing_and_audits_nothing() throws Exception {
        Task t = task("Task", "Carlos");
        repo.create(t, null);
        byte[] before = Files.readAllBytes(dataFile);

        Task same = repo.update(t.id(), "admin",
                TaskUpdate.builder().title("Task").assignee("Carlos").build()).orElseThrow();

        assertEquals(1, same.version());
        assertEquals(t, same);
        assertArrayEquals(before, Files.readAllBytes(dataFile));
        assertEquals(1, repo.history(t.id()).size());
    }

    @Test
    void update_of_unknown_id_is_empty() {
        assertTrue(repo.update("nope", null, TaskUpdate.builder().title("x").build()).isEmpty());
        assertTrue(audit.query(AuditQuery.all()).isEmpty());
    }

    @Test
    void delete_removes_exactly_one_and_audits_last_snapshot() {
        Task keep = task("keep", "Lucas");
        Task gone = task("gone", "Lucas");
        repo.create(keep, null);
        repo.create(gone, null);
        repo.update(gone.id(), null, TaskUpdate.builder().priority(TaskPriority.LOW).build());

        assertTrue(repo.delete(gone.id(), "admin"));

        assertTrue(repo.get(gone.id()).isEmpty());
        assertEquals(List.of(keep), repo.list(TaskFilter.all()));

        List<AuditEntry> deletes = audit.query(AuditQuery.all().withOperation(AuditOperation.DELETE));
        assertEquals(1, deletes.size());
        Task snapshot = TaskCodec.decode(deletes.get(0).details().get("record"));
        assertEquals(2, snapshot.version());
        assertEquals(TaskPriority.LOW, snapshot.priority());
    }

    @Test
    void delete_of_unknown_id_returns_false_without_audit() {
        assertFalse(repo.delete("missing", "admin"));
        assertTrue(audit.query(AuditQuery.all()).isEmpty());
    }

    @Test
    void history_scenario_create_then_two_updates_newest_first() {
        Task t = Task.builder().title("Implement auth").description("JWT login").assignee("Joao")
                .priority(TaskPriority.HIGH).build();
        assertEquals(1, repo.create(t, "manager").version());

        Task v2 = repo.update(t.id(), "joao", TaskUpdate.builder().status(TaskStatus.IN_PROGRESS).build()).orElseThrow();
        assertEquals(2, v2.version());

        Task v3 = repo.update(t.id(), "joao", TaskUpdate.builder().priority(TaskPriority.CRITICAL).build()).orElseThrow();
        assertEquals(3, v3.version());

        List<AuditEntry> h = repo.history(t.id());
        assertEquals(3, h.size());
        assertEquals(AuditOperation.UPDATE, h.get(0).operation());
        assertEquals(AuditOperation.UPDATE, h.get(1).operation());
        assertEquals(AuditOperation.CREATE, h.get(2).operation());

        var firstUpdate = h.get(1).details().get("changes");
        assertEquals(1, firstUpdate.size());
        assertEquals("PENDING", firstUpdate.at("/status/previous").asText());
        assertEquals("IN_PROGRESS", firstUpdate.at("/status/new").asText());
        assertEquals("CRITICAL", h.get(0).details().at("/changes/priority/new").asText());
    }

    @Test
    void history_only_includes_the_requested_record() {
        Task a = task("a", "x");
        Task b = task("b", "x");
        repo.create(a, null);
        repo.create(b, null);
        repo.delete(b.id(), null);

        assertEquals(1, repo.history(a.id()).size());
        assertEquals(2, repo.history(b.id()).size());
    }

    @Test
    void corrupted_document_fails_every_operation() throws Exception {
        Task t = task("Task", "Ana");
        repo.create(t, null);

        var root = (ObjectNode) JsonMappers.MAPPER.readTree(Files.readAllBytes(dataFile));
        ((ObjectNode) root.get("records").get(0)).put("title", "Corrupted title");
        byte[] corrupted = JsonMappers.PRETTY.writeValueAsBytes(root);
        Files.write(dataFile, corrupted);

        assertThrows(IntegrityException.class, () -> repo.get(t.id()));
        assertThrows(IntegrityException.class, () -> repo.list(TaskFilter.all()));
        assertThrows(IntegrityException.class,
                () -> repo.update(t.id(), null, TaskUpdate.builder().title("fix").build()));
        assertThrows(IntegrityException.class, () -> repo.delete(t.id(), null));
        assertThrows(IntegrityException.class, () -> repo.create(task("other", "x"), null));

        // never repaired, never rewritten
        assertArrayEquals(corrupted, Files.readAllBytes(dataFile));
        assertFalse(repo.checkIntegrity().valid());
        assertEquals(1, repo.history(t.id()).size());
    }

    @Test
    void state_survives_a_new_instance() {
        Task t = task("durable", "Rita");
        repo.create(t, null);
        repo.update(t.id(), null, TaskUpdate.builder().status(TaskStatus.CANCELLED).build());

        var reopened = new FileTaskRepository(dataFile, dir.resolve("data/audit.log"));
        Task back = reopened.get(t.id()).orElseThrow();
        assertEquals(TaskStatus.CANCELLED, back.status());
        assertEquals(2, back.version());
        assertEquals(2, reopened.history(t.id()).size());
    }

    @Test
    void returned_tasks_are_detached_from_the_store() {
        Task t = task("detached", "Ana");
        repo.create(t, null);

        Task copy = repo.get(t.id()).orElseThrow();
        copy.update(TaskUpdate.builder().title("local only").build(), Instant.now());

        assertEquals("detached", repo.get(t.id()).orElseThrow().title());
    }
}
