// file: demo/src/main/java/io/taskledger/demo/Walkthrough.java
package io.taskledger.demo;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskledger.core.Task;
import io.taskledger.core.TaskFilter;
import io.taskledger.core.TaskPriority;
import io.taskledger.core.TaskStatus;
import io.taskledger.core.TaskUpdate;
import io.taskledger.core.Timestamps;
import io.taskledger.storage.FileTaskRepository;
import io.taskledger.storage.IntegrityReport;
import io.taskledger.storage.TaskRepository;
import io.taskledger.storage.audit.AuditEntry;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Scripted tour of the task store against a scratch directory.
 *
 * Usage:
 *   java -jar demo.jar [directory]     (default: data/demo)
 *
 * Steps:
 *   - create three tasks and list them
 *   - update the first one twice (status, then priority)
 *   - filter by status and by priority
 *   - print the first task's history and the integrity check
 *   - complete the third task and print a per-status summary
 */
public final class Walkthrough {

    static final String DEFAULT_DIR = "data/demo";

    private Walkthrough() {
    }

    public static void main(String[] args) throws IOException {
        Path dir = Path.of(args.length > 0 ? args[0] : DEFAULT_DIR);
        run(dir, System.out);
    }

    /** Runs every step against {@code dir}, wiping earlier demo files first. */
    static void run(Path dir, PrintStream out) throws IOException {
        Path dataFile = dir.resolve("tasks.json");
        Path auditFile = dir.resolve("audit.log");
        Files.deleteIfExists(dataFile);
        Files.deleteIfExists(auditFile);

        TaskRepository repo = new FileTaskRepository(dataFile, auditFile);

        banner(out, "1. Creating tasks");
        Task auth = repo.create(Task.builder()
                .title("Implement authentication")
                .description("JWT based login and logout")
                .assignee("Joao Silva")
                .priority(TaskPriority.HIGH)
                .build(), "manager");
        Task schema = repo.create(Task.builder()
                .title("Design database schema")
                .description("Model the core tables")
                .assignee("Maria Santos")
                .priority(TaskPriority.MEDIUM)
                .build(), "manager");
        Task docs = repo.create(Task.builder()
                .title("Write API documentation")
                .description("Document every public endpoint")
                .assignee("Pedro Costa")
                .priority(TaskPriority.LOW)
                .build(), "manager");
        for (Task t : List.of(auth, schema, docs)) {
            out.println("  created " + t);
        }

        banner(out, "2. Listing all tasks");
        printTasks(out, repo.list(TaskFilter.all()));

        banner(out, "3. Updating '" + auth.title() + "'");
        Task v2 = repo.update(auth.id(), "joao.silva",
                TaskUpdate.builder().status(TaskStatus.IN_PROGRESS).build()).orElseThrow();
        out.println("  status -> " + v2.status() + " (v" + v2.version() + ")");
        Task v3 = repo.update(auth.id(), "joao.silva",
                TaskUpdate.builder().priority(TaskPriority.CRITICAL).build()).orElseThrow();
        out.println("  priority -> " + v3.priority() + " (v" + v3.version() + ")");

        banner(out, "4. Filtering");
        out.println("  status IN_PROGRESS:");
        printTasks(out, repo.list(TaskFilter.all().withStatus(TaskStatus.IN_PROGRESS)));
        out.println("  priority MEDIUM:");
        printTasks(out, repo.list(TaskFilter.all().withPriority(TaskPriority.MEDIUM)));

        banner(out, "5. History of '" + auth.title() + "'");
        for (AuditEntry e : repo.history(auth.id())) {
            out.println("  [" + Timestamps.format(e.timestamp()) + "] " + e.operation() + " by " + e.actor());
            printChanges(out, e.details());
        }

        banner(out, "6. Integrity check");
        IntegrityReport report = repo.checkIntegrity();
        out.println("  stored:   " + report.storedChecksum());
        out.println("  computed: " + report.computedChecksum());
        out.println("  " + (report.valid() ? "VALID" : "INVALID") + ", " + report.recordCount() + " record(s)");

        banner(out, "7. Completing '" + docs.title() + "'");
        Task done = repo.update(docs.id(), "pedro.costa",
                TaskUpdate.builder().status(TaskStatus.DONE).build()).orElseThrow();
        out.println("  status -> " + done.status() + " (v" + done.version() + ")");

        banner(out, "8. Summary");
        Map<TaskStatus, Integer> byStatus = new EnumMap<>(TaskStatus.class);
        List<Task> all = repo.list(TaskFilter.all());
        for (Task t : all) {
            byStatus.merge(t.status(), 1, Integer::sum);
        }
        out.println("  total: " + all.size());
        for (TaskStatus s : TaskStatus.values()) {
            out.printf("  %-12s %d%n", s, byStatus.getOrDefault(s, 0));
        }
        out.println();
        out.println("Files kept in " + dir.toAbsolutePath());
    }

    private static void banner(PrintStream out, String title) {
        out.println();
        out.println("=".repeat(60));
        out.println(title);
        out.println("=".repeat(60));
    }

    private static void printTasks(PrintStream out, List<Task> tasks) {
        if (tasks.isEmpty()) {
            out.println("  (none)");
            return;
        }
        for (Task t : tasks) {
            out.printf("  %-8s %-28s %-12s %-9s %s%n",
                    t.id().substring(0, Math.min(8, t.id().length())),
                    t.title(), t.status(), t.priority(), t.assignee());
        }
    }

    private static void printChanges(PrintStream out, JsonNode details) {
        JsonNode changes = details.get("changes");
        if (changes == null) return;
        for (Iterator<Map.Entry<String, JsonNode>> it = changes.fields(); it.hasNext(); ) {
            var c = it.next();
            out.println("      " + c.getKey() + ": " + c.getValue().path("previous").asText()
                    + " -> " + c.getValue().path("new").asText());
        }
    }
}
