// file: client/src/main/java/io/taskledger/client/Cli.java
package io.taskledger.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskledger.core.Task;
import io.taskledger.core.TaskField;
import io.taskledger.core.TaskFilter;
import io.taskledger.core.TaskPriority;
import io.taskledger.core.TaskStatus;
import io.taskledger.core.TaskUpdate;
import io.taskledger.core.Timestamps;
import io.taskledger.core.ValidationException;
import io.taskledger.storage.DuplicateIdException;
import io.taskledger.storage.FileTaskRepository;
import io.taskledger.storage.IntegrityException;
import io.taskledger.storage.IntegrityReport;
import io.taskledger.storage.StorageException;
import io.taskledger.storage.TaskRepository;
import io.taskledger.storage.audit.AuditEntry;

import java.io.PrintStream;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command-line front end over a local task store.
 *
 * Usage:
 *   taskledger [--data file] [--audit file] [--actor name] create <title> <description> <assignee>
 *              [--priority P] [--status S]
 *   taskledger ... list [--status S] [--priority P] [--assignee A]
 *   taskledger ... view <id>
 *   taskledger ... update <id> [--title T] [--description D] [--status S] [--priority P] [--assignee A]
 *   taskledger ... delete <id>
 *   taskledger ... history <id>
 *   taskledger ... verify
 *
 * Exit codes: 0 ok, 1 usage / validation / not found, 2 storage failure, 3 integrity failure.
 */
public final class Cli {

    static final int OK = 0;
    static final int FAILED = 1;
    static final int STORAGE_FAILURE = 2;
    static final int INTEGRITY_FAILURE = 3;

    private static final DateTimeFormatter LOCAL =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private final TaskRepository repo;
    private final String actor;
    private final PrintStream out;

    Cli(TaskRepository repo, String actor, PrintStream out) {
        this.repo = repo;
        this.actor = actor;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Parse, execute one command, and return the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            CliConfig cfg = CliConfig.fromArgs(args);
            if (cfg.help()) {
                out.println(USAGE);
                return OK;
            }
            if (cfg.command().length == 0) {
                throw new CliException("missing command");
            }

            var repo = new FileTaskRepository(cfg.dataFile(), cfg.auditFile());
            return new Cli(repo, cfg.actor(), out).execute(cfg.command(), err);
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE);
            return FAILED;
        } catch (ValidationException | DuplicateIdException e) {
            err.println("error: " + e.getMessage());
            return FAILED;
        } catch (IntegrityException e) {
            err.println("!!! INTEGRITY FAILURE: " + e.getMessage());
            err.println("!!! The task file may be corrupted. Nothing was changed; restore it from a backup.");
            return INTEGRITY_FAILURE;
        } catch (StorageException e) {
            err.println("storage error: " + e.getMessage()
                    + (e.getCause() != null ? " (" + e.getCause() + ")" : ""));
            return STORAGE_FAILURE;
        }
    }

    private int execute(String[] command, PrintStream err) {
        String cmd = command[0];
        Args a = Args.parse(command, switch (cmd) {
            case "create" -> Set.of("priority", "status");
            case "list" -> Set.of("status", "priority", "assignee");
            case "update" -> Set.of("title", "description", "status", "priority", "assignee");
            case "view", "delete", "history", "verify" -> Set.of();
            default -> throw new CliException("unknown command: " + cmd);
        });

        return switch (cmd) {
            case "create" -> {
                a.requirePositional(3, "create requires <title> <description> <assignee>");
                yield create(a);
            }
            case "list" -> {
                a.requirePositional(0, "list takes no positional arguments");
                yield list(a);
            }
            case "view" -> {
                a.requirePositional(1, "view requires <id>");
                yield view(a.positional(0), err);
            }
            case "update" -> {
                a.requirePositional(1, "update requires <id>");
                yield update(a, err);
            }
            case "delete" -> {
                a.requirePositional(1, "delete requires <id>");
                yield delete(a.positional(0), err);
            }
            case "history" -> {
                a.requirePositional(1, "history requires <id>");
                yield history(a.positional(0));
            }
            default -> {
                a.requirePositional(0, "verify takes no arguments");
                yield verify(err);
            }
        };
    }

    private int create(Args a) {
        Task.Builder b = Task.builder()
                .title(a.positional(0))
                .description(a.positional(1))
                .assignee(a.positional(2));
        if (a.has("priority")) b.priority(a.option("priority"));
        if (a.has("status")) b.status(a.option("status"));

        Task t = repo.create(b.build(), actor);
        out.println("Task created");
        out.println("  ID:       " + t.id());
        out.println("  Title:    " + t.title());
        out.println("  Status:   " + t.status());
        out.println("  Priority: " + t.priority());
        out.println("  Assignee: " + t.assignee());
        return OK;
    }

    private int list(Args a) {
        TaskFilter filter = new TaskFilter(
                a.has("status") ? TaskStatus.parse(a.option("status")) : null,
                a.has("priority") ? TaskPriority.parse(a.option("priority")) : null,
                a.option("assignee"));
        List<Task> tasks = repo.list(filter);
        if (tasks.isEmpty()) {
            out.println("No tasks found.");
            return OK;
        }

        out.printf("%n%-10s %-30s %-12s %-10s %-20s %-8s%n", "ID", "Title", "Status", "Priority", "Assignee", "Version");
        out.println("-".repeat(95));
        for (Task t : tasks) {
            out.printf("%-10s %-30s %-12s %-10s %-20s v%-7d%n",
                    shortId(t.id()), clip(t.title(), 28), t.status(), t.priority(), clip(t.assignee(), 20), t.version());
        }
        out.printf("%nTotal: %d task(s)%n", tasks.size());
        return OK;
    }

    private int view(String id, PrintStream err) {
        var found = repo.get(id);
        if (found.isEmpty()) {
            err.println("error: task " + id + " not found");
            return FAILED;
        }
        Task t = found.get();
        out.println("=".repeat(60));
        out.println("ID:          " + t.id());
        out.println("Title:       " + t.title());
        out.println("Description: " + t.description());
        out.println("Status:      " + t.status());
        out.println("Priority:    " + t.priority());
        out.println("Assignee:    " + t.assignee());
        out.println("Version:     " + t.version());
        out.println("Created:     " + LOCAL.format(t.createdAt()));
        out.println("Updated:     " + LOCAL.format(t.updatedAt()));
        out.println("=".repeat(60));
        return OK;
    }

    private int update(Args a, PrintStream err) {
        String id = a.positional(0);
        Map<String, String> raw = new LinkedHashMap<>();
        for (TaskField f : TaskField.values()) {
            if (a.has(f.wireName())) raw.put(f.wireName(), a.option(f.wireName()));
        }
        if (raw.isEmpty()) {
            throw new CliException("update needs at least one of --title --description --status --priority --assignee");
        }

        var updated = repo.update(id, actor, TaskUpdate.parse(raw));
        if (updated.isEmpty()) {
            err.println("error: task " + id + " not found");
            return FAILED;
        }
        out.println("Task " + shortId(id) + " updated, version v" + updated.get().version());
        return OK;
    }

    private int delete(String id, PrintStream err) {
        if (!repo.delete(id, actor)) {
            err.println("error: task " + id + " not found");
            return FAILED;
        }
        out.println("Task " + id + " deleted");
        return OK;
    }

    private int history(String id) {
        List<AuditEntry> entries = repo.history(id);
        if (entries.isEmpty()) {
            out.println("No history found for task " + id + ".");
            return OK;
        }
        out.println("History of task " + id + ":");
        out.println("-".repeat(80));
        for (AuditEntry e : entries) {
            out.println("[" + Timestamps.format(e.timestamp()) + "] " + e.operation() + " by " + e.actor());
            printChanges(out, e.details());
        }
        out.println("-".repeat(80));
        return OK;
    }

    private int verify(PrintStream err) {
        IntegrityReport r = repo.checkIntegrity();
        out.println("Stored checksum:   " + r.storedChecksum());
        out.println("Computed checksum: " + r.computedChecksum());
        out.println("Records:           " + r.recordCount());
        if (!r.valid()) {
            err.println("!!! INTEGRITY FAILURE: stored checksum does not match the content");
            return INTEGRITY_FAILURE;
        }
        out.println("Status: VALID");
        return OK;
    }

    /** Print "field: previous -> new" lines of an UPDATE entry; other entries print nothing. */
    static void printChanges(PrintStream out, JsonNode details) {
        JsonNode changes = details == null ? null : details.get("changes");
        if (changes == null || !changes.isObject()) return;
        for (Iterator<Map.Entry<String, JsonNode>> it = changes.fields(); it.hasNext(); ) {
            var c = it.next();
            out.println("  " + c.getKey() + ": " + c.getValue().path("previous").asText()
                    + " -> " + c.getValue().path("new").asText());
        }
    }

    private static String shortId(String id) {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }

    private static String clip(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }

    /** Positional arguments and {@code --name value} options of one command. */
    private static final class Args {
        private final List<String> positional = new ArrayList<>();
        private final Map<String, String> options = new LinkedHashMap<>();

        static Args parse(String[] command, Set<String> allowed) {
            Args a = new Args();
            for (int i = 1; i < command.length; i++) {
                String arg = command[i];
                if (arg.startsWith("--")) {
                    String name = arg.substring(2);
                    if (!allowed.contains(name)) {
                        throw new CliException(command[0] + " does not accept " + arg);
                    }
                    if (i + 1 >= command.length) {
                        throw new CliException("missing value for option: " + arg);
                    }
                    a.options.put(name, command[++i]);
                } else {
                    a.positional.add(arg);
                }
            }
            return a;
        }

        void requirePositional(int n, String message) {
            if (positional.size() != n) throw new CliException(message);
        }

        String positional(int i) {
            return positional.get(i);
        }

        boolean has(String name) {
            return options.containsKey(name);
        }

        String option(String name) {
            return options.get(name);
        }
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }

    private static final String USAGE = """
            Usage:
              taskledger [options] create <title> <description> <assignee> [--priority P] [--status S]
              taskledger [options] list [--status S] [--priority P] [--assignee A]
              taskledger [options] view <id>
              taskledger [options] update <id> [--title T] [--description D] [--status S] [--priority P] [--assignee A]
              taskledger [options] delete <id>
              taskledger [options] history <id>
              taskledger [options] verify

            Options:
              --data,  -d   Task document (default: data/tasks.json)
              --audit, -a   Audit log (default: data/audit.log)
              --actor, -u   Who is running the command (default: system)
              --help,  -h   Show this help message

            Status:   PENDING, IN_PROGRESS, DONE, CANCELLED
            Priority: LOW, MEDIUM, HIGH, CRITICAL
            """;
}
