// file: src/main/java/io/taskledger/storage/FileTaskRepository.java
package io.taskledger.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskledger.core.ChangeSet;
import io.taskledger.core.Task;
import io.taskledger.core.TaskFilter;
import io.taskledger.core.TaskUpdate;
import io.taskledger.storage.audit.AuditEntry;
import io.taskledger.storage.audit.AuditLog;
import io.taskledger.storage.audit.AuditOperation;
import io.taskledger.storage.audit.AuditQuery;
import io.taskledger.storage.audit.FileAuditLog;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Task repository backed by a single checksummed JSON document.
 * <p>
 * Every operation:
 *  1) takes the instance lock (fair, no timeout),
 *  2) loads and verifies the document,
 *  3) mutates the in-memory list (if it is a mutation),
 *  4) saves the whole document atomically with a fresh checksum,
 *  5) releases the lock,
 *  6) appends the audit entry, before returning to the caller.
 * <p>
 * Reads go through the same lock so they never observe a torn document.
 * The audit append sits outside the lock: an entry never precedes the state it
 * describes, but a crash between 4) and 6) leaves a persisted, unaudited change.
 * <p>
 * Two instances on the same files are not coordinated.
 */
public class FileTaskRepository implements TaskRepository {
    private static final Logger log = Logger.getLogger(FileTaskRepository.class.getName());

    private final TaskDocumentFile document;
    private final AuditLog auditLog;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock(true);

    /** Document and audit log at the given paths, UTC system clock. */
    public FileTaskRepository(Path dataFile, Path auditFile) {
        this(dataFile, new FileAuditLog(auditFile), Clock.systemUTC());
    }

    /**
     * @param dataFile collection document; created empty if absent
     * @param auditLog where mutations are recorded
     * @param clock    source of update timestamps
     */
    public FileTaskRepository(Path dataFile, AuditLog auditLog, Clock clock) {
        this.document = new TaskDocumentFile(dataFile);
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
        this.clock = Objects.requireNonNull(clock, "clock");

        if (!document.exists()) {
            document.save(List.of());
            log.info("Initialized empty task document at " + document.path());
        }
    }

    @Override
    public Task create(Task task, String actor) {
        Objects.requireNonNull(task, "task");
        ObjectNode snapshot;

        lock.lock();
        try {
            List<Task> tasks = document.load();
            if (indexOf(tasks, task.id()) >= 0) {
                throw new DuplicateIdException(task.id());
            }
            tasks.add(task.copy());
            document.save(tasks);
            snapshot = TaskCodec.encode(task);
        } finally {
            lock.unlock();
        }

        auditLog.append(AuditOperation.CREATE, task.id(), actor, details("record", snapshot));
        log.fine(() -> "created " + task);
        return task;
    }

    @Override
    public Optional<Task> get(String id) {
        Objects.requireNonNull(id, "id");
        lock.lock();
        try {
            List<Task> tasks = document.load();
            int i = indexOf(tasks, id);
            return i < 0 ? Optional.empty() : Optional.of(tasks.get(i));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Task> list(TaskFilter filter) {
        TaskFilter f = filter == null ? TaskFilter.all() : filter;
        lock.lock();
        try {
            return document.load().stream().filter(f::matches).toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Task> update(String id, String actor, TaskUpdate update) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(update, "update");
        Task task;
        ChangeSet changes;

        lock.lock();
        try {
            List<Task> tasks = document.load();
            int i = indexOf(tasks, id);
            if (i < 0) {
                return Optional.empty();
            }
            task = tasks.get(i);
            changes = task.update(update, clock.instant());
            if (changes.isEmpty()) {
                log.fine(() -> "update of " + id + " changed nothing");
                return Optional.of(task);
            }
            document.save(tasks);
        } finally {
            lock.unlock();
        }

        auditLog.append(AuditOperation.UPDATE, id, actor, TaskCodec.encodeChangeSet(changes));
        log.fine(() -> "updated " + id + ": " + changes);
        return Optional.of(task.copy());
    }

    @Override
    public boolean delete(String id, String actor) {
        Objects.requireNonNull(id, "id");
        Task removed;

        lock.lock();
        try {
            List<Task> tasks = document.load();
            int i = indexOf(tasks, id);
            if (i < 0) {
                return false;
            }
            removed = tasks.remove(i);
            document.save(tasks);
        } finally {
            lock.unlock();
        }

        auditLog.append(AuditOperation.DELETE, id, actor, details("record", TaskCodec.encode(removed)));
        log.fine(() -> "deleted " + removed);
        return true;
    }

    @Override
    public List<AuditEntry> history(String id) {
        Objects.requireNonNull(id, "id");
        return auditLog.query(AuditQuery.forRecord(id));
    }

    @Override
    public IntegrityReport checkIntegrity() {
        lock.lock();
        try {
            IntegrityReport report = document.inspect();
            if (!report.valid() && document.exists()) {
                log.severe("Integrity check failed for " + document.path()
                        + ": stored=" + report.storedChecksum() + " computed=" + report.computedChecksum());
            }
            return report;
        } finally {
            lock.unlock();
        }
    }

    private static int indexOf(List<Task> tasks, String id) {
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).id().equals(id)) return i;
        }
        return -1;
    }

    private static ObjectNode details(String key, ObjectNode value) {
        ObjectNode n = JsonMappers.MAPPER.createObjectNode();
        n.set(key, value);
        return n;
    }
}
