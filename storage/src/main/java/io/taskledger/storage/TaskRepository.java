package io.taskledger.storage;

import io.taskledger.core.Task;
import io.taskledger.core.TaskFilter;
import io.taskledger.core.TaskUpdate;
import io.taskledger.storage.audit.AuditEntry;

import java.util.List;
import java.util.Optional;

/**
 * Task store used by the front ends.
 * <p>
 * Semantics:
 *  - every operation sees a verified document; a corrupted one raises
 *    {@link IntegrityException} and nothing is written.
 *  - mutations are durable before returning, and each accepted mutation
 *    is followed by exactly one audit entry.
 *  - reads are not audited.
 *  - operations on one instance never interleave.
 */
public interface TaskRepository {

    /**
     * Add a new task and audit a CREATE with its snapshot.
     *
     * @throws DuplicateIdException if a task with the same id exists; the document is unchanged
     */
    Task create(Task task, String actor);

    /** The task with this id, or empty. */
    Optional<Task> get(String id);

    /** Tasks matching every non-null filter component, in document order. */
    List<Task> list(TaskFilter filter);

    /**
     * Apply a partial update.
     * <ul>
     *   <li>unknown id: empty, nothing written;</li>
     *   <li>no field actually changes: the unchanged task, no write, no audit entry;</li>
     *   <li>otherwise: version bumped, document saved, UPDATE audited with the change-set.</li>
     * </ul>
     */
    Optional<Task> update(String id, String actor, TaskUpdate update);

    /**
     * Remove a task and audit a DELETE with its last snapshot.
     *
     * @return false (and no audit entry) if no task has this id
     */
    boolean delete(String id, String actor);

    /** All audit entries for this id, newest first. */
    List<AuditEntry> history(String id);

    /** Stored vs recomputed checksum of the document, without failing on mismatch. */
    IntegrityReport checkIntegrity();
}
