package io.taskledger.storage.audit;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Append-only trail of mutations, keyed by opaque record ids.
 * <p>
 * Contract:
 *  - append() adds exactly one entry at the end and is durable when it returns.
 *  - query() always reflects what is on storage at call time (no caching).
 *  - entries are never edited; only clear() removes them, all at once.
 */
public interface AuditLog {

    /** Actor recorded when the caller does not name one. */
    String SYSTEM_ACTOR = "system";

    /**
     * Append one entry stamped with the current time.
     *
     * @param actor   null or blank is recorded as {@link #SYSTEM_ACTOR}
     * @param details operation-specific payload, may be null
     * @throws io.taskledger.storage.StorageException on I/O failure
     */
    void append(AuditOperation operation, String recordId, String actor, JsonNode details);

    /**
     * Matching entries, newest first. Entries with identical timestamps are
     * ordered by append order, later appended first.
     */
    List<AuditEntry> query(AuditQuery query);

    /** Irreversibly remove every entry. Maintenance only. */
    void clear();
}
