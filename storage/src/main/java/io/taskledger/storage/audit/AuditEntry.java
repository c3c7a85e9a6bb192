package io.taskledger.storage.audit;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * One immutable fact about an accepted mutation.
 *
 * @param timestamp when the entry was appended
 * @param operation CREATE, UPDATE or DELETE
 * @param recordId  opaque id of the task the operation touched
 * @param actor     who performed it ({@link AuditLog#SYSTEM_ACTOR} when unknown)
 * @param details   snapshot ({@code {"record": ...}}) for CREATE/DELETE,
 *                  change-set for UPDATE
 */
public record AuditEntry(
        Instant timestamp,
        AuditOperation operation,
        String recordId,
        String actor,
        JsonNode details
) {
    public AuditEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(recordId, "recordId");
        Objects.requireNonNull(actor, "actor");
        details = details == null ? null : details.deepCopy();
    }

    /** Details tree; a copy, so callers cannot alter the entry. */
    @Override
    public JsonNode details() {
        return details == null ? null : details.deepCopy();
    }
}
