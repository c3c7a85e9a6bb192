package io.taskledger.storage.audit;

/**
 * Filters for {@link AuditLog#query}. Null components are not applied.
 *
 * @param recordId  only entries for this record
 * @param operation only entries of this kind
 * @param limit     keep at most this many (after sorting newest first); must be >= 0
 */
public record AuditQuery(String recordId, AuditOperation operation, Integer limit) {

    public AuditQuery {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        }
    }

    public static AuditQuery all() {
        return new AuditQuery(null, null, null);
    }

    public static AuditQuery forRecord(String recordId) {
        return new AuditQuery(recordId, null, null);
    }

    public AuditQuery withOperation(AuditOperation op) {
        return new AuditQuery(recordId, op, limit);
    }

    public AuditQuery withLimit(int n) {
        return new AuditQuery(recordId, operation, n);
    }

    boolean matches(AuditEntry e) {
        if (recordId != null && !recordId.equals(e.recordId())) return false;
        return operation == null || operation == e.operation();
    }
}
