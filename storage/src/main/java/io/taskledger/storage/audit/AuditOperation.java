package io.taskledger.storage.audit;

/** Kind of mutation an audit entry records. */
public enum AuditOperation {
    CREATE,
    UPDATE,
    DELETE
}
