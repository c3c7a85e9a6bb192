package io.taskledger.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskledger.core.ChangeSet;
import io.taskledger.core.FieldChange;
import io.taskledger.core.Task;
import io.taskledger.core.TaskField;
import io.taskledger.core.TaskPriority;
import io.taskledger.core.TaskStatus;
import io.taskledger.core.Timestamps;
import io.taskledger.core.ValidationException;

import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * JSON tree form of tasks and change-sets.
 * <p>
 * Record object layout:
 * <pre>
 *   { "id", "title", "description", "status", "priority", "assignee",
 *     "version", "created_at", "updated_at" }
 * </pre>
 * Change-set layout (audit details of an UPDATE):
 * <pre>
 *   { "changes": { "&lt;field&gt;": { "previous": ..., "new": ... } },
 *     "version": n, "updated_at": ts }
 * </pre>
 * Decoding is strict: a missing or mistyped field is an {@link IntegrityException}.
 */
public final class TaskCodec {
    static final String ID = "id";
    static final String TITLE = "title";
    static final String DESCRIPTION = "description";
    static final String STATUS = "status";
    static final String PRIORITY = "priority";
    static final String ASSIGNEE = "assignee";
    static final String VERSION = "version";
    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";

    private TaskCodec() {
        // utility
    }

    public static ObjectNode encode(Task t) {
        ObjectNode n = JsonMappers.MAPPER.createObjectNode();
        n.put(ID, t.id());
        n.put(TITLE, t.title());
        n.put(DESCRIPTION, t.description());
        n.put(STATUS, t.status().name());
        n.put(PRIORITY, t.priority().name());
        n.put(ASSIGNEE, t.assignee());
        n.put(VERSION, t.version());
        n.put(CREATED_AT, Timestamps.format(t.createdAt()));
        n.put(UPDATED_AT, Timestamps.format(t.updatedAt()));
        return n;
    }

    /**
     * @throws IntegrityException if the node is not a complete, well-typed record
     */
    public static Task decode(JsonNode n) {
        if (n == null || !n.isObject()) {
            throw new IntegrityException("Malformed record: expected an object, got " + n);
        }
        try {
            return Task.restore(
                    text(n, ID),
                    text(n, TITLE),
                    text(n, DESCRIPTION),
                    text(n, ASSIGNEE),
                    TaskStatus.parse(text(n, STATUS)),
                    TaskPriority.parse(text(n, PRIORITY)),
                    integer(n, VERSION),
                    Timestamps.parse(text(n, CREATED_AT)),
                    Timestamps.parse(text(n, UPDATED_AT))
            );
        } catch (ValidationException | DateTimeParseException | IllegalArgumentException e) {
            throw new IntegrityException("Malformed record " + n.path(ID).asText("?") + ": " + e.getMessage(), e);
        }
    }

    public static ObjectNode encodeChangeSet(ChangeSet cs) {
        ObjectNode changes = JsonMappers.MAPPER.createObjectNode();
        for (Map.Entry<TaskField, FieldChange> e : cs.changes().entrySet()) {
            ObjectNode pair = changes.putObject(e.getKey().wireName());
            pair.put("previous", e.getValue().previous());
            pair.put("new", e.getValue().next());
        }
        ObjectNode n = JsonMappers.MAPPER.createObjectNode();
        n.set("changes", changes);
        n.put(VERSION, cs.version());
        if (cs.updatedAt() != null) {
            n.put(UPDATED_AT, Timestamps.format(cs.updatedAt()));
        }
        return n;
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || !v.isTextual()) {
            throw new IntegrityException("Malformed record: field '" + field + "' missing or not text");
        }
        return v.asText();
    }

    private static int integer(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || !v.canConvertToInt() || !v.isIntegralNumber()) {
            throw new IntegrityException("Malformed record: field '" + field + "' missing or not an integer");
        }
        return v.intValue();
    }
}
