// file: src/main/java/io/taskledger/storage/TaskDocumentFile.java
package io.taskledger.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskledger.core.Task;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.*;

/**
 * The collection document on disk: {@code {"records": [...], "checksum": "<hex>"}}.
 * <p>
 * save():
 *  - encodes the records, computes the checksum, embeds it,
 *  - writes the whole document to "&lt;name&gt;.tmp" and fsyncs it,
 *  - moves it over the real file with ATOMIC_MOVE.
 *  A failure at any step leaves the previous file untouched.
 * <p>
 * load():
 *  - missing file: empty collection,
 *  - unparseable content, missing checksum or mismatch: {@link IntegrityException},
 *  - never repairs or partially trusts the content.
 * <p>
 * Not thread safe; the owning repository serializes access.
 */
final class TaskDocumentFile {
    private static final Logger log = Logger.getLogger(TaskDocumentFile.class.getName());

    static final String RECORDS = "records";

    private final Path path;
    private final Path tmp;

    TaskDocumentFile(Path path) {
        this.path = path.toAbsolutePath();
        this.tmp = this.path.resolveSibling(this.path.getFileName() + ".tmp");
        try {
            Files.createDirectories(this.path.getParent());
        } catch (IOException e) {
            throw new StorageException("Cannot create directory for " + this.path, e);
        }
    }

    Path path() {
        return path;
    }

    boolean exists() {
        return Files.exists(path);
    }

    /** Load and verify. Returned list is a fresh, mutable copy in document order. */
    List<Task> load() {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        ObjectNode doc = readDocument();
        if (!DocumentChecksum.verify(doc)) {
            String msg = doc.has(DocumentChecksum.FIELD)
                    ? "Integrity error: checksum mismatch in " + path + ", data is corrupted"
                    : "Integrity error: no checksum in " + path;
            log.severe(msg);
            throw new IntegrityException(msg);
        }

        JsonNode records = doc.get(RECORDS);
        if (records == null || !records.isArray()) {
            throw new IntegrityException("Integrity error: '" + RECORDS + "' array missing in " + path);
        }
        List<Task> tasks = new ArrayList<>(records.size());
        for (JsonNode r : records) {
            tasks.add(TaskCodec.decode(r));
        }
        return tasks;
    }

    /** Persist the full collection with a freshly computed checksum. */
    void save(List<Task> tasks) {
        ObjectNode doc = JsonMappers.MAPPER.createObjectNode();
        ArrayNode records = doc.putArray(RECORDS);
        for (Task t : tasks) {
            records.add(TaskCodec.encode(t));
        }
        doc.put(DocumentChecksum.FIELD, DocumentChecksum.compute(doc));

        byte[] bytes;
        try {
            bytes = JsonMappers.PRETTY.writeValueAsBytes(doc);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize document", e);
        }
        writeAtomically(bytes);
        log.fine(() -> "saved " + tasks.size() + " record(s) to " + path);
    }

    /** Recompute the checksum of whatever is on disk, without throwing on mismatch. */
    IntegrityReport inspect() {
        if (!Files.exists(path)) {
            return new IntegrityReport(null, null, 0);
        }
        ObjectNode doc = readDocument();
        JsonNode stored = doc.get(DocumentChecksum.FIELD);
        JsonNode records = doc.get(RECORDS);
        return new IntegrityReport(
                stored != null && stored.isTextual() ? stored.asText() : null,
                DocumentChecksum.compute(doc),
                records != null && records.isArray() ? records.size() : 0
        );
    }

    private ObjectNode readDocument() {
        JsonNode root;
        try {
            root = JsonMappers.MAPPER.readTree(Files.readAllBytes(path));
        } catch (JsonProcessingException e) {
            log.severe("Integrity error: unparseable document " + path + ": " + e.getOriginalMessage());
            throw new IntegrityException("Integrity error: document " + path + " is not valid JSON", e);
        } catch (IOException e) {
            throw new StorageException("Cannot read " + path, e);
        }
        if (root == null || !root.isObject()) {
            log.severe("Integrity error: document " + path + " is not a JSON object");
            throw new IntegrityException("Integrity error: document " + path + " is not a JSON object");
        }
        return (ObjectNode) root;
    }

    private void writeAtomically(byte[] bytes) {
        try (FileChannel ch = FileChannel.open(tmp, CREATE, WRITE, TRUNCATE_EXISTING)) {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
        } catch (IOException e) {
            throw new StorageException("Cannot write " + tmp, e);
        }
        try {
            Files.move(tmp, path, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Cannot replace " + path, e);
        }
    }
}
