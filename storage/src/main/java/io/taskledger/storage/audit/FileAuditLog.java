// file: src/main/java/io/taskledger/storage/audit/FileAuditLog.java
package io.taskledger.storage.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskledger.core.Timestamps;
import io.taskledger.storage.JsonMappers;
import io.taskledger.storage.StorageException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

import static java.nio.file.StandardOpenOption.*;

/**
 * Audit log stored as one JSON object per line:
 * <pre>
 *   {"timestamp":"...","operation":"UPDATE","record_id":"...","actor":"...","details":{...}}
 * </pre>
 * <p>
 *  - append(): opens the file in APPEND mode, writes the line, fsyncs, closes.
 *  - query():  full scan of the file, filter, sort newest first, truncate.
 *  - clear():  truncates the file to zero length.
 * <p>
 * Within one instance appends and clears exclude queries, so a reader never
 * sees a half-written line. Other processes writing the same file are not
 * coordinated with.
 */
public final class FileAuditLog implements AuditLog {
    private static final Logger log = Logger.getLogger(FileAuditLog.class.getName());

    private static final String TIMESTAMP = "timestamp";
    private static final String OPERATION = "operation";
    private static final String RECORD_ID = "record_id";
    private static final String ACTOR = "actor";
    private static final String DETAILS = "details";

    private final Path path;
    private final Clock clock;
    private final ReadWriteLock rw = new ReentrantReadWriteLock();

    public FileAuditLog(Path path) {
        this(path, Clock.systemUTC());
    }

    public FileAuditLog(Path path, Clock clock) {
        this.path = path.toAbsolutePath();
        this.clock = Objects.requireNonNull(clock, "clock");
        try {
            Files.createDirectories(this.path.getParent());
            if (!Files.exists(this.path)) {
                Files.createFile(this.path);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot create audit log " + this.path, e);
        }
    }

    public Path path() {
        return path;
    }

    @Override
    public void append(AuditOperation operation, String recordId, String actor, JsonNode details) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(recordId, "recordId");
        String who = (actor == null || actor.isBlank()) ? SYSTEM_ACTOR : actor;

        rw.writeLock().lock();
        try {
            var entry = new AuditEntry(clock.instant(), operation, recordId, who, details);
            byte[] line = encode(entry);
            try (FileChannel ch = FileChannel.open(path, CREATE, WRITE, APPEND)) {
                ByteBuffer buf = ByteBuffer.wrap(line);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(false);
            } catch (IOException e) {
                throw new StorageException("Audit append failed for " + path, e);
            }
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public List<AuditEntry> query(AuditQuery query) {
        Objects.requireNonNull(query, "query");
        List<Sequenced> matches = new ArrayList<>();

        rw.readLock().lock();
        try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            long lineNo = 0;
            for (String line; (line = in.readLine()) != null; ) {
                lineNo++;
                if (line.isBlank()) continue;
                AuditEntry e = decode(line, lineNo);
                if (query.matches(e)) {
                    matches.add(new Sequenced(lineNo, e));
                }
            }
        } catch (IOException e) {
            throw new StorageException("Cannot read audit log " + path, e);
        } finally {
            rw.readLock().unlock();
        }

        // newest first; equal timestamps: later line first
        matches.sort(Comparator.comparing((Sequenced s) -> s.entry().timestamp())
                .thenComparingLong(Sequenced::seq)
                .reversed());

        int limit = query.limit() == null ? matches.size() : Math.min(query.limit(), matches.size());
        List<AuditEntry> out = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            out.add(matches.get(i).entry());
        }
        return out;
    }

    @Override
    public void clear() {
        rw.writeLock().lock();
        try (FileChannel ch = FileChannel.open(path, CREATE, WRITE, TRUNCATE_EXISTING)) {
            ch.force(true);
            log.warning("Audit log " + path + " cleared");
        } catch (IOException e) {
            throw new StorageException("Cannot clear audit log " + path, e);
        } finally {
            rw.writeLock().unlock();
        }
    }

    private static byte[] encode(AuditEntry e) {
        ObjectNode n = JsonMappers.MAPPER.createObjectNode();
        n.put(TIMESTAMP, Timestamps.format(e.timestamp()));
        n.put(OPERATION, e.operation().name());
        n.put(RECORD_ID, e.recordId());
        n.put(ACTOR, e.actor());
        if (e.details() == null) {
            n.putObject(DETAILS);
        } else {
            n.set(DETAILS, e.details());
        }
        try {
            // compact output never contains a raw newline, so one entry == one line
            return (JsonMappers.MAPPER.writeValueAsString(n) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException ex) {
            throw new StorageException("Cannot serialize audit entry", ex);
        }
    }

    private AuditEntry decode(String line, long lineNo) {
        try {
            JsonNode n = JsonMappers.MAPPER.readTree(line);
            return new AuditEntry(
                    Timestamps.parse(text(n, TIMESTAMP, lineNo)),
                    AuditOperation.valueOf(text(n, OPERATION, lineNo)),
                    text(n, RECORD_ID, lineNo),
                    text(n, ACTOR, lineNo),
                    n.get(DETAILS)
            );
        } catch (JsonProcessingException | DateTimeParseException | IllegalArgumentException e) {
            throw new StorageException("Malformed audit entry at " + path + ":" + lineNo, e);
        }
    }

    private String text(JsonNode n, String field, long lineNo) {
        JsonNode v = n == null ? null : n.get(field);
        if (v == null || !v.isTextual()) {
            throw new StorageException("Malformed audit entry at " + path + ":" + lineNo + ", missing " + field);
        }
        return v.asText();
    }

    private record Sequenced(long seq, AuditEntry entry) {}
}
