package io.taskledger.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson mappers. ObjectMapper is thread safe once configured.
 */
public final class JsonMappers {

    /** Reading, and compact writing (audit lines). */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    /** Human-readable form for the collection document on disk. */
    static final ObjectMapper PRETTY = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /** Keys sorted at every level, no whitespace: the bytes the checksum is taken over. */
    static final ObjectMapper CANONICAL = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private JsonMappers() {
        // utility
    }
}
