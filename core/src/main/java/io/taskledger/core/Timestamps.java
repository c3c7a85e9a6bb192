package io.taskledger.core;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Text form of timestamps used in documents and audit entries.
 * <p>
 * Always UTC with exactly nine fraction digits, so the text is lossless and
 * sorts lexicographically in time order. Parsing accepts any ISO-8601 instant.
 */
public final class Timestamps {
    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'").withZone(ZoneOffset.UTC);

    private Timestamps() {
        // utility
    }

    public static String format(Instant instant) {
        return FORMAT.format(instant);
    }

    /**
     * @throws DateTimeParseException if {@code text} is not an ISO-8601 instant
     */
    public static Instant parse(String text) {
        return Instant.parse(text);
    }
}
