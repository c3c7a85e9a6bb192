package io.taskledger.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 checksum of a collection document.
 * <p>
 * The digest covers every top-level field except {@value #FIELD}, serialized
 * canonically: the tree is converted to plain maps/lists and written with map
 * keys sorted recursively and no whitespace. The result does not depend on
 * field insertion order or on how the file was pretty-printed.
 */
public final class DocumentChecksum {
    public static final String FIELD = "checksum";

    private DocumentChecksum() {
        // utility
    }

    /** Lowercase hex SHA-256 over everything but the checksum field. */
    public static String compute(ObjectNode document) {
        ObjectNode content = document.deepCopy();
        content.remove(FIELD);
        return HexFormat.of().formatHex(sha256(canonicalBytes(content)));
    }

    /** True iff a textual checksum is present and equals the recomputed one. */
    public static boolean verify(ObjectNode document) {
        JsonNode stored = document.get(FIELD);
        if (stored == null || !stored.isTextual()) return false;
        return MessageDigest.isEqual(
                stored.asText().getBytes(java.nio.charset.StandardCharsets.US_ASCII),
                compute(document).getBytes(java.nio.charset.StandardCharsets.US_ASCII));
    }

    static byte[] canonicalBytes(JsonNode content) {
        try {
            Object plain = JsonMappers.CANONICAL.treeToValue(content, Object.class);
            return JsonMappers.CANONICAL.writeValueAsBytes(plain);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize document content", e);
        }
    }

    private static byte[] sha256(byte[] bytes) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
