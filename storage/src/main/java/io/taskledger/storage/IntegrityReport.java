package io.taskledger.storage;

/**
 * Outcome of checking the collection document without loading it.
 *
 * @param storedChecksum   checksum found in the file, or null if absent
 * @param computedChecksum checksum recomputed from the file's content
 * @param recordCount      number of entries in the records array
 */
public record IntegrityReport(String storedChecksum, String computedChecksum, int recordCount) {

    public boolean valid() {
        return storedChecksum != null && storedChecksum.equals(computedChecksum);
    }
}
