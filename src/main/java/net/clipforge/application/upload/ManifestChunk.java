package net.clipforge.application.upload;

/**
 * One part of a chunked object, in reassembly order.
 */
public record ManifestChunk(int sequenceIndex, String storageKey, long byteLength) {

    public ManifestChunk {
        if (sequenceIndex < 0) {
            throw new IllegalArgumentException("sequenceIndex must not be negative");
        }
        if (storageKey == null || storageKey.isBlank()) {
            throw new IllegalArgumentException("storageKey must not be blank");
        }
    }
}
