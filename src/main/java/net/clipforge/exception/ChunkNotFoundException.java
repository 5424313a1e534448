package net.clipforge.exception;

/**
 * A part referenced by a manifest is missing from the store.
 * RETRYABLE: No
 */
public class ChunkNotFoundException extends ClipForgeException {

    private final int sequenceIndex;
    private final String storageKey;

    public ChunkNotFoundException(int sequenceIndex, String storageKey) {
        super(ErrorCode.CHUNK_NOT_FOUND, "Chunk " + sequenceIndex + " not found: " + storageKey, false, null);
        this.sequenceIndex = sequenceIndex;
        this.storageKey = storageKey;
    }

    public int getSequenceIndex() {
        return sequenceIndex;
    }

    public String getStorageKey() {
        return storageKey;
    }
}
