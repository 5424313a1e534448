package net.clipforge.exception;

/**
 * A part (or the manifest) of a chunked upload failed after all retries.
 * Every part uploaded by the failed attempt has already been rolled back when this is thrown.
 * RETRYABLE: Yes (the whole upload can be re-run)
 */
public class ChunkUploadFailedException extends ClipForgeException {

    /** Part index reported when the manifest write, not a data part, failed. */
    public static final int MANIFEST_PART_INDEX = -1;

    private final String ownerId;
    private final String logicalName;
    private final int partIndex;

    public ChunkUploadFailedException(String ownerId, String logicalName, int partIndex, Throwable cause) {
        super(ErrorCode.CHUNK_UPLOAD_FAILED, describe(ownerId, logicalName, partIndex, cause), true, cause);
        this.ownerId = ownerId;
        this.logicalName = logicalName;
        this.partIndex = partIndex;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getLogicalName() {
        return logicalName;
    }

    public int getPartIndex() {
        return partIndex;
    }

    public boolean isManifestFailure() {
        return partIndex == MANIFEST_PART_INDEX;
    }

    private static String describe(String ownerId, String logicalName, int partIndex, Throwable cause) {
        String target = partIndex == MANIFEST_PART_INDEX ? "manifest" : "part " + partIndex;
        String reason = cause != null && cause.getMessage() != null ? cause.getMessage() : "unknown cause";
        return "Failed to upload " + target + " of " + ownerId + "/" + logicalName + ": " + reason;
    }
}
