package net.clipforge.exception;

/**
 * Reassembled bytes do not add up to the size recorded in the manifest.
 * Only thrown when strict size checking is enabled.
 */
public class SizeMismatchException extends ClipForgeException {

    private final long expectedBytes;
    private final long actualBytes;

    public SizeMismatchException(String manifestKey, long expectedBytes, long actualBytes) {
        super(ErrorCode.SIZE_MISMATCH,
            "Reconstructed size mismatch for " + manifestKey + ": expected=" + expectedBytes + " actual=" + actualBytes,
            false,
            null);
        this.expectedBytes = expectedBytes;
        this.actualBytes = actualBytes;
    }

    public long getExpectedBytes() {
        return expectedBytes;
    }

    public long getActualBytes() {
        return actualBytes;
    }
}
