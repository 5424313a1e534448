package net.clipforge.exception;

/**
 * A manifest object exists but cannot be parsed or violates its structural invariants.
 * RETRYABLE: No
 */
public class ManifestCorruptException extends ClipForgeException {

    public ManifestCorruptException(String manifestKey, String detail, Throwable cause) {
        super(ErrorCode.MANIFEST_CORRUPT, "Manifest " + manifestKey + " is unreadable: " + detail, false, cause);
    }
}
