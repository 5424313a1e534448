package net.clipforge.exception;

/**
 * No manifest object exists under the requested key.
 * RETRYABLE: No
 */
public class ManifestNotFoundException extends ClipForgeException {

    private final String manifestKey;

    public ManifestNotFoundException(String manifestKey) {
        super(ErrorCode.MANIFEST_NOT_FOUND, "Manifest not found: " + manifestKey, false, null);
        this.manifestKey = manifestKey;
    }

    public String getManifestKey() {
        return manifestKey;
    }
}
