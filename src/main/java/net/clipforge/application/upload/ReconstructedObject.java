package net.clipforge.application.upload;

/**
 * Bytes read back from storage.
 *
 * @param manifest the manifest used for reassembly, or {@code null} for a direct object
 * @param sizeMismatch whether the reassembled length disagreed with the manifest
 */
public record ReconstructedObject(byte[] bytes, Manifest manifest, boolean sizeMismatch) {

    public static ReconstructedObject direct(byte[] bytes) {
        return new ReconstructedObject(bytes, null, false);
    }

    public long length() {
        return bytes.length;
    }
}
