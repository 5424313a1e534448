package net.clipforge.exception;

/**
 * Object store call failed (service error, client error, unreachable endpoint).
 * RETRYABLE: Yes (transient store issues)
 */
public class ObjectStoreException extends TransientIoException {

    private final String storageKey;

    public ObjectStoreException(String message, String storageKey, Throwable cause) {
        super(message, cause);
        this.storageKey = storageKey;
    }

    public String getStorageKey() {
        return storageKey;
    }
}
