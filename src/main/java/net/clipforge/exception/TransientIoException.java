package net.clipforge.exception;

/**
 * Network or storage call failed for a reason that may clear up on its own.
 * RETRYABLE: Yes
 */
public class TransientIoException extends ClipForgeException {

    public TransientIoException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_IO, message, true, cause);
    }

    public TransientIoException(String message) {
        this(message, null);
    }
}
