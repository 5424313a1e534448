package net.clipforge.exception;

import java.util.Objects;

/**
 * Base exception for upload and generation failures.
 * Subclasses indicate specific failure types for retry classification and for the HTTP layer.
 */
public abstract class ClipForgeException extends RuntimeException {

    /**
     * Canonical failure categories.
     */
    public enum ErrorCode {
        TRANSIENT_IO,
        INSUFFICIENT_RESOURCE,
        CHUNK_UPLOAD_FAILED,
        MANIFEST_NOT_FOUND,
        MANIFEST_CORRUPT,
        CHUNK_NOT_FOUND,
        SIZE_MISMATCH,
        GENERATION_FAILED,
        GENERATION_TIMED_OUT,
        GENERATION_ABORTED,
        RETRY_EXHAUSTED,
        RATE_LIMITED
    }

    private final ErrorCode errorCode;
    private final boolean retryable;

    protected ClipForgeException(ErrorCode errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.retryable = retryable;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
