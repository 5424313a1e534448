package net.clipforge.exception;

/**
 * Every permitted attempt of an operation failed with a retryable error.
 * The last observed error is the cause.
 */
public class RetryExhaustedException extends ClipForgeException {

    private final String operationLabel;
    private final int attempts;

    public RetryExhaustedException(String operationLabel, int attempts, Throwable lastError) {
        super(ErrorCode.RETRY_EXHAUSTED,
            "'" + operationLabel + "' failed after " + attempts + " attempt(s): "
                + (lastError != null && lastError.getMessage() != null ? lastError.getMessage() : "unknown error"),
            false,
            lastError);
        this.operationLabel = operationLabel;
        this.attempts = attempts;
    }

    public String getOperationLabel() {
        return operationLabel;
    }

    public int getAttempts() {
        return attempts;
    }
}
