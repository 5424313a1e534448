package net.clipforge.exception;

/**
 * Generation service call failed with an HTTP or network error other than resource exhaustion.
 * RETRYABLE: Yes
 */
public class GenerationServiceException extends TransientIoException {

    private final int statusCode;

    public GenerationServiceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public GenerationServiceException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    /**
     * Returns the HTTP status reported by the service, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
