package net.clipforge.exception;

import java.time.Duration;

/**
 * A single attempt did not finish within its time budget.
 * RETRYABLE: Yes
 */
public class AttemptTimeoutException extends TransientIoException {

    private final int attempt;
    private final Duration timeout;

    public AttemptTimeoutException(String operationLabel, int attempt, Duration timeout) {
        super("Attempt " + attempt + " of '" + operationLabel + "' timed out after " + timeout.toMillis() + "ms");
        this.attempt = attempt;
        this.timeout = timeout;
    }

    public int getAttempt() {
        return attempt;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
