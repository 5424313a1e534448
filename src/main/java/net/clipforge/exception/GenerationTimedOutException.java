package net.clipforge.exception;

import java.time.Duration;

/**
 * The generation job did not reach a terminal state before the polling deadline.
 * The remote job is left running; callers resubmit instead of resuming the same id.
 * RETRYABLE: Yes (as a fresh job)
 */
public class GenerationTimedOutException extends ClipForgeException {

    private final String jobId;
    private final Duration maxWait;

    public GenerationTimedOutException(String jobId, Duration maxWait) {
        super(ErrorCode.GENERATION_TIMED_OUT,
            "Generation job " + jobId + " did not finish within " + maxWait.toMillis() + "ms",
            true,
            null);
        this.jobId = jobId;
        this.maxWait = maxWait;
    }

    public String getJobId() {
        return jobId;
    }

    public Duration getMaxWait() {
        return maxWait;
    }
}
