package net.clipforge.exception;

/**
 * The remote generation job reported failure.
 * RETRYABLE: Yes, but only by submitting a fresh job.
 */
public class GenerationFailedException extends ClipForgeException {

    private final String jobId;

    public GenerationFailedException(String jobId, String reason) {
        super(ErrorCode.GENERATION_FAILED, "Generation job " + jobId + " failed: " + reason, true, null);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
