package net.clipforge.exception;

/**
 * The caller cancelled polling. The remote job is neither failed nor succeeded from our side.
 * RETRYABLE: No
 */
public class GenerationAbortedException extends ClipForgeException {

    private final String jobId;

    public GenerationAbortedException(String jobId) {
        super(ErrorCode.GENERATION_ABORTED, "Polling for generation job " + jobId + " was cancelled", false, null);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
