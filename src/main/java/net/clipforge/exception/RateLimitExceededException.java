package net.clipforge.exception;

/**
 * A caller exceeded its request allowance for the current window.
 */
public class RateLimitExceededException extends ClipForgeException {

    private final String ownerId;
    private final long limit;

    public RateLimitExceededException(String ownerId, String windowLabel, long limit) {
        super(ErrorCode.RATE_LIMITED,
            "Rate limit exceeded for " + ownerId + ": " + limit + " requests per " + windowLabel,
            true,
            null);
        this.ownerId = ownerId;
        this.limit = limit;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public long getLimit() {
        return limit;
    }
}
