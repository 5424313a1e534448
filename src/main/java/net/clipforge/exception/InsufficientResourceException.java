package net.clipforge.exception;

/**
 * The generation service refused work because the account has run out of credits.
 * RETRYABLE: No (retrying cannot restore a balance)
 */
public class InsufficientResourceException extends ClipForgeException {

    public static final String USER_MESSAGE =
        "The video generation account has insufficient credits. Add credits and try again.";

    public InsufficientResourceException(String detail, Throwable cause) {
        super(ErrorCode.INSUFFICIENT_RESOURCE, "Insufficient generation credits: " + detail, false, cause);
    }

    public InsufficientResourceException(String detail) {
        this(detail, null);
    }
}
