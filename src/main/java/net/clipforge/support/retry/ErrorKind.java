package net.clipforge.support.retry;

/**
 * Retry classification of a failure.
 */
public enum ErrorKind {
    /** Retrying cannot help; propagate immediately. */
    TERMINAL,
    /** May succeed on a later attempt. */
    TRANSIENT
}
