package net.clipforge.support.storage;

/**
 * How a signed URL is meant to be consumed by the browser.
 */
public enum SignedUrlIntent {
    /** Inline playback or display. */
    READ,
    /** Forces an attachment download. */
    DOWNLOAD
}
