package net.clipforge.application.upload;

/**
 * Result of a successful upload.
 *
 * @param key manifest key for {@link Kind#CHUNKED}, object key for {@link Kind#DIRECT}
 * @param url path that serves the object back through the media endpoint
 */
public record StoredObjectReference(Kind kind, String key, String url, long sizeBytes, int partCount) {

    public enum Kind {
        DIRECT,
        CHUNKED
    }

    public boolean isChunked() {
        return kind == Kind.CHUNKED;
    }
}
