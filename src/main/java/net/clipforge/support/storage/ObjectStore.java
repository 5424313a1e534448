package net.clipforge.support.storage;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key-addressed blob storage used for media parts, manifests and single-shot objects.
 *
 * <p>Implementations are synchronous; callers that need deadlines or retries wrap calls in
 * {@link net.clipforge.support.retry.RetryPolicy}. Failures surface as
 * {@link net.clipforge.exception.ObjectStoreException}.</p>
 */
public interface ObjectStore {

    void put(String key, byte[] bytes, String contentType);

    /**
     * Returns the object's bytes, or empty when no object exists under {@code key}.
     */
    Optional<byte[]> get(String key);

    boolean exists(String key);

    /**
     * Deletes {@code key}. Deleting a missing key succeeds.
     */
    void delete(String key);

    /**
     * Lists every key starting with {@code prefix}.
     */
    List<String> list(String prefix);

    /**
     * Returns a time-limited URL granting read access to {@code key}.
     */
    String signedUrl(String key, Duration ttl, SignedUrlIntent intent);

    /**
     * Verifies the backing store is reachable. Throws when it is not.
     */
    void verifyReachable();

    /**
     * Short label for logs and health details.
     */
    String describe();
}
