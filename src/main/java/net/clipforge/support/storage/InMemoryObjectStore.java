package net.clipforge.support.storage;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local {@link ObjectStore} used when no S3 credentials are configured.
 * Contents are lost on restart.
 */
public class InMemoryObjectStore implements ObjectStore {

    private final ConcurrentSkipListMap<String, StoredBlob> objects = new ConcurrentSkipListMap<>();
    private final Clock clock;

    public InMemoryObjectStore() {
        this(Clock.systemUTC());
    }

    public InMemoryObjectStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void put(String key, byte[] bytes, String contentType) {
        objects.put(key, new StoredBlob(bytes.clone(), contentType));
    }

    @Override
    public Optional<byte[]> get(String key) {
        StoredBlob blob = objects.get(key);
        return blob == null ? Optional.empty() : Optional.of(blob.bytes().clone());
    }

    @Override
    public boolean exists(String key) {
        return objects.containsKey(key);
    }

    @Override
    public void delete(String key) {
        objects.remove(key);
    }

    @Override
    public List<String> list(String prefix) {
        String effectivePrefix = prefix == null ? "" : prefix;
        return objects.keySet().stream()
            .filter(key -> key.startsWith(effectivePrefix))
            .toList();
    }

    @Override
    public String signedUrl(String key, Duration ttl, SignedUrlIntent intent) {
        long expiresAt = clock.instant().plus(ttl).getEpochSecond();
        return "memory://objects/" + URLEncoder.encode(key, StandardCharsets.UTF_8)
            + "?expires=" + expiresAt
            + "&intent=" + intent.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public void verifyReachable() {
        // always reachable
    }

    @Override
    public String describe() {
        return "in-memory";
    }

    /**
     * Returns the content type recorded for {@code key}, if present.
     */
    public Optional<String> contentTypeOf(String key) {
        StoredBlob blob = objects.get(key);
        return blob == null ? Optional.empty() : Optional.ofNullable(blob.contentType());
    }

    public int size() {
        return objects.size();
    }

    private record StoredBlob(byte[] bytes, String contentType) {
    }
}
