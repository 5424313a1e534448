package net.clipforge.application.upload;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import net.clipforge.config.UploadProperties;
import net.clipforge.exception.ChunkUploadFailedException;
import net.clipforge.service.event.StorageCleanupFailedEvent;
import net.clipforge.service.event.StorageCleanupFailedEvent.CleanupPhase;
import net.clipforge.support.retry.RetryPolicy;
import net.clipforge.support.retry.RetrySettings;
import net.clipforge.support.retry.Sleeper;
import net.clipforge.support.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Writes an object to the store as a single object or as ordered parts plus a manifest.
 *
 * <p>Either the whole object becomes retrievable under its logical name, or every part this call
 * wrote is removed again. Parts of one object are written strictly one after another. Rollback is
 * best-effort: a failed delete is logged and published as {@link StorageCleanupFailedEvent} but
 * never masks the upload failure.</p>
 *
 * <p>A part whose upload timed out is checked for existence before being retried. An existing key
 * is accepted as written; that check cannot prove the stored bytes are complete.</p>
 */
@Service
public class ChunkedUploader {

    private static final Logger log = LoggerFactory.getLogger(ChunkedUploader.class);
    private static final String MANIFEST_CONTENT_TYPE = "application/json";

    private final ObjectStore objectStore;
    private final RetryPolicy retryPolicy;
    private final ManifestCodec manifestCodec;
    private final UploadProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Sleeper sleeper;
    private final Clock clock;

    @Autowired
    public ChunkedUploader(ObjectStore objectStore,
                           RetryPolicy retryPolicy,
                           ManifestCodec manifestCodec,
                           UploadProperties properties,
                           ApplicationEventPublisher eventPublisher) {
        this(objectStore, retryPolicy, manifestCodec, properties, eventPublisher, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public ChunkedUploader(ObjectStore objectStore,
                           RetryPolicy retryPolicy,
                           ManifestCodec manifestCodec,
                           UploadProperties properties,
                           ApplicationEventPublisher eventPublisher,
                           Sleeper sleeper,
                           Clock clock) {
        this.objectStore = objectStore;
        this.retryPolicy = retryPolicy;
        this.manifestCodec = manifestCodec;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Stores {@code objectBytes} under {@code ownerId/logicalName}, replacing any earlier version.
     *
     * @throws ChunkUploadFailedException when a part or the manifest cannot be written; partial state is already removed
     */
    public StoredObjectReference upload(byte[] objectBytes,
                                        String ownerId,
                                        String logicalName,
                                        String filename,
                                        String contentType) {
        if (objectBytes == null || objectBytes.length == 0) {
            throw new IllegalArgumentException("Cannot upload an empty object");
        }
        StorageKeyLayout layout = StorageKeyLayout.of(ownerId, logicalName, filename);
        long partSize = properties.getPartSize().toBytes();
        int totalChunks = ChunkPlanner.totalChunks(objectBytes.length, partSize);

        removePreviousVersion(layout);

        if (totalChunks == 1) {
            return uploadDirect(objectBytes, layout, contentType);
        }
        return uploadChunked(objectBytes, layout, contentType, partSize, totalChunks);
    }

    /**
     * Deletes every object stored under {@code ownerId/logicalName}.
     *
     * @return number of keys removed
     */
    public int deleteLogicalObject(String ownerId, String logicalName) {
        StorageKeyLayout layout = StorageKeyLayout.of(ownerId, logicalName, "placeholder");
        List<String> keys = objectStore.list(layout.logicalPrefix());
        int removed = 0;
        for (String key : keys) {
            if (deleteQuietly(layout, key, CleanupPhase.DELETE)) {
                removed++;
            }
        }
        log.info("Deleted {}/{} object(s) under {}", removed, keys.size(), layout.logicalPrefix());
        return removed;
    }

    private StoredObjectReference uploadDirect(byte[] objectBytes, StorageKeyLayout layout, String contentType) {
        String key = layout.directKey();
        try {
            writeWithRetry("upload " + key, key, objectBytes, contentType);
        } catch (RuntimeException failure) {
            log.error("Single-part upload of {} failed: {}", key, failure.getMessage());
            throw new ChunkUploadFailedException(layout.ownerId(), layout.logicalName(), 0, failure);
        }
        log.info("Uploaded {} ({} bytes) as a single object", key, objectBytes.length);
        return new StoredObjectReference(StoredObjectReference.Kind.DIRECT, key, serveUrl(key), objectBytes.length, 1);
    }

    private StoredObjectReference uploadChunked(byte[] objectBytes,
                                                StorageKeyLayout layout,
                                                String contentType,
                                                long partSize,
                                                int totalChunks) {
        UploadSession session = new UploadSession(layout);
        log.info("Starting chunked upload {} of {} ({} bytes in {} parts)",
            session.uploadId(), layout.logicalPrefix(), objectBytes.length, totalChunks);

        for (int index = 0; index < totalChunks; index++) {
            ChunkPlanner.ByteRange range = ChunkPlanner.rangeOf(index, objectBytes.length, partSize);
            byte[] part = Arrays.copyOfRange(objectBytes, (int) range.start(), (int) range.end());
            String key = layout.chunkKey(index);
            try {
                writeWithRetry("upload part " + (index + 1) + "/" + totalChunks + " of " + layout.logicalPrefix(),
                    key, part, contentType);
            } catch (RuntimeException failure) {
                log.error("Part {}/{} of {} failed after retries; rolling back {} uploaded part(s)",
                    index + 1, totalChunks, layout.logicalPrefix(), session.successfulCount());
                rollback(session, List.of(key));
                throw new ChunkUploadFailedException(layout.ownerId(), layout.logicalName(), index, failure);
            }
            session.recordUploaded(new ManifestChunk(index, key, part.length));
            log.debug("Uploaded part {}/{} ({} bytes) to {}", index + 1, totalChunks, part.length, key);

            if (index < totalChunks - 1) {
                pauseBetweenParts(session);
            }
        }

        Manifest manifest = Manifest.create(
            layout.fileName(), partSize, objectBytes.length, session.uploadedChunks(), clock.instant());
        String manifestKey = layout.manifestKey();
        try {
            writeWithRetry("write manifest " + manifestKey, manifestKey, manifestCodec.encode(manifest), MANIFEST_CONTENT_TYPE);
        } catch (RuntimeException failure) {
            log.error("Manifest write for {} failed; rolling back {} part(s)", layout.logicalPrefix(), session.successfulCount());
            rollback(session, List.of(manifestKey));
            throw new ChunkUploadFailedException(
                layout.ownerId(), layout.logicalName(), ChunkUploadFailedException.MANIFEST_PART_INDEX, failure);
        }

        log.info("Completed chunked upload {}: {} parts, manifest {}", session.uploadId(), totalChunks, manifestKey);
        return new StoredObjectReference(
            StoredObjectReference.Kind.CHUNKED, manifestKey, serveUrl(manifestKey), objectBytes.length, totalChunks);
    }

    private void writeWithRetry(String label, String key, byte[] bytes, String contentType) {
        RetrySettings settings = properties.partRetrySettings();
        retryPolicy.execute(label, settings, StorageErrorClassifier.INSTANCE,
            () -> {
                objectStore.put(key, bytes, contentType);
                return key;
            },
            () -> objectStore.exists(key) ? Optional.of(key) : Optional.empty());
    }

    private void pauseBetweenParts(UploadSession session) {
        Duration delay = properties.getInterPartDelay();
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            StorageKeyLayout layout = session.layout();
            rollback(session, List.of());
            throw new ChunkUploadFailedException(
                layout.ownerId(), layout.logicalName(), session.successfulCount(), interruptedException);
        }
    }

    private void removePreviousVersion(StorageKeyLayout layout) {
        List<String> existing;
        try {
            existing = objectStore.list(layout.logicalPrefix());
        } catch (RuntimeException failure) {
            log.warn("Could not list previous version under {}: {}", layout.logicalPrefix(), failure.getMessage());
            publishCleanupFailure(layout, CleanupPhase.OVERWRITE, layout.logicalPrefix(), failure);
            return;
        }
        if (!existing.isEmpty()) {
            log.info("Removing {} object(s) of the previous version under {}", existing.size(), layout.logicalPrefix());
        }
        for (String key : existing) {
            deleteQuietly(layout, key, CleanupPhase.OVERWRITE);
        }
    }

    private void rollback(UploadSession session, List<String> extraKeys) {
        List<String> keys = new ArrayList<>(session.uploadedKeys());
        keys.addAll(extraKeys);
        for (String key : keys) {
            deleteQuietly(session.layout(), key, CleanupPhase.ROLLBACK);
        }
    }

    private boolean deleteQuietly(StorageKeyLayout layout, String key, CleanupPhase phase) {
        try {
            objectStore.delete(key);
            return true;
        } catch (RuntimeException failure) {
            log.warn("Failed to delete {} during {} cleanup: {}", key, phase, failure.getMessage());
            publishCleanupFailure(layout, phase, key, failure);
            return false;
        }
    }

    private void publishCleanupFailure(StorageKeyLayout layout, CleanupPhase phase, String key, RuntimeException failure) {
        eventPublisher.publishEvent(new StorageCleanupFailedEvent(
            layout.ownerId(), layout.logicalName(), phase, key, String.valueOf(failure.getMessage()), clock.instant()));
    }

    private String serveUrl(String key) {
        return properties.getServePath() + "?key=" + URLEncoder.encode(key, StandardCharsets.UTF_8);
    }
}
