package net.clipforge.application.upload;

import java.util.Comparator;
import java.util.List;
import net.clipforge.config.UploadProperties;
import net.clipforge.exception.ChunkNotFoundException;
import net.clipforge.exception.ManifestNotFoundException;
import net.clipforge.exception.SizeMismatchException;
import net.clipforge.support.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Reads stored objects back, reassembling chunked ones from their manifest.
 *
 * <p>Parts are fetched concurrently on the bounded-elastic scheduler and concatenated by index,
 * so completion order does not matter.</p>
 */
@Service
public class ManifestReconstructor {

    private static final Logger log = LoggerFactory.getLogger(ManifestReconstructor.class);

    private final ObjectStore objectStore;
    private final ManifestCodec manifestCodec;
    private final UploadProperties properties;

    public ManifestReconstructor(ObjectStore objectStore, ManifestCodec manifestCodec, UploadProperties properties) {
        this.objectStore = objectStore;
        this.manifestCodec = manifestCodec;
        this.properties = properties;
    }

    /**
     * Resolves a key returned by an upload: manifests are reassembled, other keys are read directly.
     *
     * @throws ManifestNotFoundException when nothing is stored under {@code key}
     */
    public ReconstructedObject open(String key) {
        if (StorageKeyLayout.isManifestKey(key)) {
            return reconstruct(key);
        }
        byte[] bytes = objectStore.get(key).orElseThrow(() -> new ManifestNotFoundException(key));
        return ReconstructedObject.direct(bytes);
    }

    public ReconstructedObject open(StoredObjectReference reference) {
        return reference.isChunked() ? reconstruct(reference.key()) : open(reference.key());
    }

    public ReconstructedObject reconstruct(String manifestKey) {
        byte[] manifestPayload = objectStore.get(manifestKey)
            .orElseThrow(() -> new ManifestNotFoundException(manifestKey));
        Manifest manifest = manifestCodec.decode(manifestKey, manifestPayload);
        log.debug("Reconstructing {} from {} part(s)", manifest.originalName(), manifest.totalChunks());

        List<FetchedChunk> fetched = Flux.fromIterable(manifest.chunks())
            .flatMap(chunk -> Mono.fromCallable(() -> fetchChunk(chunk))
                    .subscribeOn(Schedulers.boundedElastic()),
                Math.max(1, properties.getFetchConcurrency()))
            .collectSortedList(Comparator.comparingInt(FetchedChunk::sequenceIndex))
            .block();

        byte[] assembled = concatenate(fetched);
        boolean sizeMismatch = assembled.length != manifest.totalSizeBytes();
        if (sizeMismatch) {
            if (properties.isStrictSizeCheck()) {
                throw new SizeMismatchException(manifestKey, manifest.totalSizeBytes(), assembled.length);
            }
            log.warn("Reconstructed {} has {} bytes but its manifest records {}",
                manifestKey, assembled.length, manifest.totalSizeBytes());
        }
        return new ReconstructedObject(assembled, manifest, sizeMismatch);
    }

    private FetchedChunk fetchChunk(ManifestChunk chunk) {
        byte[] bytes = objectStore.get(chunk.storageKey())
            .orElseThrow(() -> new ChunkNotFoundException(chunk.sequenceIndex(), chunk.storageKey()));
        return new FetchedChunk(chunk.sequenceIndex(), bytes);
    }

    private static byte[] concatenate(List<FetchedChunk> chunks) {
        long total = 0L;
        for (FetchedChunk chunk : chunks) {
            total += chunk.bytes().length;
        }
        if (total > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("Reconstructed object of " + total + " bytes does not fit in memory");
        }
        byte[] assembled = new byte[(int) total];
        int offset = 0;
        for (FetchedChunk chunk : chunks) {
            System.arraycopy(chunk.bytes(), 0, assembled, offset, chunk.bytes().length);
            offset += chunk.bytes().length;
        }
        return assembled;
    }

    private record FetchedChunk(int sequenceIndex, byte[] bytes) {
    }
}
