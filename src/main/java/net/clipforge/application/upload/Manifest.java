package net.clipforge.application.upload;

import java.time.Instant;
import java.util.List;

/**
 * Describes how to reassemble a chunked object.
 *
 * <p>The canonical constructor enforces the structural invariants (count matches, indices contiguous
 * from zero). {@link #create} additionally requires part lengths to add up to {@code totalSizeBytes};
 * manifests read back from storage are not held to that so drift can be detected at reconstruction.</p>
 */
public record Manifest(String originalName,
                       int totalChunks,
                       long chunkSizeBytes,
                       long totalSizeBytes,
                       List<ManifestChunk> chunks,
                       Instant createdAt) {

    public Manifest {
        if (totalChunks < 1) {
            throw new IllegalArgumentException("totalChunks must be at least 1 but was " + totalChunks);
        }
        chunks = List.copyOf(chunks);
        if (chunks.size() != totalChunks) {
            throw new IllegalArgumentException("Manifest lists " + chunks.size() + " chunks but declares " + totalChunks);
        }
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.get(i).sequenceIndex() != i) {
                throw new IllegalArgumentException("Chunk at position " + i + " has index " + chunks.get(i).sequenceIndex());
            }
        }
    }

    public static Manifest create(String originalName,
                                  long chunkSizeBytes,
                                  long totalSizeBytes,
                                  List<ManifestChunk> chunks,
                                  Instant createdAt) {
        long sum = 0L;
        for (ManifestChunk chunk : chunks) {
            if (chunk.byteLength() <= 0) {
                throw new IllegalArgumentException("Chunk " + chunk.sequenceIndex() + " has no bytes");
            }
            sum += chunk.byteLength();
        }
        if (sum != totalSizeBytes) {
            throw new IllegalArgumentException("Chunk lengths add up to " + sum + " but total size is " + totalSizeBytes);
        }
        return new Manifest(originalName, chunks.size(), chunkSizeBytes, totalSizeBytes, chunks, createdAt);
    }
}
