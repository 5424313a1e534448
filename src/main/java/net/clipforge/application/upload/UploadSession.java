package net.clipforge.application.upload;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Tracks the parts written by one upload call so they can be rolled back. Not shared between calls.
 */
final class UploadSession {

    private final String uploadId = UUID.randomUUID().toString();
    private final StorageKeyLayout layout;
    private final List<ManifestChunk> uploadedChunks = new ArrayList<>();

    UploadSession(StorageKeyLayout layout) {
        this.layout = layout;
    }

    String uploadId() {
        return uploadId;
    }

    StorageKeyLayout layout() {
        return layout;
    }

    void recordUploaded(ManifestChunk chunk) {
        uploadedChunks.add(chunk);
    }

    int successfulCount() {
        return uploadedChunks.size();
    }

    List<ManifestChunk> uploadedChunks() {
        return Collections.unmodifiableList(uploadedChunks);
    }

    List<String> uploadedKeys() {
        return uploadedChunks.stream().map(ManifestChunk::storageKey).toList();
    }
}
