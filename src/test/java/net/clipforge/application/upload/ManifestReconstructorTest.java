package net.clipforge.application.upload;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import net.clipforge.config.UploadProperties;
import net.clipforge.exception.ChunkNotFoundException;
import net.clipforge.exception.ManifestCorruptException;
import net.clipforge.exception.ManifestNotFoundException;
import net.clipforge.exception.SizeMismatchException;
import net.clipforge.support.storage.InMemoryObjectStore;
import net.clipforge.testsupport.UploadFixtures;
import org.junit.jupiter.api.Test;

class ManifestReconstructorTest {

    private final InMemoryObjectStore store = new InMemoryObjectStore();
    private final UploadProperties properties = UploadFixtures.properties(10);

    private StoredObjectReference uploadParts(int length) {
        return UploadFixtures.uploader(store, properties, event -> { })
            .upload(UploadFixtures.patternedBytes(length), "owner", "logical", "clip.mp4", "video/mp4");
    }

    @Test
    void should_ThrowManifestNotFound_When_ManifestMissing() {
        ManifestReconstructor reconstructor = UploadFixtures.reconstructor(store, properties);

        assertThatThrownBy(() -> reconstructor.reconstruct("owner/logical/manifests/clip_manifest.json"))
            .isInstanceOf(ManifestNotFoundException.class);
    }

    @Test
    void should_ReportMissingIndex_When_PartDeleted() {
        StoredObjectReference reference = uploadParts(35);
        store.delete("owner/logical/chunks/clip_chunk_002.mp4");

        assertThatThrownBy(() -> UploadFixtures.reconstructor(store, properties).open(reference))
            .isInstanceOf(ChunkNotFoundException.class)
            .satisfies(error -> assertThat(((ChunkNotFoundException) error).getSequenceIndex()).isEqualTo(2));
    }

    @Test
    void should_ReturnBytesWithMismatchFlag_When_SizeDriftsInLenientMode() {
        StoredObjectReference reference = uploadParts(35);
        store.put("owner/logical/chunks/clip_chunk_003.mp4", new byte[] {1, 2}, "video/mp4");

        ReconstructedObject restored = UploadFixtures.reconstructor(store, properties).open(reference);

        assertThat(restored.sizeMismatch()).isTrue();
        assertThat(restored.length()).isEqualTo(32);
    }

    @Test
    void should_ThrowSizeMismatch_When_SizeDriftsInStrictMode() {
        StoredObjectReference reference = uploadParts(35);
        store.put("owner/logical/chunks/clip_chunk_003.mp4", new byte[] {1, 2}, "video/mp4");
        properties.setStrictSizeCheck(true);

        assertThatThrownBy(() -> UploadFixtures.reconstructor(store, properties).open(reference))
            .isInstanceOf(SizeMismatchException.class)
            .satisfies(error -> {
                SizeMismatchException mismatch = (SizeMismatchException) error;
                assertThat(mismatch.getExpectedBytes()).isEqualTo(35);
                assertThat(mismatch.getActualBytes()).isEqualTo(32);
            });
    }

    @Test
    void should_ReassembleInIndexOrder_When_ManifestLacksChunkSizes() {
        store.put("o/l/chunks/a_chunk_000.mp4", "hello ".getBytes(StandardCharsets.UTF_8), "video/mp4");
        store.put("o/l/chunks/a_chunk_001.mp4", "world".getBytes(StandardCharsets.UTF_8), "video/mp4");
        String legacyManifest = """
            {
              "originalFilename": "a.mp4",
              "totalChunks": 2,
              "chunkSize": 6,
              "totalSize": 11,
              "chunks": ["o/l/chunks/a_chunk_000.mp4", "o/l/chunks/a_chunk_001.mp4"],
              "uploadedAt": "2025-01-01T00:00:00Z"
            }
            """;
        store.put("o/l/manifests/a_manifest.json", legacyManifest.getBytes(StandardCharsets.UTF_8), "application/json");

        ReconstructedObject restored = UploadFixtures.reconstructor(store, properties).open("o/l/manifests/a_manifest.json");

        assertThat(new String(restored.bytes(), StandardCharsets.UTF_8)).isEqualTo("hello world");
        assertThat(restored.manifest().chunks()).extracting(ManifestChunk::byteLength).containsExactly(6L, 5L);
        assertThat(restored.sizeMismatch()).isFalse();
    }

    @Test
    void should_ThrowCorrupt_When_ManifestIsNotJson() {
        store.put("o/l/manifests/a_manifest.json", "not json".getBytes(StandardCharsets.UTF_8), "application/json");

        assertThatThrownBy(() -> UploadFixtures.reconstructor(store, properties).open("o/l/manifests/a_manifest.json"))
            .isInstanceOf(ManifestCorruptException.class);
    }

    @Test
    void should_ReadDirectly_When_KeyIsNotManifest() {
        store.put("o/l/clip.mp4", new byte[] {9, 8, 7}, "video/mp4");

        ReconstructedObject restored = UploadFixtures.reconstructor(store, properties).open("o/l/clip.mp4");

        assertThat(restored.bytes()).containsExactly(9, 8, 7);
        assertThat(restored.manifest()).isNull();
    }
}
