package net.clipforge.application.upload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import net.clipforge.exception.ManifestCorruptException;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads and writes the JSON manifest document.
 *
 * <p>{@code chunkSizes} is optional on read. Without it, every part but the last is assumed to be
 * {@code chunkSize} long and the last carries the remainder.</p>
 */
@Component
public class ManifestCodec {

    private final ObjectMapper objectMapper;

    public ManifestCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(Manifest manifest) {
        List<String> keys = new ArrayList<>(manifest.totalChunks());
        List<Long> sizes = new ArrayList<>(manifest.totalChunks());
        for (ManifestChunk chunk : manifest.chunks()) {
            keys.add(chunk.storageKey());
            sizes.add(chunk.byteLength());
        }
        ManifestDocument document = new ManifestDocument(
            manifest.originalName(),
            manifest.totalChunks(),
            manifest.chunkSizeBytes(),
            manifest.totalSizeBytes(),
            keys,
            sizes,
            manifest.createdAt().toString()
        );
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document).getBytes(StandardCharsets.UTF_8);
    }

    public Manifest decode(String manifestKey, byte[] payload) {
        ManifestDocument document;
        try {
            document = objectMapper.readValue(payload, ManifestDocument.class);
        } catch (JacksonException exception) {
            throw new ManifestCorruptException(manifestKey, "invalid JSON", exception);
        }
        if (document == null || document.chunks() == null || document.chunks().isEmpty()) {
            throw new ManifestCorruptException(manifestKey, "no chunks listed", null);
        }
        List<String> keys = document.chunks();
        List<Long> sizes = document.chunkSizes();
        if (sizes != null && sizes.size() != keys.size()) {
            throw new ManifestCorruptException(manifestKey,
                "chunkSizes has " + sizes.size() + " entries for " + keys.size() + " chunks", null);
        }
        List<ManifestChunk> chunks = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            long length = sizes != null ? sizes.get(i) : inferredLength(document, i, keys.size());
            chunks.add(new ManifestChunk(i, keys.get(i), length));
        }
        try {
            return new Manifest(
                document.originalFilename(),
                document.totalChunks(),
                document.chunkSize(),
                document.totalSize(),
                chunks,
                parseInstant(document.uploadedAt())
            );
        } catch (IllegalArgumentException | DateTimeParseException exception) {
            throw new ManifestCorruptException(manifestKey, exception.getMessage(), exception);
        }
    }

    private static long inferredLength(ManifestDocument document, int index, int count) {
        if (index < count - 1) {
            return document.chunkSize();
        }
        return document.totalSize() - document.chunkSize() * (count - 1L);
    }

    private static Instant parseInstant(String value) {
        return value == null || value.isBlank() ? Instant.EPOCH : Instant.parse(value);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ManifestDocument(String originalFilename,
                            int totalChunks,
                            long chunkSize,
                            long totalSize,
                            List<String> chunks,
                            List<Long> chunkSizes,
                            String uploadedAt) {
    }
}
