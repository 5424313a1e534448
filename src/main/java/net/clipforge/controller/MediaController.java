package net.clipforge.controller;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import net.clipforge.application.upload.ChunkedUploader;
import net.clipforge.application.upload.ManifestReconstructor;
import net.clipforge.application.upload.ReconstructedObject;
import net.clipforge.application.upload.StoredObjectReference;
import net.clipforge.config.UploadProperties;
import net.clipforge.support.storage.ObjectStore;
import net.clipforge.support.storage.SignedUrlIntent;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * Upload, serve, sign and delete stored media.
 */
@RestController
@RequestMapping("/api/media")
@Slf4j
public class MediaController {

    private static final String DEFAULT_VIDEO_TYPE = "video/mp4";

    private final ChunkedUploader uploader;
    private final ManifestReconstructor reconstructor;
    private final ObjectStore objectStore;
    private final UploadProperties uploadProperties;

    public MediaController(ChunkedUploader uploader,
                           ManifestReconstructor reconstructor,
                           ObjectStore objectStore,
                           UploadProperties uploadProperties) {
        this.uploader = uploader;
        this.reconstructor = reconstructor;
        this.objectStore = objectStore;
        this.uploadProperties = uploadProperties;
    }

    @PostMapping(path = "/videos", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> uploadVideo(@RequestParam("video") MultipartFile video,
                                                      @RequestParam String ownerId,
                                                      @RequestParam String logicalName,
                                                      @RequestParam(required = false) String filename) {
        if (video.isEmpty()) {
            throw new IllegalArgumentException("No video file provided");
        }
        String effectiveFilename = filename != null && !filename.isBlank()
            ? filename
            : (video.getOriginalFilename() != null ? video.getOriginalFilename() : logicalName + ".mp4");
        String contentType = video.getContentType() != null ? video.getContentType() : DEFAULT_VIDEO_TYPE;
        byte[] bytes;
        try {
            bytes = video.getBytes();
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Could not read uploaded file", ex);
        }
        log.info("Upload request for {}/{} ({} bytes)", ownerId, logicalName, bytes.length);
        StoredObjectReference reference = uploader.upload(bytes, ownerId, logicalName, effectiveFilename, contentType);
        return ResponseEntity.ok(UploadResponse.from(reference));
    }

    /**
     * Streams a stored object; manifest keys are reassembled from their parts.
     */
    @GetMapping("/stream")
    public ResponseEntity<Resource> stream(@RequestParam String key,
                                           @RequestParam(defaultValue = "false") boolean download) {
        ReconstructedObject object = reconstructor.open(key);
        String fileName = object.manifest() != null ? object.manifest().originalName() : fileNameOf(key);
        MediaType mediaType = MediaTypeFactory.getMediaType(fileName)
            .orElse(MediaType.parseMediaType(DEFAULT_VIDEO_TYPE));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(mediaType);
        headers.setContentLength(object.length());
        headers.set(HttpHeaders.ACCEPT_RANGES, "bytes");
        headers.setCacheControl("public, max-age=3600");
        if (download) {
            headers.setContentDisposition(ContentDisposition.attachment().filename(fileName).build());
        }
        return ResponseEntity.ok().headers(headers).body(new ByteArrayResource(object.bytes()));
    }

    @GetMapping("/signed-url")
    public ResponseEntity<SignedUrlResponse> signedUrl(@RequestParam String key,
                                                       @RequestParam(required = false) Long ttlSeconds,
                                                       @RequestParam(defaultValue = "READ") SignedUrlIntent intent) {
        Duration ttl = ttlSeconds != null ? Duration.ofSeconds(ttlSeconds) : uploadProperties.getSignedUrlTtl();
        if (ttl.isNegative() || ttl.isZero() || ttl.compareTo(uploadProperties.getMaxSignedUrlTtl()) > 0) {
            throw new IllegalArgumentException("ttlSeconds must be between 1 and " + uploadProperties.getMaxSignedUrlTtl().toSeconds());
        }
        if (!objectStore.exists(key)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No object stored under " + key);
        }
        String url = objectStore.signedUrl(key, ttl, intent);
        return ResponseEntity.ok(new SignedUrlResponse(url, Instant.now().plus(ttl)));
    }

    @DeleteMapping
    public ResponseEntity<DeleteResponse> delete(@RequestParam String ownerId, @RequestParam String logicalName) {
        int removed = uploader.deleteLogicalObject(ownerId, logicalName);
        return ResponseEntity.ok(new DeleteResponse(ownerId, logicalName, removed));
    }

    private static String fileNameOf(String key) {
        int slash = key.lastIndexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }

    public record UploadResponse(String kind, String key, String url, long size, boolean chunked, int partCount) {

        static UploadResponse from(StoredObjectReference reference) {
            return new UploadResponse(reference.kind().name(), reference.key(), reference.url(),
                reference.sizeBytes(), reference.isChunked(), reference.partCount());
        }
    }

    public record SignedUrlResponse(String url, Instant expiresAt) {
    }

    public record DeleteResponse(String ownerId, String logicalName, int removed) {
    }
}
