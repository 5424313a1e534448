package net.clipforge.controller;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.clipforge.controller.support.ErrorResponseUtils;
import net.clipforge.exception.ChunkNotFoundException;
import net.clipforge.exception.ChunkUploadFailedException;
import net.clipforge.exception.ClipForgeException;
import net.clipforge.exception.InsufficientResourceException;
import net.clipforge.exception.ManifestNotFoundException;
import net.clipforge.exception.RateLimitExceededException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Maps upload and generation failures onto HTTP responses.
 *
 * <p>Only resource exhaustion, missing objects, throttling and bad input are reported specifically;
 * every other failure gets a generic retry-later answer.</p>
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InsufficientResourceException.class)
    public ResponseEntity<Map<String, String>> handleInsufficientResource(InsufficientResourceException ex) {
        log.warn("Request stopped by insufficient generation credits: {}", ex.getMessage());
        return ErrorResponseUtils.error(HttpStatus.PAYMENT_REQUIRED, "Insufficient credits", InsufficientResourceException.USER_MESSAGE);
    }

    @ExceptionHandler({ManifestNotFoundException.class, ChunkNotFoundException.class})
    public ResponseEntity<Map<String, String>> handleNotFound(ClipForgeException ex) {
        log.info("Stored media not found: {}", ex.getMessage());
        return ErrorResponseUtils.error(HttpStatus.NOT_FOUND, "Media not found", ex.getMessage());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, String>> handleRateLimited(RateLimitExceededException ex) {
        return ErrorResponseUtils.error(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        return ErrorResponseUtils.badRequest("Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleTooLarge(MaxUploadSizeExceededException ex) {
        return ErrorResponseUtils.error(HttpStatus.CONTENT_TOO_LARGE, "Upload too large", ex.getMessage());
    }

    @ExceptionHandler(ChunkUploadFailedException.class)
    public ResponseEntity<Map<String, String>> handleUploadFailed(ChunkUploadFailedException ex) {
        log.error("Upload of {}/{} failed at part {}: {}", ex.getOwnerId(), ex.getLogicalName(), ex.getPartIndex(), ex.getMessage());
        return ErrorResponseUtils.retryLater(HttpStatus.SERVICE_UNAVAILABLE, "Upload failed");
    }

    @ExceptionHandler(ClipForgeException.class)
    public ResponseEntity<Map<String, String>> handleClipForge(ClipForgeException ex) {
        log.error("Request failed ({}): {}", ex.errorCode(), ex.getMessage(), ex);
        return ErrorResponseUtils.retryLater(HttpStatus.BAD_GATEWAY, "Service temporarily unavailable");
    }
}
