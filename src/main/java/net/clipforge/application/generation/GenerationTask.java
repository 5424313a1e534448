package net.clipforge.application.generation;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Optional;

/**
 * Last observed state of a remote generation job.
 */
public record GenerationTask(String id,
                             Instant submittedAt,
                             GenerationStatus status,
                             @Nullable String outputRef,
                             @Nullable String failureReason) {

    public Optional<String> outputReference() {
        return Optional.ofNullable(outputRef).filter(ref -> !ref.isBlank());
    }
}
