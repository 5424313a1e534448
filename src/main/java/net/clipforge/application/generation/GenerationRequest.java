package net.clipforge.application.generation;

/**
 * Image-to-video job parameters sent to the generation service.
 */
public record GenerationRequest(String model,
                                String promptImage,
                                String promptText,
                                String ratio,
                                int durationSeconds) {
}
