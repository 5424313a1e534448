package net.clipforge.application.generation;

/**
 * Remote asynchronous generation service.
 *
 * <p>Implementations raise {@link net.clipforge.exception.InsufficientResourceException} when the
 * account is out of credits and {@link net.clipforge.exception.GenerationServiceException} for
 * any other HTTP or network failure.</p>
 */
public interface GenerationServiceClient {

    /**
     * Starts a job and returns its id. Not retried by callers.
     */
    String submit(GenerationRequest request);

    GenerationTask getStatus(String jobId);

    /**
     * Indicates if the client has the configuration it needs to reach the service.
     */
    default boolean isAvailable() {
        return true;
    }
}
