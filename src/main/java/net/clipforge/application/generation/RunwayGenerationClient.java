package net.clipforge.application.generation;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import net.clipforge.config.GenerationProperties;
import net.clipforge.exception.GenerationServiceException;
import net.clipforge.exception.InsufficientResourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * {@link GenerationServiceClient} for the Runway image-to-video API.
 *
 * <p>Submissions pass through an outbound rate limiter that waits for a permit. HTTP failures are
 * translated at the edge: a credit exhaustion message becomes
 * {@link InsufficientResourceException}, anything else becomes {@link GenerationServiceException}.</p>
 */
@Component
public class RunwayGenerationClient implements GenerationServiceClient {

    private static final Logger log = LoggerFactory.getLogger(RunwayGenerationClient.class);
    private static final String VERSION_HEADER = "X-Runway-Version";

    private final WebClient webClient;
    private final GenerationProperties properties;
    private final RateLimiter submitRateLimiter;
    private final Clock clock;

    @Autowired
    public RunwayGenerationClient(WebClient.Builder webClientBuilder,
                                  GenerationProperties properties,
                                  @Qualifier("generationSubmitRateLimiter") RateLimiter submitRateLimiter) {
        this(webClientBuilder, properties, submitRateLimiter, Clock.systemUTC());
    }

    public RunwayGenerationClient(WebClient.Builder webClientBuilder,
                                  GenerationProperties properties,
                                  RateLimiter submitRateLimiter,
                                  Clock clock) {
        this.webClient = webClientBuilder.clone()
            .baseUrl(properties.getBaseUrl())
            .defaultHeader(VERSION_HEADER, properties.getApiVersion())
            .build();
        this.properties = properties;
        this.submitRateLimiter = submitRateLimiter;
        this.clock = clock;
    }

    @Override
    public String submit(GenerationRequest request) {
        ensureConfigured();
        acquireSubmitPermit();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.model());
        body.put("promptImage", request.promptImage());
        body.put("promptText", request.promptText());
        body.put("ratio", request.ratio());
        body.put("duration", request.durationSeconds());

        JsonNode response = exchange("submit",
            webClient.post()
                .uri("/v1/image_to_video")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve());

        String jobId = text(response.path("id"));
        if (jobId == null) {
            throw new GenerationServiceException("Generation service accepted the request but returned no task id", null);
        }
        log.info("Submitted generation job {} (model={}, ratio={})", jobId, request.model(), request.ratio());
        return jobId;
    }

    @Override
    public GenerationTask getStatus(String jobId) {
        ensureConfigured();
        JsonNode response = exchange("status of " + jobId,
            webClient.get()
                .uri("/v1/tasks/{id}", jobId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .retrieve());

        GenerationStatus status = GenerationStatus.fromRemote(text(response.path("status")));
        String output = text(response.path("output").path(0));
        String failure = text(response.path("failure"));
        return new GenerationTask(jobId, parseCreatedAt(text(response.path("createdAt"))), status, output, failure);
    }

    @Override
    public boolean isAvailable() {
        return properties.hasApiKey();
    }

    private JsonNode exchange(String operation, WebClient.ResponseSpec responseSpec) {
        JsonNode body = responseSpec
            .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(errorBody -> translateErrorResponse(operation, response.statusCode().value(), errorBody)))
            .bodyToMono(JsonNode.class)
            .timeout(properties.getRequestTimeout())
            .onErrorMap(TimeoutException.class, e -> new GenerationServiceException(
                "Generation " + operation + " timed out after " + properties.getRequestTimeout().toSeconds() + "s", e))
            .onErrorMap(WebClientRequestException.class, e -> new GenerationServiceException(
                "Generation " + operation + " could not reach the service: " + e.getMessage(), e))
            .onErrorMap(WebClientResponseException.class, e -> translateErrorResponse(
                operation, e.getStatusCode().value(), e.getResponseBodyAsString()))
            .switchIfEmpty(Mono.error(() -> new GenerationServiceException(
                "Generation " + operation + " returned an empty body", null)))
            .block();
        return body;
    }

    private RuntimeException translateErrorResponse(String operation, int statusCode, String errorBody) {
        if (GenerationErrorClassifier.indicatesInsufficientCredits(errorBody)) {
            log.error("Generation {} rejected: account has insufficient credits", operation);
            return new InsufficientResourceException(errorBody);
        }
        log.warn("Generation {} failed with HTTP {}: {}", operation, statusCode, errorBody);
        return new GenerationServiceException(
            "Generation " + operation + " failed with HTTP " + statusCode + ": " + errorBody, statusCode, null);
    }

    private void acquireSubmitPermit() {
        try {
            RateLimiter.waitForPermission(submitRateLimiter);
        } catch (RequestNotPermitted exception) {
            throw new GenerationServiceException("Outbound submission quota is exhausted; try again shortly", exception);
        }
    }

    private void ensureConfigured() {
        if (!properties.hasApiKey()) {
            throw new IllegalStateException("Generation API key is not configured (RUNWAYML_API_SECRET)");
        }
    }

    private Instant parseCreatedAt(String value) {
        if (value == null) {
            return clock.instant();
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException exception) {
            log.debug("Unparseable createdAt '{}' from generation service", value);
            return clock.instant();
        }
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asString();
        return value == null || value.isBlank() ? null : value;
    }
}
