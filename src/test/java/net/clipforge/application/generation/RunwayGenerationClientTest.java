package net.clipforge.application.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.resilience4j.ratelimiter.RateLimiter;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import net.clipforge.config.GenerationProperties;
import net.clipforge.exception.GenerationServiceException;
import net.clipforge.exception.InsufficientResourceException;
import net.clipforge.testsupport.UploadFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class RunwayGenerationClientTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private final GenerationProperties properties = new GenerationProperties();

    private RunwayGenerationClient clientReplying(HttpStatus status, String body) {
        properties.setApiKey("secret-key");
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(body)
                .build());
        });
        return new RunwayGenerationClient(builder, properties, RateLimiter.ofDefaults("test"), UploadFixtures.FIXED_CLOCK);
    }

    @Test
    void should_PostToImageToVideo_When_Submitting() {
        RunwayGenerationClient client = clientReplying(HttpStatus.OK, "{\"id\":\"task-123\"}");

        String jobId = client.submit(ClipPromptPolicy.requestFor("https://img/1.png", "calm sea", "16:9"));

        assertThat(jobId).isEqualTo("task-123");
        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo("https://api.dev.runwayml.com/v1/image_to_video");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret-key");
        assertThat(request.headers().getFirst("X-Runway-Version")).isEqualTo("2024-11-06");
    }

    @Test
    void should_ReadFirstOutput_When_TaskSucceeded() {
        RunwayGenerationClient client = clientReplying(HttpStatus.OK, """
            {"id":"task-123","status":"SUCCEEDED","createdAt":"2025-02-01T10:00:00Z",
             "output":["https://cdn.runway/clip.mp4","https://cdn.runway/alt.mp4"]}
            """);

        GenerationTask task = client.getStatus("task-123");

        assertThat(requests.get(0).url().getPath()).isEqualTo("/v1/tasks/task-123");
        assertThat(task.status()).isEqualTo(GenerationStatus.SUCCEEDED);
        assertThat(task.outputReference()).contains("https://cdn.runway/clip.mp4");
        assertThat(task.submittedAt()).isEqualTo(Instant.parse("2025-02-01T10:00:00Z"));
    }

    @Test
    void should_TreatUnknownStatusAsPending_When_TaskStillRunning() {
        RunwayGenerationClient client = clientReplying(HttpStatus.OK, "{\"id\":\"t\",\"status\":\"THROTTLED\"}");

        GenerationTask task = client.getStatus("t");

        assertThat(task.status()).isEqualTo(GenerationStatus.PENDING);
        assertThat(task.outputReference()).isEmpty();
        assertThat(task.submittedAt()).isEqualTo(UploadFixtures.FIXED_CLOCK.instant());
    }

    @Test
    void should_ReportFailureReason_When_TaskFailed() {
        RunwayGenerationClient client = clientReplying(HttpStatus.OK,
            "{\"id\":\"t\",\"status\":\"FAILED\",\"failure\":\"content moderation\"}");

        GenerationTask task = client.getStatus("t");

        assertThat(task.status()).isEqualTo(GenerationStatus.FAILED);
        assertThat(task.failureReason()).isEqualTo("content moderation");
    }

    @Test
    void should_RaiseInsufficientResource_When_ServiceReportsMissingCredits() {
        RunwayGenerationClient client = clientReplying(HttpStatus.BAD_REQUEST,
            "{\"error\":\"You do not have enough credits to run this task.\"}");

        assertThatThrownBy(() -> client.submit(ClipPromptPolicy.requestFor("https://img/1.png", "p", "16:9")))
            .isInstanceOf(InsufficientResourceException.class);
    }

    @Test
    void should_RaiseTransientError_When_ServiceReturnsServerError() {
        RunwayGenerationClient client = clientReplying(HttpStatus.BAD_GATEWAY, "{\"error\":\"upstream\"}");

        assertThatThrownBy(() -> client.getStatus("t"))
            .isInstanceOf(GenerationServiceException.class)
            .satisfies(error -> assertThat(((GenerationServiceException) error).getStatusCode()).isEqualTo(502));
    }

    @Test
    void should_RefuseCalls_When_ApiKeyMissing() {
        RunwayGenerationClient client = clientReplying(HttpStatus.OK, "{}");
        properties.setApiKey(" ");

        assertThat(client.isAvailable()).isFalse();
        assertThatThrownBy(() -> client.getStatus("t")).isInstanceOf(IllegalStateException.class);
        assertThat(requests).isEmpty();
    }
}
