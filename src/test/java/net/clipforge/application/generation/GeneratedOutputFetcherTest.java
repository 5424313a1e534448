package net.clipforge.application.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import net.clipforge.config.GenerationProperties;
import net.clipforge.exception.GenerationServiceException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

class GeneratedOutputFetcherTest {

    private final GenerationProperties properties = new GenerationProperties();

    private GeneratedOutputFetcher fetcherReplying(HttpStatus status, byte[] body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> Mono.just(
            ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "video/mp4")
                .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(body)))
                .build()));
        return new GeneratedOutputFetcher(builder, properties);
    }

    @Test
    void should_ReturnBody_When_DownloadSucceeds() {
        byte[] clip = {0, 0, 0, 24, 102, 116, 121, 112};

        assertThat(fetcherReplying(HttpStatus.OK, clip).fetch("https://cdn.example.com/a.mp4")).isEqualTo(clip);
    }

    @Test
    void should_RaiseTransientError_When_DownloadReturnsNotFound() {
        GeneratedOutputFetcher fetcher = fetcherReplying(HttpStatus.NOT_FOUND, new byte[] {1});

        assertThatThrownBy(() -> fetcher.fetch("https://cdn.example.com/missing.mp4"))
            .isInstanceOf(GenerationServiceException.class)
            .satisfies(error -> assertThat(((GenerationServiceException) error).getStatusCode()).isEqualTo(404));
    }
}
