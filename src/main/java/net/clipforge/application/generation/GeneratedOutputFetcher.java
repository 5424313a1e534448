package net.clipforge.application.generation;

import java.util.concurrent.TimeoutException;
import net.clipforge.config.GenerationProperties;
import net.clipforge.exception.GenerationServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Downloads a generated output from the URL reported by the generation service.
 */
@Component
public class GeneratedOutputFetcher {

    private static final Logger log = LoggerFactory.getLogger(GeneratedOutputFetcher.class);

    private final WebClient webClient;
    private final GenerationProperties properties;

    public GeneratedOutputFetcher(WebClient.Builder webClientBuilder, GenerationProperties properties) {
        int maxBytes = (int) Math.min(Integer.MAX_VALUE, properties.getMaxDownloadSize().toBytes());
        this.webClient = webClientBuilder.clone()
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxBytes))
                .build())
            .build();
        this.properties = properties;
    }

    public byte[] fetch(String outputUrl) {
        byte[] bytes = webClient.get()
            .uri(outputUrl)
            .retrieve()
            .bodyToMono(byte[].class)
            .timeout(properties.getDownloadTimeout())
            .onErrorMap(TimeoutException.class, e -> new GenerationServiceException(
                "Download of generated output timed out after " + properties.getDownloadTimeout().toSeconds() + "s", e))
            .onErrorMap(WebClientResponseException.class, e -> new GenerationServiceException(
                "Download of generated output failed with HTTP " + e.getStatusCode().value(), e.getStatusCode().value(), e))
            .onErrorMap(WebClientException.class, e -> new GenerationServiceException(
                "Download of generated output failed: " + e.getMessage(), e))
            .switchIfEmpty(Mono.error(() -> new GenerationServiceException("Generated output was empty", null)))
            .block();
        log.info("Downloaded generated output ({} bytes)", bytes.length);
        return bytes;
    }
}
