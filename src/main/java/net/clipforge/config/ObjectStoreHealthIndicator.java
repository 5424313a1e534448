package net.clipforge.config;

import net.clipforge.support.storage.ObjectStore;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

@Component("objectStoreHealthIndicator")
public class ObjectStoreHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration STORE_TIMEOUT = Duration.ofSeconds(5);

    private final ObjectStore objectStore;

    public ObjectStoreHealthIndicator(ObjectStore objectStore) {
        this.objectStore = objectStore;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(() -> {
                    objectStore.verifyReachable();
                    return Health.up()
                            .withDetail("store_status", "available")
                            .withDetail("store", objectStore.describe())
                            .build();
                })
                .timeout(STORE_TIMEOUT)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(TimeoutException.class, ex -> Mono.just(Health.down()
                        .withDetail("store_status", "timeout")
                        .withDetail("store", objectStore.describe())
                        .withDetail("message", ex.getMessage())
                        .build()))
                .onErrorResume(Throwable.class, ex -> Mono.just(Health.down()
                        .withDetail("store_status", "unavailable")
                        .withDetail("store", objectStore.describe())
                        .withDetail("error", ex.getClass().getName())
                        .withDetail("message", String.valueOf(ex.getMessage()))
                        .build()));
    }
}
