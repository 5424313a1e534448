package net.clipforge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatNoException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import net.clipforge.config.GenerationProperties;
import net.clipforge.exception.RateLimitExceededException;
import net.clipforge.support.ratelimit.CaffeineRequestCounterStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OwnerRequestThrottleTest {

    private final AtomicLong nanos = new AtomicLong();
    private final CaffeineRequestCounterStore counterStore = new CaffeineRequestCounterStore(1_000, nanos::get);
    private final GenerationProperties properties = new GenerationProperties();
    private OwnerRequestThrottle throttle;

    @BeforeEach
    void setUp() {
        properties.getRateLimit().setRequestsPerMinute(2);
        properties.getRateLimit().setRequestsPerHour(3);
        throttle = new OwnerRequestThrottle(counterStore, properties);
    }

    @Test
    void should_RejectThirdRequest_When_MinuteAllowanceIsTwo() {
        throttle.acquire("owner-a");
        throttle.acquire("owner-a");

        assertThatThrownBy(() -> throttle.acquire("owner-a"))
            .isInstanceOf(RateLimitExceededException.class)
            .hasMessageContaining("minute");
        assertThatNoException().isThrownBy(() -> throttle.acquire("owner-b"));
    }

    @Test
    void should_NotCountRejectedRequests_When_WindowIsFull() {
        throttle.acquire("owner-a");
        throttle.acquire("owner-a");
        assertThatThrownBy(() -> throttle.acquire("owner-a")).isInstanceOf(RateLimitExceededException.class);

        assertThat(counterStore.current("owner-a:hour")).isEqualTo(2);
    }

    @Test
    void should_EnforceHourAllowance_When_MinuteWindowRolls() {
        throttle.acquire("owner-a");
        throttle.acquire("owner-a");
        nanos.addAndGet(Duration.ofSeconds(61).toNanos());
        throttle.acquire("owner-a");

        assertThatThrownBy(() -> throttle.acquire("owner-a"))
            .isInstanceOf(RateLimitExceededException.class)
            .hasMessageContaining("hour");
        assertThat(counterStore.current("owner-a:minute")).isEqualTo(1);
        assertThat(counterStore.current("owner-a:hour")).isEqualTo(3);
    }

    @Test
    void should_AdmitExactlyOne_When_ConcurrentRequestsRaceForLastSlot() throws Exception {
        properties.getRateLimit().setRequestsPerMinute(1);
        int callers = 16;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch ready = new CountDownLatch(callers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    start.await();
                    try {
                        throttle.acquire("owner-a");
                        admitted.incrementAndGet();
                    } catch (RateLimitExceededException expected) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(admitted.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(callers - 1);
        assertThat(counterStore.current("owner-a:minute")).isEqualTo(1);
        assertThat(counterStore.current("owner-a:hour")).isEqualTo(1);
    }
}
