package net.clipforge.support.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link RequestCounterStore} backed by a Caffeine cache with per-entry expiry equal to the
 * window length, so idle keys do not accumulate.
 */
public class CaffeineRequestCounterStore implements RequestCounterStore {

    private final Cache<String, WindowCounter> counters;

    public CaffeineRequestCounterStore(long maximumKeys) {
        this(maximumKeys, Ticker.systemTicker());
    }

    public CaffeineRequestCounterStore(long maximumKeys, Ticker ticker) {
        this.counters = Caffeine.newBuilder()
            .maximumSize(maximumKeys)
            .ticker(ticker)
            .expireAfter(new WindowExpiry())
            .build();
    }

    @Override
    public boolean tryAcquire(String key, Duration window, long limit) {
        AtomicBoolean acquired = new AtomicBoolean();
        counters.asMap().compute(key, (ignored, existing) -> {
            WindowCounter counter = existing != null ? existing : new WindowCounter(window.toNanos());
            if (counter.count().get() < limit) {
                counter.count().incrementAndGet();
                acquired.set(true);
            }
            return counter;
        });
        return acquired.get();
    }

    @Override
    public void release(String key) {
        counters.asMap().computeIfPresent(key, (ignored, counter) -> {
            counter.count().updateAndGet(count -> Math.max(0L, count - 1));
            return counter;
        });
    }

    @Override
    public long current(String key) {
        WindowCounter counter = counters.getIfPresent(key);
        return counter == null ? 0L : counter.count().get();
    }

    private record WindowCounter(long windowNanos, AtomicLong count) {
        WindowCounter(long windowNanos) {
            this(windowNanos, new AtomicLong());
        }
    }

    private static final class WindowExpiry implements Expiry<String, WindowCounter> {

        @Override
        public long expireAfterCreate(String key, WindowCounter value, long currentTime) {
            return value.windowNanos();
        }

        @Override
        public long expireAfterUpdate(String key, WindowCounter value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        @Override
        public long expireAfterRead(String key, WindowCounter value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
