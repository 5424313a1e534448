package net.clipforge.service;

import java.time.Duration;
import net.clipforge.config.GenerationProperties;
import net.clipforge.exception.RateLimitExceededException;
import net.clipforge.support.ratelimit.RequestCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Enforces per-owner minute and hour request allowances on generation requests.
 */
@Service
public class OwnerRequestThrottle {

    private static final Logger log = LoggerFactory.getLogger(OwnerRequestThrottle.class);

    private final RequestCounterStore counterStore;
    private final GenerationProperties.RateLimit limits;

    public OwnerRequestThrottle(RequestCounterStore counterStore, GenerationProperties generationProperties) {
        this.counterStore = counterStore;
        this.limits = generationProperties.getRateLimit();
    }

    /**
     * Counts one request for {@code ownerId}. A rejected request consumes neither allowance.
     *
     * @throws RateLimitExceededException when either window is already full
     */
    public void acquire(String ownerId) {
        String minuteKey = ownerId + ":minute";
        String hourKey = ownerId + ":hour";
        if (!counterStore.tryAcquire(minuteKey, Duration.ofMinutes(1), limits.getRequestsPerMinute())) {
            log.info("Owner {} exceeded {} requests/minute", ownerId, limits.getRequestsPerMinute());
            throw new RateLimitExceededException(ownerId, "minute", limits.getRequestsPerMinute());
        }
        if (!counterStore.tryAcquire(hourKey, Duration.ofHours(1), limits.getRequestsPerHour())) {
            counterStore.release(minuteKey);
            log.info("Owner {} exceeded {} requests/hour", ownerId, limits.getRequestsPerHour());
            throw new RateLimitExceededException(ownerId, "hour", limits.getRequestsPerHour());
        }
    }
}
