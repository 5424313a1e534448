package net.clipforge.support.retry;

import java.time.Duration;

/**
 * Per-call-site retry parameters.
 *
 * @param maxAttempts total attempts including the first, at least 1
 * @param perAttemptTimeout budget for a single attempt; {@code null} runs the attempt inline without a deadline
 * @param baseBackoff delay unit; the wait after attempt {@code n} is {@code n * baseBackoff}
 */
public record RetrySettings(int maxAttempts, Duration perAttemptTimeout, Duration baseBackoff) {

    public RetrySettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 but was " + maxAttempts);
        }
        if (perAttemptTimeout != null && (perAttemptTimeout.isNegative() || perAttemptTimeout.isZero())) {
            throw new IllegalArgumentException("perAttemptTimeout must be positive when set but was " + perAttemptTimeout);
        }
        if (baseBackoff == null || baseBackoff.isNegative()) {
            throw new IllegalArgumentException("baseBackoff must be zero or positive");
        }
    }

    public static RetrySettings withoutTimeout(int maxAttempts, Duration baseBackoff) {
        return new RetrySettings(maxAttempts, null, baseBackoff);
    }

    Duration backoffAfter(int attempt) {
        return baseBackoff.multipliedBy(attempt);
    }
}
