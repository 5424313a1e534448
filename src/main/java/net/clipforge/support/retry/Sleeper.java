package net.clipforge.support.retry;

import java.time.Duration;

/**
 * Blocking wait used between attempts and poll cycles. Replaced in tests to observe or skip delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
