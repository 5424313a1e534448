package net.clipforge.support.ratelimit;

import java.time.Duration;

/**
 * Counts requests per key within a fixed window that starts at the key's first request.
 * Expired windows are evicted by the store itself.
 */
public interface RequestCounterStore {

    /**
     * Atomically counts one request for {@code key} when the active window holds fewer than {@code limit},
     * opening a new window of length {@code window} if none is active.
     *
     * @return {@code false} when the window is full; the count is then left unchanged
     */
    boolean tryAcquire(String key, Duration window, long limit);

    /**
     * Gives back one request previously counted for {@code key}, if its window is still active.
     */
    void release(String key);

    /**
     * Returns the count in the active window for {@code key}, or zero when no window is active.
     */
    long current(String key);
}
