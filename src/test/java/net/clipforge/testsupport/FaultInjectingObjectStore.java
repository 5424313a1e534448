package net.clipforge.testsupport;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import net.clipforge.exception.ObjectStoreException;
import net.clipforge.support.storage.InMemoryObjectStore;

/**
 * In-memory store whose writes and deletes can be made to fail or stall per key.
 */
public class FaultInjectingObjectStore extends InMemoryObjectStore {

    private final List<PutFault> putFaults = new CopyOnWriteArrayList<>();
    private volatile Predicate<String> failingDeletes = key -> false;
    private volatile Duration stallAfterPut = Duration.ZERO;
    private volatile Predicate<String> stalledPuts = key -> false;
    private volatile Predicate<String> failingAfterWrite = key -> false;
    private final Map<String, AtomicInteger> putAttempts = new ConcurrentHashMap<>();

    /**
     * Fails the next {@code times} puts to keys matching {@code keyMatcher}; negative means always.
     */
    public FaultInjectingObjectStore failPuts(Predicate<String> keyMatcher, int times) {
        putFaults.add(new PutFault(keyMatcher, new AtomicInteger(times)));
        return this;
    }

    public FaultInjectingObjectStore failDeletes(Predicate<String> keyMatcher) {
        this.failingDeletes = keyMatcher;
        return this;
    }

    /**
     * Stores the bytes and then blocks for {@code stall}, simulating a write whose acknowledgement is lost.
     */
    public FaultInjectingObjectStore stallPutsAfterWrite(Predicate<String> keyMatcher, Duration stall) {
        this.stalledPuts = keyMatcher;
        this.stallAfterPut = stall;
        return this;
    }

    /**
     * Stores the bytes and then fails, simulating a write that lands but reports an error.
     */
    public FaultInjectingObjectStore failPutsAfterWrite(Predicate<String> keyMatcher) {
        this.failingAfterWrite = keyMatcher;
        return this;
    }

    public int putAttempts(String key) {
        AtomicInteger attempts = putAttempts.get(key);
        return attempts == null ? 0 : attempts.get();
    }

    @Override
    public void put(String key, byte[] bytes, String contentType) {
        putAttempts.computeIfAbsent(key, ignored -> new AtomicInteger()).incrementAndGet();
        for (PutFault fault : putFaults) {
            if (fault.keyMatcher().test(key) && fault.consume()) {
                throw new ObjectStoreException("Injected put failure for " + key, key, null);
            }
        }
        super.put(key, bytes, contentType);
        if (failingAfterWrite.test(key)) {
            throw new ObjectStoreException("Injected failure after write for " + key, key, null);
        }
        if (stalledPuts.test(key)) {
            try {
                Thread.sleep(stallAfterPut.toMillis());
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void delete(String key) {
        if (failingDeletes.test(key)) {
            throw new ObjectStoreException("Injected delete failure for " + key, key, null);
        }
        super.delete(key);
    }

    private record PutFault(Predicate<String> keyMatcher, AtomicInteger remaining) {

        boolean consume() {
            if (remaining.get() < 0) {
                return true;
            }
            return remaining.getAndUpdate(value -> value > 0 ? value - 1 : 0) > 0;
        }
    }
}
