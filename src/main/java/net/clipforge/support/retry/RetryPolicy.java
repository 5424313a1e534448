package net.clipforge.support.retry;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import net.clipforge.exception.AttemptTimeoutException;
import net.clipforge.exception.RetryExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Executes operations with bounded retry, linear backoff and an optional per-attempt deadline.
 *
 * <p>Each failure is classified: terminal failures propagate immediately without further attempts,
 * transient failures are retried after {@code attempt * baseBackoff}. When every attempt fails the
 * last error is wrapped in {@link RetryExhaustedException}.</p>
 *
 * <p>Attempts with a deadline run on a dedicated daemon pool so the caller can stop waiting. A timed
 * out attempt is interrupted, and the optional {@link TimeoutRecovery} probe is consulted before the
 * timeout is counted as a failure.</p>
 */
@Component
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final ExecutorService attemptExecutor;
    private final Sleeper sleeper;

    public RetryPolicy() {
        this(Sleeper.SYSTEM);
    }

    public RetryPolicy(Sleeper sleeper) {
        this.sleeper = sleeper;
        AtomicInteger threadCounter = new AtomicInteger();
        this.attemptExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("retry-attempt-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public <T> T execute(String operationLabel,
                         RetrySettings settings,
                         ErrorClassifier classifier,
                         Callable<T> action) {
        return execute(operationLabel, settings, classifier, action, null);
    }

    /**
     * Runs {@code action} until it succeeds, fails terminally, or runs out of attempts.
     *
     * @param timeoutRecovery probe consulted after a timed-out attempt; may be {@code null}
     */
    public <T> T execute(String operationLabel,
                         RetrySettings settings,
                         ErrorClassifier classifier,
                         Callable<T> action,
                         TimeoutRecovery<T> timeoutRecovery) {
        int maxAttempts = settings.maxAttempts();
        Throwable lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return runAttempt(operationLabel, attempt, settings.perAttemptTimeout(), action);
            } catch (AttemptTimeoutException timeout) {
                Optional<T> recovered = probeAfterTimeout(operationLabel, attempt, timeoutRecovery);
                if (recovered.isPresent()) {
                    log.info("'{}' attempt {}/{} timed out but the result is already in place; accepting it",
                        operationLabel, attempt, maxAttempts);
                    return recovered.get();
                }
                lastError = timeout;
            } catch (Exception failure) {
                if (classifier.classify(failure) == ErrorKind.TERMINAL) {
                    log.warn("'{}' failed terminally on attempt {}/{}: {}",
                        operationLabel, attempt, maxAttempts, failure.getMessage());
                    throw asUnchecked(operationLabel, failure);
                }
                lastError = failure;
            }

            if (attempt < maxAttempts) {
                Duration backoff = settings.backoffAfter(attempt);
                log.warn("'{}' failed (attempt {}/{}): {}. Retrying in {}ms",
                    operationLabel, attempt, maxAttempts, lastError.getMessage(), backoff.toMillis());
                sleepUnchecked(operationLabel, backoff);
            }
        }
        log.error("'{}' exhausted {} attempt(s); last error: {}", operationLabel, maxAttempts,
            lastError != null ? lastError.getMessage() : "none");
        throw new RetryExhaustedException(operationLabel, maxAttempts, lastError);
    }

    @PreDestroy
    void shutdown() {
        attemptExecutor.shutdownNow();
    }

    private <T> T runAttempt(String operationLabel, int attempt, Duration timeout, Callable<T> action) throws Exception {
        if (timeout == null) {
            return action.call();
        }
        Future<T> future = attemptExecutor.submit(action);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException timeoutException) {
            future.cancel(true);
            throw new AttemptTimeoutException(operationLabel, attempt, timeout);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause();
            if (cause instanceof Error error) {
                throw error;
            }
            throw (Exception) cause;
        } catch (InterruptedException interruptedException) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for '" + operationLabel + "'", interruptedException);
        }
    }

    private <T> Optional<T> probeAfterTimeout(String operationLabel, int attempt, TimeoutRecovery<T> recovery) {
        if (recovery == null) {
            return Optional.empty();
        }
        try {
            return recovery.recover();
        } catch (Exception probeFailure) {
            log.warn("Post-timeout probe for '{}' attempt {} failed; treating the attempt as failed: {}",
                operationLabel, attempt, probeFailure.getMessage());
            return Optional.empty();
        }
    }

    private void sleepUnchecked(String operationLabel, Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry '" + operationLabel + "'", interruptedException);
        }
    }

    private static RuntimeException asUnchecked(String operationLabel, Exception failure) {
        if (failure instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new IllegalStateException("'" + operationLabel + "' failed: " + failure.getMessage(), failure);
    }
}
