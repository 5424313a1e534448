package net.clipforge.application.generation;

import java.time.Duration;
import net.clipforge.config.GenerationProperties;
import net.clipforge.exception.GenerationAbortedException;
import net.clipforge.exception.GenerationFailedException;
import net.clipforge.exception.GenerationTimedOutException;
import net.clipforge.support.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Drives one generation job from submission to a terminal state.
 *
 * <p>States: {@code SUBMITTED -> POLLING -> SUCCEEDED | FAILED | TIMED_OUT}, with {@code ABORTED}
 * reached only through the {@link CancellationToken}. Each cycle checks the token, sleeps one poll
 * interval (never past the deadline), checks the token again and fetches the status. A status error
 * ends the run and propagates, leaving resubmission to the job-level retry. The deadline is measured
 * from the first poll and never cancels the remote job.</p>
 */
@Service
public class GenerationTaskPoller {

    private static final Logger log = LoggerFactory.getLogger(GenerationTaskPoller.class);

    enum PollState {
        SUBMITTED,
        POLLING,
        SUCCEEDED,
        FAILED,
        TIMED_OUT,
        ABORTED
    }

    private final GenerationServiceClient client;
    private final GenerationProperties properties;
    private final Sleeper sleeper;

    @Autowired
    public GenerationTaskPoller(GenerationServiceClient client, GenerationProperties properties) {
        this(client, properties, Sleeper.SYSTEM);
    }

    public GenerationTaskPoller(GenerationServiceClient client, GenerationProperties properties, Sleeper sleeper) {
        this.client = client;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public String run(GenerationRequest request, CancellationToken token) {
        return run(request, properties.getPollInterval(), properties.getMaxWait(), token);
    }

    /**
     * Submits {@code request} and waits for its output.
     *
     * @return the first output reference of the succeeded job
     * @throws GenerationFailedException when the job fails remotely
     * @throws GenerationTimedOutException when {@code maxWait} elapses first
     * @throws GenerationAbortedException when {@code token} is cancelled
     */
    public String run(GenerationRequest request, Duration pollInterval, Duration maxWait, CancellationToken token) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        String jobId = client.submit(request);
        transition(jobId, PollState.SUBMITTED);

        long deadlineNanos = System.nanoTime() + maxWait.toNanos();
        transition(jobId, PollState.POLLING);
        while (true) {
            abortIfCancelled(jobId, token);
            long remainingNanos = deadlineNanos - System.nanoTime();
            Duration nap = remainingNanos > 0 ? min(pollInterval, Duration.ofNanos(remainingNanos)) : Duration.ZERO;
            sleepOneCycle(jobId, nap);
            abortIfCancelled(jobId, token);

            GenerationTask task = fetchStatus(jobId);
            if (task.status() == GenerationStatus.SUCCEEDED) {
                String output = task.outputReference().orElseThrow(() -> {
                    transition(jobId, PollState.FAILED);
                    return new GenerationFailedException(jobId, "job succeeded without an output");
                });
                transition(jobId, PollState.SUCCEEDED);
                return output;
            }
            if (task.status() == GenerationStatus.FAILED) {
                transition(jobId, PollState.FAILED);
                throw new GenerationFailedException(jobId,
                    task.failureReason() != null ? task.failureReason() : "remote job reported failure");
            }

            if (System.nanoTime() - deadlineNanos >= 0) {
                transition(jobId, PollState.TIMED_OUT);
                throw new GenerationTimedOutException(jobId, maxWait);
            }
        }
    }

    private GenerationTask fetchStatus(String jobId) {
        try {
            return client.getStatus(jobId);
        } catch (RuntimeException failure) {
            log.warn("Status check for generation job {} failed ({}): {}", jobId,
                GenerationErrorClassifier.INSTANCE.classify(failure), failure.getMessage());
            transition(jobId, PollState.FAILED);
            throw failure;
        }
    }

    private static Duration min(Duration first, Duration second) {
        return first.compareTo(second) <= 0 ? first : second;
    }

    private void abortIfCancelled(String jobId, CancellationToken token) {
        if (token.isCancelled()) {
            transition(jobId, PollState.ABORTED);
            throw new GenerationAbortedException(jobId);
        }
    }

    private void sleepOneCycle(String jobId, Duration pollInterval) {
        try {
            sleeper.sleep(pollInterval);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            transition(jobId, PollState.ABORTED);
            throw new GenerationAbortedException(jobId);
        }
    }

    private static void transition(String jobId, PollState state) {
        if (state == PollState.SUCCEEDED || state == PollState.SUBMITTED) {
            log.info("Generation job {} -> {}", jobId, state);
        } else if (state == PollState.POLLING) {
            log.debug("Generation job {} -> {}", jobId, state);
        } else {
            log.warn("Generation job {} -> {}", jobId, state);
        }
    }
}
