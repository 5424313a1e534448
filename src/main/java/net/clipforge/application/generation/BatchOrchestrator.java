package net.clipforge.application.generation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import net.clipforge.application.upload.ChunkedUploader;
import net.clipforge.application.upload.StoredObjectReference;
import net.clipforge.config.GenerationProperties;
import net.clipforge.exception.ClipForgeException;
import net.clipforge.exception.ClipForgeException.ErrorCode;
import net.clipforge.exception.RetryExhaustedException;
import net.clipforge.support.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs independent clip jobs in parallel and reports partial success.
 *
 * <p>Each item is a job-level retry around poll, download and upload, so a failed or timed out job is
 * resubmitted as a fresh job. One item's failure never stops the others.</p>
 */
@Service
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);
    private static final String CLIP_CONTENT_TYPE = "video/mp4";

    private final GenerationTaskPoller poller;
    private final GeneratedOutputFetcher outputFetcher;
    private final ChunkedUploader uploader;
    private final RetryPolicy retryPolicy;
    private final GenerationProperties properties;

    public BatchOrchestrator(GenerationTaskPoller poller,
                             GeneratedOutputFetcher outputFetcher,
                             ChunkedUploader uploader,
                             RetryPolicy retryPolicy,
                             GenerationProperties properties) {
        this.poller = poller;
        this.outputFetcher = outputFetcher;
        this.uploader = uploader;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
    }

    public BatchResult runAll(List<ClipJobSpec> specs) {
        return runAll(specs, CancellationToken.create());
    }

    /**
     * Runs every spec; never throws for item failures.
     */
    public BatchResult runAll(List<ClipJobSpec> specs, CancellationToken token) {
        String batchId = UUID.randomUUID().toString();
        if (specs.isEmpty()) {
            return new BatchResult(batchId, List.of(), List.of());
        }
        int concurrency = effectiveConcurrency(specs.size());
        log.info("Batch {} starting {} item(s) with concurrency {}", batchId, specs.size(), concurrency);

        List<ItemOutcome> outcomes = Flux.range(0, specs.size())
            .flatMap(index -> Mono.fromCallable(() -> runItem(batchId, index, specs.get(index), token))
                    .subscribeOn(Schedulers.boundedElastic()),
                concurrency)
            .collectSortedList(Comparator.comparingInt(ItemOutcome::index))
            .block();

        List<ClipOutput> succeeded = new ArrayList<>();
        List<ItemStatus> statuses = new ArrayList<>();
        for (ItemOutcome outcome : outcomes) {
            statuses.add(outcome.status());
            if (outcome.output() != null) {
                succeeded.add(outcome.output());
            }
        }
        BatchResult result = new BatchResult(batchId, succeeded, statuses);
        if (result.isHardFailure()) {
            log.error("Batch {} failed: none of {} item(s) succeeded", batchId, specs.size());
        } else {
            log.info("Batch {} finished: {}/{} item(s) succeeded", batchId, succeeded.size(), specs.size());
        }
        return result;
    }

    private ItemOutcome runItem(String batchId, int index, ClipJobSpec spec, CancellationToken token) {
        try {
            ClipOutput output = retryPolicy.execute(
                "batch " + batchId + " item " + index,
                properties.jobRetrySettings(),
                GenerationErrorClassifier.INSTANCE,
                () -> generateAndStore(index, spec, token));
            return new ItemOutcome(index, output, ItemStatus.succeeded(index));
        } catch (RuntimeException failure) {
            Throwable cause = rootFailure(failure);
            log.warn("Batch {} item {} failed: {}", batchId, index, cause.getMessage());
            return new ItemOutcome(index, null, ItemStatus.failed(index, errorCodeOf(cause), cause.getMessage()));
        }
    }

    private ClipOutput generateAndStore(int index, ClipJobSpec spec, CancellationToken token) {
        String outputUrl = poller.run(spec.request(), token);
        byte[] bytes = outputFetcher.fetch(outputUrl);
        StoredObjectReference stored = uploader.upload(bytes, spec.ownerId(), spec.logicalName(), spec.filename(), CLIP_CONTENT_TYPE);
        return new ClipOutput(index, outputUrl, stored);
    }

    private int effectiveConcurrency(int itemCount) {
        int cap = properties.getBatch().getMaxConcurrency();
        return cap <= 0 ? itemCount : Math.min(cap, itemCount);
    }

    private static Throwable rootFailure(RuntimeException failure) {
        if (failure instanceof RetryExhaustedException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    private static ErrorCode errorCodeOf(Throwable failure) {
        if (failure instanceof ClipForgeException clipForgeException) {
            return clipForgeException.errorCode();
        }
        return ErrorCode.GENERATION_FAILED;
    }

    private record ItemOutcome(int index, ClipOutput output, ItemStatus status) {
    }
}
