package net.clipforge.application.generation;

import java.util.List;
import net.clipforge.exception.ClipForgeException.ErrorCode;

/**
 * Result of a batch run: stored outputs and one status per spec, both in spec order.
 */
public record BatchResult(String batchId, List<ClipOutput> succeeded, List<ItemStatus> statuses) {

    public BatchResult {
        succeeded = List.copyOf(succeeded);
        statuses = List.copyOf(statuses);
    }

    /**
     * True when no item succeeded. Partial success is not a hard failure.
     */
    public boolean isHardFailure() {
        return succeeded.isEmpty();
    }

    public long failedCount() {
        return statuses.stream().filter(status -> !status.isSucceeded()).count();
    }

    /**
     * True when at least one item stopped because the generation account ran out of credits.
     */
    public boolean hasInsufficientResourceFailure() {
        return statuses.stream().anyMatch(status -> status.errorCode() == ErrorCode.INSUFFICIENT_RESOURCE);
    }
}
