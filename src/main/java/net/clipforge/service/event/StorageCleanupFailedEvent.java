package net.clipforge.service.event;

import java.time.Instant;

/**
 * Published when a best-effort delete of upload parts fails, leaving orphaned objects behind.
 *
 * @param phase which cleanup was running
 * @param storageKey the key (or prefix) that could not be removed
 */
public record StorageCleanupFailedEvent(String ownerId,
                                        String logicalName,
                                        CleanupPhase phase,
                                        String storageKey,
                                        String reason,
                                        Instant occurredAt) {

    public enum CleanupPhase {
        /** Clearing the previous version before a new upload. */
        OVERWRITE,
        /** Removing parts of an upload that failed. */
        ROLLBACK,
        /** Explicit delete requested by a caller. */
        DELETE
    }
}
