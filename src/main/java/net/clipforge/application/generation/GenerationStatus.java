package net.clipforge.application.generation;

import java.util.Locale;

/**
 * Local view of a remote job's state.
 */
public enum GenerationStatus {
    PENDING,
    SUCCEEDED,
    FAILED;

    /**
     * Maps a remote status string. Unknown values are treated as still in progress.
     */
    public static GenerationStatus fromRemote(String remoteStatus) {
        if (remoteStatus == null) {
            return PENDING;
        }
        return switch (remoteStatus.trim().toUpperCase(Locale.ROOT)) {
            case "SUCCEEDED" -> SUCCEEDED;
            case "FAILED", "CANCELLED", "CANCELED" -> FAILED;
            default -> PENDING;
        };
    }
}
