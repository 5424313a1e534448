package net.clipforge.application.generation;

import jakarta.annotation.Nullable;
import net.clipforge.exception.ClipForgeException.ErrorCode;

/**
 * Outcome of one batch item.
 */
public record ItemStatus(int index, Outcome outcome, @Nullable ErrorCode errorCode, @Nullable String message) {

    public enum Outcome {
        SUCCEEDED,
        FAILED
    }

    public static ItemStatus succeeded(int index) {
        return new ItemStatus(index, Outcome.SUCCEEDED, null, null);
    }

    public static ItemStatus failed(int index, ErrorCode errorCode, String message) {
        return new ItemStatus(index, Outcome.FAILED, errorCode, message);
    }

    public boolean isSucceeded() {
        return outcome == Outcome.SUCCEEDED;
    }
}
