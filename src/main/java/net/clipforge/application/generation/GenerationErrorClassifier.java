package net.clipforge.application.generation;

import java.util.Locale;
import net.clipforge.exception.GenerationAbortedException;
import net.clipforge.support.retry.ErrorClassifier;

/**
 * Retry classification for generation calls and whole generation jobs.
 * Cancellation and invalid requests are terminal in addition to resource exhaustion.
 */
public final class GenerationErrorClassifier {

    public static final ErrorClassifier INSTANCE = ErrorClassifier.DEFAULT
        .orTerminalWhen(error -> error instanceof GenerationAbortedException
            || error instanceof IllegalArgumentException);

    private static final String INSUFFICIENT_CREDITS_MARKER = "enough credits";

    private GenerationErrorClassifier() {
    }

    /**
     * Detects the service's credit exhaustion message in a response body or error message.
     */
    public static boolean indicatesInsufficientCredits(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(INSUFFICIENT_CREDITS_MARKER);
    }
}
