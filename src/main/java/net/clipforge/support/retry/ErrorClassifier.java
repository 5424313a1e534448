package net.clipforge.support.retry;

import java.util.function.Predicate;
import net.clipforge.exception.InsufficientResourceException;

/**
 * Decides whether a failure observed by {@link RetryPolicy} is worth another attempt.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Base classification: resource exhaustion is terminal, everything else (timeouts included) is transient.
     */
    ErrorClassifier DEFAULT = error -> error instanceof InsufficientResourceException
        ? ErrorKind.TERMINAL
        : ErrorKind.TRANSIENT;

    ErrorKind classify(Throwable error);

    /**
     * Returns a classifier that also treats errors matching {@code predicate} as terminal.
     */
    default ErrorClassifier orTerminalWhen(Predicate<Throwable> predicate) {
        return error -> predicate.test(error) ? ErrorKind.TERMINAL : classify(error);
    }
}
