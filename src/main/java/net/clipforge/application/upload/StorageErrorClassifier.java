package net.clipforge.application.upload;

import net.clipforge.support.retry.ErrorClassifier;

/**
 * Retry classification for object store writes. Malformed requests are terminal.
 */
final class StorageErrorClassifier {

    static final ErrorClassifier INSTANCE = ErrorClassifier.DEFAULT
        .orTerminalWhen(error -> error instanceof IllegalArgumentException);

    private StorageErrorClassifier() {
    }
}
