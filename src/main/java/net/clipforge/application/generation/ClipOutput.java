package net.clipforge.application.generation;

import net.clipforge.application.upload.StoredObjectReference;

/**
 * A generated clip that was stored successfully.
 *
 * @param index position of the originating spec in the batch
 * @param sourceUrl where the generation service published the output
 */
public record ClipOutput(int index, String sourceUrl, StoredObjectReference stored) {
}
