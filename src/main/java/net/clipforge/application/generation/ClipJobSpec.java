package net.clipforge.application.generation;

/**
 * One clip to generate and store.
 *
 * @param logicalName storage namespace under the owner; re-running a spec replaces its previous output
 */
public record ClipJobSpec(String ownerId, String logicalName, String filename, GenerationRequest request) {
}
