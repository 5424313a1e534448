package net.clipforge.controller.dto;

import java.util.List;

/**
 * Body of a clip generation request: one clip is generated per frame.
 */
public record GenerateClipsRequest(String ownerId, String prompt, String ratio, List<Frame> frames) {

    public record Frame(String name, String imageUrl) {
    }

    public void validate() {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }
        if (frames == null || frames.isEmpty()) {
            throw new IllegalArgumentException("At least one frame is required");
        }
        for (Frame frame : frames) {
            if (frame == null || frame.name() == null || frame.name().isBlank()) {
                throw new IllegalArgumentException("Every frame needs a name");
            }
            if (frame.imageUrl() == null || frame.imageUrl().isBlank()) {
                throw new IllegalArgumentException("Frame '" + frame.name() + "' has no imageUrl");
            }
        }
    }
}
