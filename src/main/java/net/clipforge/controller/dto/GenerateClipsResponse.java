package net.clipforge.controller.dto;

import java.util.List;
import net.clipforge.application.generation.BatchResult;
import net.clipforge.application.generation.ClipOutput;
import net.clipforge.application.generation.ItemStatus;

public record GenerateClipsResponse(String batchId,
                                    int completed,
                                    long failed,
                                    List<Clip> clips,
                                    List<ItemStatus> statuses,
                                    String error) {

    public record Clip(int index, String key, String url, long size, boolean chunked) {

        static Clip from(ClipOutput output) {
            return new Clip(output.index(), output.stored().key(), output.stored().url(),
                output.stored().sizeBytes(), output.stored().isChunked());
        }
    }

    public static GenerateClipsResponse from(BatchResult result, String error) {
        List<Clip> clips = result.succeeded().stream().map(Clip::from).toList();
        return new GenerateClipsResponse(result.batchId(), clips.size(), result.failedCount(), clips, result.statuses(), error);
    }

    public static GenerateClipsResponse unavailable(String error) {
        return new GenerateClipsResponse(null, 0, 0, List.of(), List.of(), error);
    }
}
