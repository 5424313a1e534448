package net.clipforge.application.generation;

import java.time.Clock;
import net.clipforge.application.upload.StorageKeyLayout;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns a frame of a generation request into a {@link ClipJobSpec}.
 */
@Component
public class ClipJobFactory {

    private final Clock clock;

    @Autowired
    public ClipJobFactory() {
        this(Clock.systemUTC());
    }

    public ClipJobFactory(Clock clock) {
        this.clock = clock;
    }

    /**
     * Output file is named {@code <frameName>_video_clip_<epochMillis>.mp4}; the frame name is also the logical name.
     */
    public ClipJobSpec forFrame(String ownerId, String frameName, String imageUrl, String prompt, String ratio) {
        String safeName = StorageKeyLayout.sanitize(frameName);
        String filename = safeName + "_video_clip_" + clock.millis() + ".mp4";
        return new ClipJobSpec(ownerId, safeName, filename, ClipPromptPolicy.requestFor(imageUrl, prompt, ratio));
    }
}
