package net.clipforge.application.generation;

import static org.assertj.core.api.Assertions.assertThat;

import net.clipforge.testsupport.UploadFixtures;
import org.junit.jupiter.api.Test;

class ClipJobFactoryTest {

    @Test
    void should_NameOutputAfterFrameAndTime_When_BuildingSpec() {
        ClipJobFactory factory = new ClipJobFactory(UploadFixtures.FIXED_CLOCK);

        ClipJobSpec spec = factory.forFrame("user-1", "Opening Shot", "https://img/1.png", "sunrise", "9:16");

        assertThat(spec.ownerId()).isEqualTo("user-1");
        assertThat(spec.logicalName()).isEqualTo("Opening_Shot");
        assertThat(spec.filename()).isEqualTo("Opening_Shot_video_clip_" + UploadFixtures.FIXED_CLOCK.millis() + ".mp4");
        assertThat(spec.request().ratio()).isEqualTo("720:1280");
        assertThat(spec.request().promptImage()).isEqualTo("https://img/1.png");
    }
}
