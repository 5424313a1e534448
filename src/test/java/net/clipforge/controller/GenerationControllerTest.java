package net.clipforge.controller;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import net.clipforge.application.generation.BatchOrchestrator;
import net.clipforge.application.generation.BatchResult;
import net.clipforge.application.generation.ClipJobFactory;
import net.clipforge.application.generation.ClipOutput;
import net.clipforge.application.generation.GenerationServiceClient;
import net.clipforge.application.generation.ItemStatus;
import net.clipforge.application.upload.StoredObjectReference;
import net.clipforge.config.GenerationProperties;
import net.clipforge.exception.ClipForgeException.ErrorCode;
import net.clipforge.service.OwnerRequestThrottle;
import net.clipforge.support.ratelimit.CaffeineRequestCounterStore;
import net.clipforge.testsupport.UploadFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class GenerationControllerTest {

    private static final String TWO_FRAMES = """
        {"ownerId":"user-1","prompt":"gentle waves","ratio":"16:9",
         "frames":[{"name":"first","imageUrl":"https://img/1.png"},{"name":"second","imageUrl":"https://img/2.png"}]}
        """;

    @Mock
    private BatchOrchestrator batchOrchestrator;

    @Mock
    private GenerationServiceClient generationClient;

    private final GenerationProperties properties = new GenerationProperties();
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        OwnerRequestThrottle throttle = new OwnerRequestThrottle(new CaffeineRequestCounterStore(100), properties);
        GenerationController controller = new GenerationController(
            batchOrchestrator, new ClipJobFactory(UploadFixtures.FIXED_CLOCK), throttle, generationClient);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    private static StoredObjectReference stored(String key) {
        return new StoredObjectReference(StoredObjectReference.Kind.DIRECT, key, "/api/media/stream?key=" + key, 3, 1);
    }

    @Test
    void should_Return200WithPartialResults_When_AnyClipSucceeds() throws Exception {
        when(generationClient.isAvailable()).thenReturn(true);
        when(batchOrchestrator.runAll(anyList())).thenReturn(new BatchResult("batch-1",
            List.of(new ClipOutput(0, "https://cdn/0.mp4", stored("user-1/first/first.mp4"))),
            List.of(ItemStatus.succeeded(0), ItemStatus.failed(1, ErrorCode.GENERATION_FAILED, "moderated"))));

        mockMvc.perform(post("/api/generation/clips").contentType(MediaType.APPLICATION_JSON).content(TWO_FRAMES))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.completed").value(1))
            .andExpect(jsonPath("$.failed").value(1))
            .andExpect(jsonPath("$.clips[0].key").value("user-1/first/first.mp4"))
            .andExpect(jsonPath("$.statuses[1].errorCode").value("GENERATION_FAILED"));
    }

    @Test
    void should_Return402_When_EveryClipFailsForLackOfCredits() throws Exception {
        when(generationClient.isAvailable()).thenReturn(true);
        when(batchOrchestrator.runAll(anyList())).thenReturn(new BatchResult("batch-2", List.of(),
            List.of(ItemStatus.failed(0, ErrorCode.INSUFFICIENT_RESOURCE, "credits"),
                ItemStatus.failed(1, ErrorCode.INSUFFICIENT_RESOURCE, "credits"))));

        mockMvc.perform(post("/api/generation/clips").contentType(MediaType.APPLICATION_JSON).content(TWO_FRAMES))
            .andExpect(status().isPaymentRequired())
            .andExpect(jsonPath("$.completed").value(0));
    }

    @Test
    void should_Return502_When_EveryClipFailsOtherwise() throws Exception {
        when(generationClient.isAvailable()).thenReturn(true);
        when(batchOrchestrator.runAll(anyList())).thenReturn(new BatchResult("batch-3", List.of(),
            List.of(ItemStatus.failed(0, ErrorCode.GENERATION_TIMED_OUT, "slow"),
                ItemStatus.failed(1, ErrorCode.GENERATION_FAILED, "bad"))));

        mockMvc.perform(post("/api/generation/clips").contentType(MediaType.APPLICATION_JSON).content(TWO_FRAMES))
            .andExpect(status().isBadGateway());
    }

    @Test
    void should_Return503_When_GenerationNotConfigured() throws Exception {
        when(generationClient.isAvailable()).thenReturn(false);

        mockMvc.perform(post("/api/generation/clips").contentType(MediaType.APPLICATION_JSON).content(TWO_FRAMES))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("Video generation is not configured"));
        verify(batchOrchestrator, never()).runAll(anyList());
    }

    @Test
    void should_Return400_When_NoFramesGiven() throws Exception {
        mockMvc.perform(post("/api/generation/clips").contentType(MediaType.APPLICATION_JSON)
                .content("{\"ownerId\":\"user-1\",\"frames\":[]}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void should_Return429_When_OwnerExceedsMinuteAllowance() throws Exception {
        properties.getRateLimit().setRequestsPerMinute(1);
        when(generationClient.isAvailable()).thenReturn(true);
        when(batchOrchestrator.runAll(anyList())).thenReturn(new BatchResult("batch-4", List.of(), List.of()));

        mockMvc.perform(post("/api/generation/clips").contentType(MediaType.APPLICATION_JSON).content(TWO_FRAMES));
        mockMvc.perform(post("/api/generation/clips").contentType(MediaType.APPLICATION_JSON).content(TWO_FRAMES))
            .andExpect(status().isTooManyRequests());
    }
}
