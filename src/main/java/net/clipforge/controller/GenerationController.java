package net.clipforge.controller;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.clipforge.application.generation.BatchOrchestrator;
import net.clipforge.application.generation.BatchResult;
import net.clipforge.application.generation.ClipJobFactory;
import net.clipforge.application.generation.ClipJobSpec;
import net.clipforge.application.generation.GenerationServiceClient;
import net.clipforge.controller.dto.GenerateClipsRequest;
import net.clipforge.controller.dto.GenerateClipsResponse;
import net.clipforge.exception.InsufficientResourceException;
import net.clipforge.service.OwnerRequestThrottle;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Generates one clip per submitted frame and stores the results.
 */
@RestController
@RequestMapping("/api/generation")
@Slf4j
public class GenerationController {

    private final BatchOrchestrator batchOrchestrator;
    private final ClipJobFactory clipJobFactory;
    private final OwnerRequestThrottle throttle;
    private final GenerationServiceClient generationClient;

    public GenerationController(BatchOrchestrator batchOrchestrator,
                                ClipJobFactory clipJobFactory,
                                OwnerRequestThrottle throttle,
                                GenerationServiceClient generationClient) {
        this.batchOrchestrator = batchOrchestrator;
        this.clipJobFactory = clipJobFactory;
        this.throttle = throttle;
        this.generationClient = generationClient;
    }

    @PostMapping("/clips")
    public ResponseEntity<GenerateClipsResponse> generateClips(@RequestBody GenerateClipsRequest request) {
        request.validate();
        if (!generationClient.isAvailable()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(GenerateClipsResponse.unavailable("Video generation is not configured"));
        }
        throttle.acquire(request.ownerId());

        List<ClipJobSpec> specs = new ArrayList<>(request.frames().size());
        for (GenerateClipsRequest.Frame frame : request.frames()) {
            specs.add(clipJobFactory.forFrame(request.ownerId(), frame.name(), frame.imageUrl(), request.prompt(), request.ratio()));
        }
        log.info("Generating {} clip(s) for owner {}", specs.size(), request.ownerId());

        BatchResult result = batchOrchestrator.runAll(specs);
        if (!result.isHardFailure()) {
            return ResponseEntity.ok(GenerateClipsResponse.from(result, null));
        }
        if (result.hasInsufficientResourceFailure()) {
            return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
                .body(GenerateClipsResponse.from(result, InsufficientResourceException.USER_MESSAGE));
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(GenerateClipsResponse.from(result, "No clips could be generated. Please try again later."));
    }
}
