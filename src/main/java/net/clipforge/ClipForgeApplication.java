/**
 * Main application class for ClipForge
 *
 * Features:
 * - Generates video clips through a remote generation service
 * - Stores large media in an object store as ordered parts plus a manifest
 * - Entry point for Spring Boot application
 */

package net.clipforge;

import net.clipforge.application.generation.GenerationServiceClient;
import net.clipforge.support.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClipForgeApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ClipForgeApplication.class);

    private final ObjectStore objectStore;
    private final GenerationServiceClient generationClient;

    public ClipForgeApplication(ObjectStore objectStore, GenerationServiceClient generationClient) {
        this.objectStore = objectStore;
        this.generationClient = generationClient;
    }

    public static void main(String[] args) {
        SpringApplication.run(ClipForgeApplication.class, args);
    }

    /**
     * Logs which backends are active so a misconfigured deployment is obvious at startup.
     */
    @Override
    public void run(ApplicationArguments args) {
        log.info("Media store: {}", objectStore.describe());
        if (generationClient.isAvailable()) {
            log.info("Video generation is enabled");
        } else {
            log.warn("Video generation is disabled: set RUNWAYML_API_SECRET to enable it");
        }
    }
}
