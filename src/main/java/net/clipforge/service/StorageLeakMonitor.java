package net.clipforge.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import net.clipforge.service.event.StorageCleanupFailedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Records cleanup failures so orphaned storage objects are visible on the metrics endpoint.
 */
@Component
public class StorageLeakMonitor {

    static final String METRIC_NAME = "clipforge.storage.cleanup.failures";

    private static final Logger log = LoggerFactory.getLogger(StorageLeakMonitor.class);

    private final MeterRegistry meterRegistry;

    public StorageLeakMonitor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @EventListener
    public void onCleanupFailed(StorageCleanupFailedEvent event) {
        Counter.builder(METRIC_NAME)
            .description("Storage objects left behind after a failed cleanup")
            .tag("phase", event.phase().name().toLowerCase(Locale.ROOT))
            .register(meterRegistry)
            .increment();
        log.warn("Orphaned storage object {} for {}/{} after {} cleanup failed: {}",
            event.storageKey(), event.ownerId(), event.logicalName(), event.phase(), event.reason());
    }
}
