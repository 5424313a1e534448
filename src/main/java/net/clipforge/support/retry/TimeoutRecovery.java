package net.clipforge.support.retry;

import java.util.Optional;

/**
 * Probe run after an attempt times out, to detect work that completed despite the timeout.
 * A present result is accepted as the attempt's outcome. The probe is advisory: when it fails
 * or reports nothing, the timeout counts as a normal transient failure.
 */
@FunctionalInterface
public interface TimeoutRecovery<T> {

    Optional<T> recover() throws Exception;
}
