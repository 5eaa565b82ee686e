package com.sandcastle.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for sandbox lifecycle operations.
 */
@Service
public class SandboxMetrics {

    private final MeterRegistry registry;

    public SandboxMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "success" or the simple name of the failure
     */
    public void recordOperation(String operation, String outcome, Duration duration) {
        Timer.builder("sandcastle.operation.duration")
                .description("Sandbox engine operations")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .record(duration);
    }

    /**
     * Records a compensating action taken after a failed create.
     *
     * @param action  "delete-container" or "delete-record"
     * @param success whether the compensation itself succeeded
     */
    public void recordCompensation(String action, boolean success) {
        Counter.builder("sandcastle.create.compensations")
                .description("Cleanup actions after a failed sandbox creation")
                .tag("action", action)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    /**
     * Records a container that could not be removed and needs reconciliation.
     */
    public void recordOrphanedContainer() {
        Counter.builder("sandcastle.containers.orphaned")
                .description("Containers left behind by a failed sandbox creation")
                .register(registry)
                .increment();
    }

    /**
     * Records a sandbox moved to the error state because its container was gone.
     */
    public void recordContainerMissing(String operation) {
        Counter.builder("sandcastle.containers.missing")
                .description("Operations that found the sandbox container missing")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
