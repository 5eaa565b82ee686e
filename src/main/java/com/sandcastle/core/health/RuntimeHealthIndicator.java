package com.sandcastle.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the container runtime.
 * Reports UP when the daemon answers, DOWN otherwise.
 */
@Component("runtimeHealthIndicator")
public class RuntimeHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public RuntimeHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        var status = healthCheckService.checkRuntime();
        var builder = switch (status.status()) {
            case UP -> Health.up();
            case DEGRADED -> Health.status("DEGRADED");
            case DOWN -> Health.down();
        };
        if (status.detail() != null) {
            builder.withDetail("detail", status.detail());
        }
        if (status.metadata() != null) {
            status.metadata().forEach(builder::withDetail);
        }
        return builder.build();
    }
}
