package com.fops.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes {@link ToolchainHealthService} through Actuator. Any DOWN component
 * makes the whole indicator DOWN; DEGRADED ones only show up in the details.
 */
@Component
public class ToolchainHealthIndicator implements HealthIndicator {

    private final ToolchainHealthService healthService;

    public ToolchainHealthIndicator(ToolchainHealthService healthService) {
        this.healthService = healthService;
    }

    @Override
    public Health health() {
        var builder = Health.up();
        for (HealthStatus status : healthService.checkAll()) {
            if (status.isDown()) {
                builder = builder.down();
            }
            builder.withDetail(status.component(), status.status() + ": " + status.detail());
        }
        return builder.build();
    }
}
