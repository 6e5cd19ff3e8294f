package com.fops.core.health;

import java.util.Map;

/**
 * Result of probing one prerequisite: a tool binary, a platform credential or
 * the audit directory. Only {@link Status#DOWN} blocks startup; a missing
 * credential is {@link Status#DEGRADED} because the other platform still works.
 *
 * @param component short probe name, e.g. {@code terraform} or {@code github-credentials}
 * @param detail    human-readable outcome
 * @param metadata  resolved paths and similar facts, for the health endpoint
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    static HealthStatus down(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    static HealthStatus degraded(String component, String detail) {
        return new HealthStatus(component, Status.DEGRADED, detail, Map.of());
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
