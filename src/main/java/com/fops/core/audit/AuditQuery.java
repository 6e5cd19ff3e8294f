package com.fops.core.audit;

import java.time.Instant;

/**
 * Filters for {@link AuditTrail#query}. Null fields do not filter.
 * {@code from}/{@code to} also choose which day files are opened.
 */
public record AuditQuery(
    Instant from,
    Instant to,
    String operationType,
    String agent,
    String status
) {

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, null);
    }

    public AuditQuery between(Instant from, Instant to) {
        return new AuditQuery(from, to, operationType, agent, status);
    }

    public AuditQuery operationType(String operationType) {
        return new AuditQuery(from, to, operationType, agent, status);
    }

    public AuditQuery agent(String agent) {
        return new AuditQuery(from, to, operationType, agent, status);
    }

    public AuditQuery status(String status) {
        return new AuditQuery(from, to, operationType, agent, status);
    }

    boolean matches(AuditEntry entry) {
        if (operationType != null && !operationType.equals(entry.operationType())) return false;
        if (agent != null && !agent.equals(entry.agent())) return false;
        if (status != null && !status.equals(entry.status())) return false;
        if (from != null && entry.timestamp().isBefore(from)) return false;
        if (to != null && entry.timestamp().isAfter(to)) return false;
        return true;
    }
}
