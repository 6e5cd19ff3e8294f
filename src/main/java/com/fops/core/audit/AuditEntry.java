package com.fops.core.audit;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One immutable line of the audit trail.
 *
 * @param id            first 12 hex chars of SHA-256(timestamp + nonce); an audit handle, not a unique key
 * @param timestamp     UTC instant the entry was written
 * @param operationType e.g. {@code sandbox_validation}, {@code pr_creation}
 * @param agent         component that performed the operation
 * @param inputs        operation inputs (never file contents)
 * @param outputs       operation outputs
 * @param citations     knowledge-source citations in use
 * @param status        {@code completed}, {@code failed} or {@code rejected}
 */
public record AuditEntry(
    String id,
    Instant timestamp,
    String operationType,
    String agent,
    Map<String, Object> inputs,
    Map<String, Object> outputs,
    List<String> citations,
    String status
) {}
