package com.fops.core.audit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a caller wants recorded. {@link AuditTrail} assigns the id and timestamp.
 */
public record AuditEvent(
    String operationType,
    String agent,
    Map<String, Object> inputs,
    Map<String, Object> outputs,
    List<String> citations,
    String status
) {

    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";
    public static final String REJECTED = "rejected";

    public AuditEvent {
        inputs = inputs == null ? Map.of() : new LinkedHashMap<>(inputs);
        outputs = outputs == null ? Map.of() : new LinkedHashMap<>(outputs);
        citations = citations == null ? List.of() : List.copyOf(citations);
        status = status == null ? COMPLETED : status;
    }

    public static AuditEvent completed(String operationType, String agent,
                                       Map<String, Object> inputs, Map<String, Object> outputs) {
        return new AuditEvent(operationType, agent, inputs, outputs, List.of(), COMPLETED);
    }

    public static AuditEvent failed(String operationType, String agent,
                                    Map<String, Object> inputs, String error) {
        return new AuditEvent(operationType, agent, inputs,
                Map.of("error", error == null ? "unknown" : error), List.of(), FAILED);
    }

    public AuditEvent withCitations(List<String> citations) {
        return new AuditEvent(operationType, agent, inputs, outputs, citations, status);
    }
}
