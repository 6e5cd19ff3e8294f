package com.fops.core.audit;

import java.util.Map;

public record AuditStatistics(
    int totalOperations,
    Map<String, Integer> byOperationType,
    Map<String, Integer> byAgent,
    Map<String, Integer> byStatus,
    Map<String, Integer> byDate
) {}
