package com.fops.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing proposal-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProposal(String proposalId, String repoUrl) {
        MDC.put("proposalId", proposalId);
        MDC.put("repoUrl", repoUrl);
    }

    public static void setStage(String stage) {
        MDC.put("stage", stage);
    }

    public static void clear() {
        MDC.remove("proposalId");
        MDC.remove("repoUrl");
        MDC.remove("stage");
    }
}
