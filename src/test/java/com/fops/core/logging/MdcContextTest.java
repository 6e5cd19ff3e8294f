package com.fops.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setProposal puts proposalId and repoUrl in MDC")
    void setProposal() {
        MdcContext.setProposal("FOPS-2026-0001", "https://github.com/acme/shop");
        assertEquals("FOPS-2026-0001", MDC.get("proposalId"));
        assertEquals("https://github.com/acme/shop", MDC.get("repoUrl"));
    }

    @Test
    @DisplayName("setStage overwrites the previous stage")
    void setStage() {
        MdcContext.setStage("validate");
        MdcContext.setStage("publish");
        assertEquals("publish", MDC.get("stage"));
    }

    @Test
    @DisplayName("clear removes all proposal MDC keys")
    void clear() {
        MdcContext.setProposal("FOPS-2026-0001", "https://github.com/acme/shop");
        MdcContext.setStage("attach");
        MdcContext.clear();
        assertNull(MDC.get("proposalId"));
        assertNull(MDC.get("repoUrl"));
        assertNull(MDC.get("stage"));
    }
}
