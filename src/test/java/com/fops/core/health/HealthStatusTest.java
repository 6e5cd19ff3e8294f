package com.fops.core.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthStatusTest {

    @Test
    @DisplayName("only DOWN counts as down; a missing credential is degraded")
    void downOnlyForDown() {
        assertTrue(HealthStatus.down("helm", "helm not found on PATH", Map.of()).isDown());
        assertFalse(HealthStatus.degraded("gitlab-credentials", "No API token configured for gitlab").isDown());
        assertFalse(HealthStatus.up("terraform", "Found /usr/bin/terraform", Map.of()).isDown());
    }

    @Test
    @DisplayName("metadata is copied and never null")
    void metadataCopied() {
        var source = new HashMap<String, String>();
        source.put("dir", "/var/audit");
        HealthStatus status = HealthStatus.up("audit", "Audit directory writable", source);
        source.put("dir", "/tmp");

        assertEquals("/var/audit", status.metadata().get("dir"));
        assertThrows(UnsupportedOperationException.class, () -> status.metadata().put("x", "y"));
        assertEquals(Map.of(), new HealthStatus("audit", HealthStatus.Status.UP, "ok", null).metadata());
    }
}
