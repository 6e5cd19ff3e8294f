package com.fops.core.health;

import com.fops.core.audit.AuditProperties;
import com.fops.core.error.MissingCredentialException;
import com.fops.publish.ProposalPublisher;
import com.fops.publish.PublisherRouter;
import com.fops.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks what a proposal run depends on: the tool binaries, platform
 * credentials and a writable audit directory.
 */
@Service
public class ToolchainHealthService {

    private static final Logger log = LoggerFactory.getLogger(ToolchainHealthService.class);

    private final SandboxProperties sandboxProperties;
    private final AuditProperties auditProperties;
    private final PublisherRouter router;
    private final String searchPath;

    @Autowired
    public ToolchainHealthService(SandboxProperties sandboxProperties, AuditProperties auditProperties,
                                  PublisherRouter router) {
        this(sandboxProperties, auditProperties, router, System.getenv("PATH"));
    }

    ToolchainHealthService(SandboxProperties sandboxProperties, AuditProperties auditProperties,
                           PublisherRouter router, String searchPath) {
        this.sandboxProperties = sandboxProperties;
        this.auditProperties = auditProperties;
        this.router = router;
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkBinary("terraform", sandboxProperties.getTerraformBinary()));
        results.add(checkBinary("helm", sandboxProperties.getHelmBinary()));
        for (ProposalPublisher publisher : router.publishers()) {
            results.add(checkCredential(publisher));
        }
        results.add(checkAuditDirectory());
        return results;
    }

    HealthStatus checkBinary(String component, String binary) {
        Optional<Path> resolved = resolve(binary);
        if (resolved.isPresent()) {
            return HealthStatus.up(component,
                    "Found " + resolved.get(), Map.of("binary", resolved.get().toString()));
        }
        return HealthStatus.down(component,
                binary + " not found on PATH", Map.of("binary", String.valueOf(binary)));
    }

    private HealthStatus checkCredential(ProposalPublisher publisher) {
        String component = publisher.platform() + "-credentials";
        try {
            publisher.checkCredentials();
            return HealthStatus.up(component, "API token configured", Map.of());
        } catch (MissingCredentialException e) {
            return HealthStatus.degraded(component, e.getMessage());
        }
    }

    private HealthStatus checkAuditDirectory() {
        Path dir = Path.of(auditProperties.getLogDir());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.warn("Audit directory check failed: {}", e.getMessage());
            return HealthStatus.down("audit",
                    "Cannot create audit directory: " + e.getMessage(), Map.of("dir", dir.toString()));
        }
        if (!Files.isWritable(dir)) {
            return HealthStatus.down("audit",
                    "Audit directory not writable", Map.of("dir", dir.toString()));
        }
        return HealthStatus.up("audit",
                "Audit directory writable", Map.of("dir", dir.toAbsolutePath().toString()));
    }

    private Optional<Path> resolve(String binary) {
        if (binary == null || binary.isBlank()) {
            return Optional.empty();
        }
        if (binary.contains(File.separator)) {
            Path path = Path.of(binary);
            return Files.isExecutable(path) ? Optional.of(path) : Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Path.of(dir, binary);
            if (Files.isExecutable(candidate) && !Files.isDirectory(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
