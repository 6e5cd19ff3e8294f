package com.fops.core.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Allow-list precondition for every sandbox and publish call.
 *
 * <p>An empty allow list lets every target through and logs a warning on each
 * call. A non-empty list must contain at least one entry that the target
 * contains as a substring (repositories) or equals (namespaces, workspaces).
 */
@Service
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final SecurityProperties securityProperties;

    public AccessGuard(SecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    /**
     * @throws NotAllowListedException if {@code allowList} is non-empty and no
     *                                 entry is a substring of {@code target}
     */
    public void authorize(String target, List<String> allowList) {
        if (allowList == null || allowList.isEmpty()) {
            log.warn("No allow-list configured, allowing {}", target);
            return;
        }
        if (target == null) {
            throw new NotAllowListedException("<null>");
        }
        for (String entry : allowList) {
            if (entry != null && !entry.isEmpty() && target.contains(entry)) {
                return;
            }
        }
        log.error("Target not allow-listed: {}", target);
        throw new NotAllowListedException(target);
    }

    public void authorizeRepository(String repoUrl) {
        authorize(repoUrl, securityProperties.getAllowedRepos());
    }

    public void authorizeNamespace(String namespace) {
        authorizeExact(namespace, securityProperties.getAllowedNamespaces());
    }

    public void authorizeWorkspace(String workspace) {
        authorizeExact(workspace, securityProperties.getAllowedWorkspaces());
    }

    private void authorizeExact(String target, List<String> allowList) {
        if (allowList == null || allowList.isEmpty()) {
            log.warn("No allow-list configured, allowing {}", target);
            return;
        }
        if (!allowList.contains(target)) {
            log.error("Target not allow-listed: {} (allowed: {})", target, allowList);
            throw new NotAllowListedException(target);
        }
    }
}
