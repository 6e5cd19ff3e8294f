package com.fops.publish;

import com.fops.core.audit.AuditEvent;
import com.fops.core.audit.AuditTrail;
import com.fops.core.error.ConfigurationException;
import com.fops.core.logging.Redaction;
import com.fops.core.metrics.FopsMetrics;
import com.fops.core.security.AccessGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Guarded, audited entry point to the platform publishers.
 *
 * <p>Each {@link #publish} and {@link #attach} call writes exactly one audit entry,
 * success or failure, and returns a {@link PublishResult} instead of throwing. Only
 * {@link com.fops.core.audit.AuditWriteException} propagates.
 *
 * <p>Publishes to the same {@code (repoUrl, branchName)} are serialized: the
 * platforms' check-then-write file upsert is not atomic.
 */
@Service
public class PublishService {

    private static final Logger log = LoggerFactory.getLogger(PublishService.class);

    static final String AGENT = "proposal_publisher";
    static final String PR_CREATION = "pr_creation";
    static final String PR_CREATION_FAILED = "pr_creation_failed";
    static final String ARTIFACTS_ATTACHED = "artifacts_attached";
    static final String ARTIFACTS_ATTACH_FAILED = "artifacts_attach_failed";

    private static final int LOCK_STRIPES = 64;

    private final PublisherRouter router;
    private final AccessGuard guard;
    private final AuditTrail auditTrail;
    private final FopsMetrics metrics;
    private final ReentrantLock[] branchLocks = new ReentrantLock[LOCK_STRIPES];

    public PublishService(PublisherRouter router, AccessGuard guard, AuditTrail auditTrail,
                          @Autowired(required = false) FopsMetrics metrics) {
        this.router = router;
        this.guard = guard;
        this.auditTrail = auditTrail;
        this.metrics = metrics;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            branchLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Checks everything that must hold before any sandbox or network work for
     * {@code repoUrl}: the allow-list, platform support and credentials.
     *
     * @throws ConfigurationException if any check fails
     */
    public ProposalPublisher preflight(String repoUrl) {
        guard.authorizeRepository(repoUrl);
        ProposalPublisher publisher = router.route(repoUrl);
        publisher.checkCredentials();
        return publisher;
    }

    public PublishResult publish(PublishRequest request, List<String> citations) {
        var inputs = new LinkedHashMap<String, Object>();
        inputs.put("repo_url", Redaction.mask(request.repoUrl()));
        inputs.put("branch", request.branchName());
        inputs.put("title", request.title());
        inputs.put("files", new ArrayList<>(request.files().paths()));

        String platform = "unknown";
        String url;
        ReentrantLock lock = lockFor(request.repoUrl(), request.branchName());
        lock.lock();
        try {
            ProposalPublisher publisher = preflight(request.repoUrl());
            platform = publisher.platform();
            url = publisher.publish(request);
        } catch (RuntimeException e) {
            boolean rejected = e instanceof ConfigurationException;
            log.error("Failed to publish proposal to {} on branch {}: {}",
                    Redaction.mask(request.repoUrl()), request.branchName(), e.getMessage());
            recordPublish(platform, "publish", false);
            var event = new AuditEvent(PR_CREATION_FAILED, AGENT, inputs,
                    Map.of("error", String.valueOf(e.getMessage()), "platform", platform),
                    citations, rejected ? AuditEvent.REJECTED : AuditEvent.FAILED);
            return PublishResult.failed(null, e.getMessage(), auditTrail.append(event), rejected);
        } finally {
            lock.unlock();
        }

        recordPublish(platform, "publish", true);
        var event = new AuditEvent(PR_CREATION, AGENT, inputs,
                Map.of("pr_url", url, "platform", platform), citations, AuditEvent.COMPLETED);
        return PublishResult.succeeded(url, auditTrail.append(event));
    }

    /**
     * Posts the artifacts comment. A failure here leaves the proposal in place and
     * is reported in the result.
     */
    public PublishResult attach(String proposalUrl, Map<String, Object> artifacts) {
        var inputs = new LinkedHashMap<String, Object>();
        inputs.put("pr_url", proposalUrl);
        inputs.put("artifacts", new ArrayList<>(artifacts.keySet()));

        String platform = "unknown";
        boolean attached;
        try {
            guard.authorizeRepository(proposalUrl);
            ProposalPublisher publisher = router.route(proposalUrl);
            platform = publisher.platform();
            attached = publisher.attach(proposalUrl, artifacts);
        } catch (RuntimeException e) {
            boolean rejected = e instanceof ConfigurationException;
            log.error("Failed to attach artifacts to {}: {}", proposalUrl, e.getMessage());
            recordPublish(platform, "attach", false);
            var event = AuditEvent.failed(ARTIFACTS_ATTACH_FAILED, AGENT, inputs, e.getMessage());
            return PublishResult.failed(proposalUrl, e.getMessage(), auditTrail.append(event), rejected);
        }

        recordPublish(platform, "attach", true);
        var event = AuditEvent.completed(ARTIFACTS_ATTACHED, AGENT, inputs,
                Map.of("attached", attached, "platform", platform));
        return PublishResult.succeeded(proposalUrl, auditTrail.append(event));
    }

    private ReentrantLock lockFor(String repoUrl, String branchName) {
        int stripe = Math.floorMod((repoUrl + "#" + branchName).hashCode(), LOCK_STRIPES);
        return branchLocks[stripe];
    }

    private void recordPublish(String platform, String operation, boolean success) {
        if (metrics != null) {
            metrics.recordPublish(platform, operation, success);
        }
    }
}
