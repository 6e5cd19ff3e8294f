package com.fops.core.engine;

import com.fops.core.audit.AuditEvent;
import com.fops.core.audit.AuditTrail;
import com.fops.core.audit.AuditWriteException;
import com.fops.core.citation.CitationBinding;
import com.fops.core.citation.CitationTracker;
import com.fops.core.error.ConfigurationException;
import com.fops.core.logging.MdcContext;
import com.fops.core.logging.Redaction;
import com.fops.core.metrics.FopsMetrics;
import com.fops.core.model.FileSet;
import com.fops.core.model.Proposal;
import com.fops.core.model.ValidationReport;
import com.fops.core.security.AccessGuard;
import com.fops.publish.BranchNames;
import com.fops.publish.PublishProperties;
import com.fops.publish.PublishRequest;
import com.fops.publish.PublishResult;
import com.fops.publish.PublishService;
import com.fops.validation.ChartStructureValidator;
import com.fops.validation.HelmValidator;
import com.fops.validation.PipelineSyntaxValidator;
import com.fops.validation.TerraformValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a proposal end to end: preflight checks, sandbox validation, citation
 * binding, publishing and artifact attachment.
 *
 * <p>Steps run strictly in that order and every step that has an effect is
 * audited when it completes. Configuration problems are caught before any
 * sandbox or network work. The result is always a {@link ProposalOutcome}; only
 * {@link AuditWriteException} escapes.
 */
@Service
public class ChangeProposalOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChangeProposalOrchestrator.class);

    static final String AGENT_INFRASTRUCTURE = "infrastructure";
    static final String AGENT_PIPELINE = "pipeline";

    private final PublishService publishService;
    private final AccessGuard guard;
    private final TerraformValidator terraformValidator;
    private final HelmValidator helmValidator;
    private final ChartStructureValidator chartStructureValidator;
    private final PipelineSyntaxValidator pipelineValidator;
    private final CitationTracker citationTracker;
    private final AuditTrail auditTrail;
    private final BranchNames branchNames;
    private final ProposalBodyFormatter bodyFormatter;
    private final PublishProperties publishProperties;
    private final ExecutorService validationExecutor;
    private final Clock clock;
    private final FopsMetrics metrics;
    private final AtomicInteger proposalCounter = new AtomicInteger();

    public ChangeProposalOrchestrator(PublishService publishService,
                                      AccessGuard guard,
                                      TerraformValidator terraformValidator,
                                      HelmValidator helmValidator,
                                      ChartStructureValidator chartStructureValidator,
                                      PipelineSyntaxValidator pipelineValidator,
                                      CitationTracker citationTracker,
                                      AuditTrail auditTrail,
                                      BranchNames branchNames,
                                      ProposalBodyFormatter bodyFormatter,
                                      PublishProperties publishProperties,
                                      @Qualifier("validationExecutor") ExecutorService validationExecutor,
                                      Clock clock,
                                      @Autowired(required = false) FopsMetrics metrics) {
        this.publishService = publishService;
        this.guard = guard;
        this.terraformValidator = terraformValidator;
        this.helmValidator = helmValidator;
        this.chartStructureValidator = chartStructureValidator;
        this.pipelineValidator = pipelineValidator;
        this.citationTracker = citationTracker;
        this.auditTrail = auditTrail;
        this.branchNames = branchNames;
        this.bodyFormatter = bodyFormatter;
        this.publishProperties = publishProperties;
        this.validationExecutor = validationExecutor;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Runs {@link #propose} on the validation executor.
     */
    public CompletableFuture<ProposalOutcome> proposeAsync(ProposalRequest request) {
        return CompletableFuture.supplyAsync(() -> propose(request), validationExecutor);
    }

    /**
     * @throws AuditWriteException if an audit entry could not be written
     */
    public ProposalOutcome propose(ProposalRequest request) {
        String proposalId = nextProposalId();
        MdcContext.setProposal(proposalId, Redaction.mask(request.repoUrl()));
        var run = new Run(proposalId, request);
        try {
            log.info("Starting proposal {} ({}) for {}", proposalId, request.branchKind(),
                    Redaction.mask(request.repoUrl()));
            ProposalOutcome outcome = execute(run);
            log.info("Proposal {} finished: {}", proposalId, outcome.status());
            if (metrics != null) {
                metrics.recordProposalOutcome(outcome.status().name());
            }
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    private ProposalOutcome execute(Run run) {
        ProposalRequest request = run.request;

        MdcContext.setStage("preflight");
        try {
            preflight(request);
        } catch (ConfigurationException e) {
            log.warn("Proposal {} rejected: {}", run.proposalId, e.getMessage());
            return terminal(run, ProposalStatus.REJECTED, "proposal_rejected", AuditEvent.REJECTED, e.getMessage());
        }

        MdcContext.setStage("validate");
        try {
            validate(run);
        } catch (ConfigurationException e) {
            return terminal(run, ProposalStatus.REJECTED, "proposal_rejected", AuditEvent.REJECTED, e.getMessage());
        } catch (AuditWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Validation of proposal {} failed unexpectedly", run.proposalId, e);
            return terminal(run, ProposalStatus.VALIDATION_FAILED, "proposal_validation_failed",
                    AuditEvent.FAILED, "Validation error: " + e.getMessage());
        }

        boolean validationFailed = run.reports.stream().anyMatch(r -> r.status().isFailure());
        if (validationFailed && !publishProperties.isPublishFailedValidations()) {
            return terminal(run, ProposalStatus.VALIDATION_FAILED, "proposal_validation_failed",
                    AuditEvent.FAILED, "Validation failed: " + failureSummary(run.reports));
        }

        MdcContext.setStage("publish");
        Proposal proposal = assemble(run);
        PublishResult published = publishService.publish(PublishRequest.of(proposal),
                citationTracker.citationTexts(request.sources()));
        run.auditIds.add(published.auditId());
        if (!published.success()) {
            ProposalStatus status = published.rejected() ? ProposalStatus.REJECTED : ProposalStatus.PUBLISH_FAILED;
            return outcome(run, status, null, null, published.error());
        }

        MdcContext.setStage("attach");
        PublishResult attached = publishService.attach(published.url(), artifacts(run));
        run.auditIds.add(attached.auditId());
        String attachError = attached.success() ? null : "Artifacts not attached: " + attached.error();
        return outcome(run, ProposalStatus.PUBLISHED, published.url(), proposal.branchName(), attachError);
    }

    private void preflight(ProposalRequest request) {
        publishService.preflight(request.repoUrl());
        if (request instanceof InfrastructureProposal infra) {
            if (!infra.terraformFiles().isEmpty()) {
                guard.authorizeWorkspace(infra.terraformOptions().workspace());
            }
            if (!infra.helmChart().isEmpty()) {
                guard.authorizeNamespace(infra.helmOptions().namespace());
            }
        }
    }

    private void validate(Run run) {
        if (run.request instanceof InfrastructureProposal infra) {
            if (!infra.terraformFiles().isEmpty()) {
                run.terraform = record(run, "terraform_plan", AGENT_INFRASTRUCTURE,
                        terraformValidator.plan(infra.terraformFiles(), infra.terraformOptions()));
            }
            if (!infra.helmChart().isEmpty()) {
                ValidationReport structure = chartStructureValidator.validate(infra.helmChart());
                if (structure.status().isFailure()) {
                    run.helm = record(run, "helm_chart_validation", AGENT_INFRASTRUCTURE, structure);
                } else {
                    run.helm = record(run, "helm_dry_run", AGENT_INFRASTRUCTURE,
                            helmValidator.dryRun(infra.helmChart(), infra.helmOptions()));
                }
            }
        } else if (run.request instanceof PipelineProposal pipeline) {
            run.pipeline = record(run, "pipeline_validation", AGENT_PIPELINE,
                    pipelineValidator.validate(pipeline.pipelinePath(), pipeline.pipelineContent()));
        }
    }

    private ValidationReport record(Run run, String operation, String agent, ValidationReport report) {
        run.reports.add(report);
        var inputs = new LinkedHashMap<String, Object>();
        inputs.put("proposal_id", run.proposalId);
        inputs.put("repo_url", Redaction.mask(run.request.repoUrl()));
        var outputs = new LinkedHashMap<String, Object>();
        outputs.put("status", report.status().wireName());
        if (report.failedStage() != null) {
            outputs.put("failed_stage", report.failedStage().wireName());
        }
        outputs.put("summary", report.summary());
        outputs.put("manifest_count", report.manifests().size());
        outputs.put("errors", report.errors());
        String status = report.status().isFailure() ? AuditEvent.FAILED : AuditEvent.COMPLETED;
        run.auditIds.add(auditTrail.append(new AuditEvent(operation, agent, inputs, outputs,
                List.of(), status)));
        return report;
    }

    private Proposal assemble(Run run) {
        ProposalRequest request = run.request;
        String body;
        if (request instanceof InfrastructureProposal infra) {
            body = bodyFormatter.infrastructure(infra, run.terraform, run.helm, run.contentHash());
        } else {
            body = bodyFormatter.pipeline((PipelineProposal) request, run.pipeline, run.contentHash());
        }
        CitationBinding binding = citationTracker.bind(body, request.sources());
        return new Proposal(request.repoUrl(), branchNames.next(request.branchKind()), request.title(),
                binding.contentWithFooter(), run.files(), run.reports, binding.citations());
    }

    private Map<String, Object> artifacts(Run run) {
        var artifacts = new LinkedHashMap<String, Object>();
        List<String> citations = citationTracker.citationTexts(run.request.sources());
        if (run.request instanceof InfrastructureProposal infra) {
            if (run.terraform != null) {
                artifacts.put("terraform_plan", reportArtifact(run.terraform));
            }
            if (run.helm != null) {
                artifacts.put("helm_dry_run", reportArtifact(run.helm));
            }
            var info = new LinkedHashMap<String, Object>();
            info.put("agent", AGENT_INFRASTRUCTURE);
            info.put("target", infra.target());
            info.put("environments", infra.environments());
            info.put("domain", infra.domain());
            info.put("citations_count", citations.size());
            info.put("content_hash", run.contentHash());
            artifacts.put("infrastructure_info", info);
            artifacts.put("citations", citations);
        } else {
            artifacts.put("pipeline_validation", reportArtifact(run.pipeline));
            artifacts.put("kb_citations", citations);
            var info = new LinkedHashMap<String, Object>();
            info.put("agent", AGENT_PIPELINE);
            info.put("citations_count", citations.size());
            info.put("validation_status", run.pipeline.status().wireName());
            info.put("content_hash", run.contentHash());
            artifacts.put("generation_info", info);
        }
        return artifacts;
    }

    /**
     * Report view for the PR comment; raw tool output stays out of it.
     */
    private static Map<String, Object> reportArtifact(ValidationReport report) {
        var view = new LinkedHashMap<String, Object>();
        view.put("tool", report.tool());
        view.put("status", report.status().wireName());
        if (report.failedStage() != null) {
            view.put("failed_stage", report.failedStage().wireName());
        }
        if (!report.resourceChanges().isEmpty() || "terraform".equals(report.tool())) {
            view.put("summary", report.summary());
            view.put("resources", report.resourceChanges());
        }
        if (!report.drift().isEmpty()) {
            view.put("drift", report.drift());
        }
        if (!report.manifests().isEmpty()) {
            view.put("manifest_summary", report.manifestSummary());
        }
        view.put("lint", report.lint());
        if (!report.notes().isEmpty()) {
            view.put("notes", report.notes());
        }
        if (!report.errors().isEmpty()) {
            view.put("errors", report.errors());
        }
        return view;
    }

    private ProposalOutcome terminal(Run run, ProposalStatus status, String operation, String auditStatus,
                                     String error) {
        var inputs = new LinkedHashMap<String, Object>();
        inputs.put("proposal_id", run.proposalId);
        inputs.put("repo_url", Redaction.mask(run.request.repoUrl()));
        inputs.put("kind", run.request.branchKind());
        var outputs = new LinkedHashMap<String, Object>();
        outputs.put("error", error == null ? "unknown" : error);
        outputs.put("reports", run.reports.stream().map(r -> r.tool() + ":" + r.status().wireName()).toList());
        String agent = run.request instanceof PipelineProposal ? AGENT_PIPELINE : AGENT_INFRASTRUCTURE;
        run.auditIds.add(auditTrail.append(new AuditEvent(operation, agent, inputs, outputs,
                citationTracker.citationTexts(run.request.sources()), auditStatus)));
        return outcome(run, status, null, null, error);
    }

    private static ProposalOutcome outcome(Run run, ProposalStatus status, String url, String branch, String error) {
        return new ProposalOutcome(run.proposalId, status, url, branch, run.reports, run.contentHash(),
                error, run.auditIds);
    }

    private static String failureSummary(List<ValidationReport> reports) {
        var parts = new ArrayList<String>();
        for (ValidationReport r : reports) {
            if (r.status().isFailure()) {
                String stage = r.failedStage() != null ? " at " + r.failedStage().wireName() : "";
                parts.add(r.tool() + stage);
            }
        }
        return String.join(", ", parts);
    }

    String nextProposalId() {
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("FOPS-%d-%04d", year, proposalCounter.incrementAndGet());
    }

    /** Mutable state of one run; confined to the calling thread. */
    private static final class Run {
        final String proposalId;
        final ProposalRequest request;
        final List<ValidationReport> reports = new ArrayList<>();
        final List<String> auditIds = new ArrayList<>();
        ValidationReport terraform;
        ValidationReport helm;
        ValidationReport pipeline;
        private FileSet files;

        Run(String proposalId, ProposalRequest request) {
            this.proposalId = proposalId;
            this.request = request;
        }

        FileSet files() {
            if (files == null) {
                files = request instanceof InfrastructureProposal infra
                        ? infra.repositoryFiles()
                        : ((PipelineProposal) request).repositoryFiles();
            }
            return files;
        }

        String contentHash() {
            return files().fingerprint();
        }
    }
}
