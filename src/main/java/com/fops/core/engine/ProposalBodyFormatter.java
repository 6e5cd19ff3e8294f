package com.fops.core.engine;

import com.fops.core.model.ChangeAction;
import com.fops.core.model.PlanSummary;
import com.fops.core.model.ValidationReport;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders PR/MR descriptions. Citations are appended separately by
 * {@link com.fops.core.citation.CitationTracker}.
 */
@Component
public class ProposalBodyFormatter {

    static final String NO_SOURCES = "No knowledge base sources referenced.";

    public String infrastructure(InfrastructureProposal request, ValidationReport terraform,
                                 ValidationReport helm, String contentHash) {
        var sb = new StringBuilder();
        sb.append("# F-Ops Generated Infrastructure Configuration\n\n");
        sb.append("This PR adds infrastructure configuration for **").append(request.target())
          .append("** deployment generated by F-Ops.\n\n");

        sb.append("## Configuration Summary\n");
        sb.append("- **Target Platform**: ").append(request.target()).append('\n');
        sb.append("- **Environments**: ").append(String.join(", ", request.environments())).append('\n');
        sb.append("- **Domain**: ").append(request.domain() == null ? "" : request.domain()).append("\n\n");

        sb.append("## Generated Components\n");
        if (!request.terraformFiles().isEmpty()) {
            sb.append("- Terraform configuration under `").append(InfrastructureProposal.TERRAFORM_ROOT)
              .append("/` (").append(request.terraformFiles().size()).append(" files)\n");
        }
        if (!request.helmChart().isEmpty()) {
            sb.append("- Helm chart under `").append(InfrastructureProposal.CHART_ROOT)
              .append("/` (").append(request.helmChart().size()).append(" files)\n");
        }

        sb.append("\n## Validation Results\n");
        if (terraform != null) {
            PlanSummary plan = terraform.summary();
            sb.append("\n### Terraform Plan\n");
            sb.append("- **Status**: ").append(terraform.status().wireName()).append('\n');
            sb.append("- **Resources to add**: ").append(plan.add()).append('\n');
            sb.append("- **Resources to change**: ").append(plan.change()).append('\n');
            sb.append("- **Resources to destroy**: ").append(plan.destroy()).append('\n');
            terraform.resourceChanges().stream()
                    .filter(rc -> rc.action() == ChangeAction.REPLACE)
                    .forEach(rc -> sb.append("- **Replace**: `").append(rc.address()).append("`\n"));
            appendFailure(sb, terraform);
        }
        if (helm != null) {
            sb.append("\n### Helm Dry-Run\n");
            sb.append("- **Status**: ").append(helm.status().wireName()).append('\n');
            sb.append("- **Lint passed**: ").append(helm.lint().passed() ? "yes" : "no").append('\n');
            sb.append("- **Manifests generated**: ").append(helm.manifests().size()).append('\n');
            appendFailure(sb, helm);
        }

        appendSourcesAndFooter(sb, request.sources().isEmpty(), contentHash,
                "*Review all changes and plan outputs before merging*");
        return sb.toString();
    }

    public String pipeline(PipelineProposal request, ValidationReport validation, String contentHash) {
        var sb = new StringBuilder();
        sb.append("# F-Ops Generated CI/CD Pipeline\n\n");
        sb.append("This PR adds the CI/CD pipeline `").append(request.pipelinePath())
          .append("` generated by F-Ops.\n\n");

        sb.append("## Validation Results\n");
        sb.append("- **Status**: ").append(validation.status().wireName()).append('\n');
        sb.append("- **Syntax Check**: ").append(validation.status().isFailure() ? "failed" : "passed").append('\n');
        List<String> warnings = validation.lint().warnings();
        for (String warning : warnings) {
            sb.append("- Warning: ").append(warning).append('\n');
        }
        appendFailure(sb, validation);

        appendSourcesAndFooter(sb, request.sources().isEmpty(), contentHash,
                "*Review all changes before merging*");
        return sb.toString();
    }

    private static void appendFailure(StringBuilder sb, ValidationReport report) {
        if (report.failedStage() != null) {
            sb.append("- **Failed stage**: ").append(report.failedStage().wireName()).append('\n');
        }
        for (String error : report.errors()) {
            sb.append("- Error: ").append(error.lines().findFirst().orElse("")).append('\n');
        }
    }

    private static void appendSourcesAndFooter(StringBuilder sb, boolean noSources, String contentHash,
                                               String reviewNote) {
        if (noSources) {
            sb.append("\n## Knowledge Base Citations\n").append(NO_SOURCES).append('\n');
        }
        sb.append("\nContent fingerprint: `").append(contentHash).append("`\n");
        sb.append("\n---\n*Generated by F-Ops*\n").append(reviewNote);
    }
}
