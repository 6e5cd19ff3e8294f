package com.fops.core.engine;

import com.fops.core.model.FileSet;
import com.fops.core.model.KnowledgeSource;
import com.fops.validation.HelmOptions;
import com.fops.validation.TerraformOptions;

import java.util.List;
import java.util.Objects;

/**
 * Terraform configuration and/or a Helm chart for one deployment target.
 * Terraform files land under {@code infra/}, the chart under {@code deploy/chart/}.
 */
public record InfrastructureProposal(
    String repoUrl,
    String target,
    List<String> environments,
    String domain,
    FileSet terraformFiles,
    FileSet helmChart,
    TerraformOptions terraformOptions,
    HelmOptions helmOptions,
    List<KnowledgeSource> sources
) implements ProposalRequest {

    static final String TERRAFORM_ROOT = "infra";
    static final String CHART_ROOT = "deploy/chart";

    public InfrastructureProposal {
        Objects.requireNonNull(repoUrl, "repoUrl");
        Objects.requireNonNull(target, "target");
        environments = environments == null ? List.of() : List.copyOf(environments);
        terraformFiles = terraformFiles == null ? FileSet.empty() : terraformFiles;
        helmChart = helmChart == null ? FileSet.empty() : helmChart;
        terraformOptions = terraformOptions == null ? TerraformOptions.defaults() : terraformOptions;
        helmOptions = helmOptions == null ? HelmOptions.defaults() : helmOptions;
        sources = sources == null ? List.of() : List.copyOf(sources);
        if (terraformFiles.isEmpty() && helmChart.isEmpty()) {
            throw new IllegalArgumentException("Infrastructure proposal needs Terraform files or a Helm chart");
        }
    }

    @Override
    public String branchKind() {
        return "infrastructure-" + target;
    }

    @Override
    public String title() {
        return "[F-Ops] Add " + target + " infrastructure configuration";
    }

    /**
     * All files re-rooted to their repository locations.
     */
    public FileSet repositoryFiles() {
        return terraformFiles.prefixed(TERRAFORM_ROOT).merge(helmChart.prefixed(CHART_ROOT));
    }
}
