package com.fops.core.engine;

import com.fops.core.model.KnowledgeSource;

import java.util.List;

/**
 * One proposal to validate and publish. Each variant carries its own typed
 * payload.
 */
public sealed interface ProposalRequest permits InfrastructureProposal, PipelineProposal {

    String repoUrl();

    /** Knowledge-store hits the generated content was based on, in retrieval order. */
    List<KnowledgeSource> sources();

    /** Branch-name kind, e.g. {@code pipeline}. */
    String branchKind();

    String title();
}
