package com.fops.core.engine;

import com.fops.core.model.FileSet;
import com.fops.core.model.KnowledgeSource;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single generated CI/CD pipeline file.
 */
public record PipelineProposal(
    String repoUrl,
    String pipelinePath,
    String pipelineContent,
    List<KnowledgeSource> sources
) implements ProposalRequest {

    public PipelineProposal {
        Objects.requireNonNull(repoUrl, "repoUrl");
        Objects.requireNonNull(pipelinePath, "pipelinePath");
        pipelineContent = pipelineContent == null ? "" : pipelineContent;
        sources = sources == null ? List.of() : List.copyOf(sources);
        // rejects traversal and absolute paths up front
        FileSet.of(Map.of(pipelinePath, pipelineContent));
    }

    @Override
    public String branchKind() {
        return "pipeline";
    }

    @Override
    public String title() {
        return "[F-Ops] Add CI/CD Pipeline";
    }

    public FileSet repositoryFiles() {
        return FileSet.of(Map.of(pipelinePath, pipelineContent));
    }
}
