package com.fops.publish;

import com.fops.core.model.FileSet;
import com.fops.core.model.Proposal;

import java.util.Objects;

/**
 * @param repoUrl    repository web URL, e.g. {@code https://github.com/acme/shop}
 * @param branchName branch to create or reuse
 * @param baseBranch branch to fork from and target; null for the configured default
 * @param files      files to commit, repository-relative
 * @param title      PR/MR title
 * @param body       PR/MR description
 */
public record PublishRequest(
    String repoUrl,
    String branchName,
    String baseBranch,
    FileSet files,
    String title,
    String body
) {
    public PublishRequest {
        Objects.requireNonNull(repoUrl, "repoUrl");
        Objects.requireNonNull(branchName, "branchName");
        files = files == null ? FileSet.empty() : files;
        body = body == null ? "" : body;
    }

    public static PublishRequest of(Proposal proposal) {
        return new PublishRequest(proposal.repoUrl(), proposal.branchName(), null,
                proposal.files(), proposal.title(), proposal.body());
    }
}
