package com.fops.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A reviewable, unapplied change: what gets pushed to one new branch and
 * opened as one pull/merge request.
 */
public record Proposal(
    String repoUrl,
    String branchName,
    String title,
    String body,
    FileSet files,
    List<ValidationReport> validationReports,
    List<Citation> citations
) implements Serializable {

    public Proposal {
        validationReports = List.copyOf(validationReports);
        citations = List.copyOf(citations);
    }
}
