package com.fops.core.engine;

import com.fops.core.model.ValidationReport;

import java.util.List;

/**
 * Structured result of one proposal run.
 *
 * @param proposalId  id used in logs for this run
 * @param status      final status
 * @param proposalUrl PR/MR URL when published
 * @param branchName  branch the files were pushed to, null if never published
 * @param reports     validation reports in execution order
 * @param contentHash fingerprint of the proposed files
 * @param error       why the run did not publish, or why artifacts were not attached
 * @param auditIds    audit entries written during the run, in completion order
 */
public record ProposalOutcome(
    String proposalId,
    ProposalStatus status,
    String proposalUrl,
    String branchName,
    List<ValidationReport> reports,
    String contentHash,
    String error,
    List<String> auditIds
) {
    public ProposalOutcome {
        reports = List.copyOf(reports);
        auditIds = List.copyOf(auditIds);
    }

    public boolean published() {
        return status == ProposalStatus.PUBLISHED;
    }
}
