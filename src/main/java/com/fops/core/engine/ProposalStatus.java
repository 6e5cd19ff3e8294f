package com.fops.core.engine;

public enum ProposalStatus {
    /** Branch and PR/MR created. */
    PUBLISHED,
    /** Refused by configuration: allow-list, credentials or platform. */
    REJECTED,
    /** Validation failed and failed validations are not published. */
    VALIDATION_FAILED,
    /** The platform rejected or failed the publish. */
    PUBLISH_FAILED
}
