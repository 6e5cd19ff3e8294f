package com.fops.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named stage of a chained tool run. A failed report carries the stage it
 * stopped at, so callers can locate failures without matching tool text.
 */
public enum SandboxStage {
    INIT,
    PLAN,
    LINT,
    DRY_RUN,
    TEMPLATE,
    VALIDATE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
