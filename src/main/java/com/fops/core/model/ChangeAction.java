package com.fops.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Action Terraform plans to take on a resource, named as in the {@code -json}
 * plan stream. Only {@link #CREATE}, {@link #UPDATE} and {@link #DELETE} count
 * towards a {@link PlanSummary}; a {@link #REPLACE} is reported as itself so it
 * stays visible to reviewers.
 */
public enum ChangeAction {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete"),
    REPLACE("replace"),
    READ("read"),
    NO_OP("noop"),
    MOVE("move"),
    IMPORT("import"),
    REMOVE("remove"),
    UNKNOWN("unknown");

    private final String wireName;

    ChangeAction(String wireName) {
        this.wireName = wireName;
    }

    public static ChangeAction fromWire(String action) {
        if (action == null) {
            return UNKNOWN;
        }
        for (ChangeAction candidate : values()) {
            if (candidate.wireName.equals(action)) {
                return candidate;
            }
        }
        return "no-op".equals(action) ? NO_OP : UNKNOWN;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
