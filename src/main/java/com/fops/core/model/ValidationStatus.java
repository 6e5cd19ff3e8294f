package com.fops.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValidationStatus {
    SUCCESS("success"),
    NO_CHANGES("no_changes"),
    CHANGES_REQUIRED("changes_required"),
    FAILED("failed");

    private final String wireName;

    ValidationStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isFailure() {
        return this == FAILED;
    }
}
