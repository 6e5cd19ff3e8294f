package com.fops.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalized, immutable result of validating one artifact set with one tool.
 *
 * <p>Change counters are never stored: {@link #summary()} partitions
 * {@link #resourceChanges()} on every call, so the counts and the resource list
 * cannot disagree.
 *
 * @param tool            tool that produced the raw output ({@code terraform}, {@code helm}, {@code yaml})
 * @param status          overall classification
 * @param failedStage     stage a chained run stopped at, or null
 * @param resourceChanges planned changes in emission order
 * @param drift           drifted resources, kept apart from the counters
 * @param manifests       rendered resources that carry a {@code kind}
 * @param manifestSummary aggregate over {@code manifests}
 * @param lint            lint findings
 * @param notes           chart NOTES section, empty when absent
 * @param rawOutput       raw stdout of the last stage that ran
 * @param errors          error messages collected from the tool
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationReport(
    String tool,
    ValidationStatus status,
    SandboxStage failedStage,
    List<ResourceChange> resourceChanges,
    List<DriftRecord> drift,
    List<ManifestRecord> manifests,
    ManifestSummary manifestSummary,
    LintResult lint,
    String notes,
    String rawOutput,
    List<String> errors
) implements Serializable {

    public ValidationReport {
        resourceChanges = List.copyOf(resourceChanges);
        drift = List.copyOf(drift);
        manifests = List.copyOf(manifests);
        errors = List.copyOf(errors);
        if (manifestSummary == null) {
            manifestSummary = ManifestSummary.of(manifests);
        }
        if (lint == null) {
            lint = LintResult.notRun();
        }
        if (notes == null) {
            notes = "";
        }
        if (rawOutput == null) {
            rawOutput = "";
        }
    }

    @JsonProperty("summary")
    public PlanSummary summary() {
        return PlanSummary.of(resourceChanges);
    }

    public static Builder builder(String tool) {
        return new Builder(tool);
    }

    /**
     * Failed report for a run that never produced parseable output.
     */
    public static ValidationReport failed(String tool, SandboxStage stage, String error) {
        return builder(tool)
                .status(ValidationStatus.FAILED)
                .failedStage(stage)
                .error(error)
                .build();
    }

    public static final class Builder {
        private final String tool;
        private ValidationStatus status = ValidationStatus.SUCCESS;
        private SandboxStage failedStage;
        private final List<ResourceChange> resourceChanges = new ArrayList<>();
        private final List<DriftRecord> drift = new ArrayList<>();
        private final List<ManifestRecord> manifests = new ArrayList<>();
        private ManifestSummary manifestSummary;
        private LintResult lint;
        private String notes = "";
        private String rawOutput = "";
        private final List<String> errors = new ArrayList<>();

        private Builder(String tool) {
            this.tool = tool;
        }

        public Builder status(ValidationStatus status) { this.status = status; return this; }
        public Builder failedStage(SandboxStage failedStage) { this.failedStage = failedStage; return this; }
        public Builder resourceChange(ResourceChange change) { this.resourceChanges.add(change); return this; }
        public Builder drift(DriftRecord record) { this.drift.add(record); return this; }
        public Builder manifests(List<ManifestRecord> manifests) { this.manifests.addAll(manifests); return this; }
        public Builder manifestSummary(ManifestSummary summary) { this.manifestSummary = summary; return this; }
        public Builder lint(LintResult lint) { this.lint = lint; return this; }
        public Builder notes(String notes) { this.notes = notes; return this; }
        public Builder rawOutput(String rawOutput) { this.rawOutput = rawOutput; return this; }
        public Builder error(String error) { if (error != null && !error.isBlank()) this.errors.add(error); return this; }

        public ValidationStatus currentStatus() {
            return status;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public ValidationReport build() {
            return new ValidationReport(tool, status, failedStage, resourceChanges, drift,
                    manifests, manifestSummary, lint, notes, rawOutput, errors);
        }
    }
}
