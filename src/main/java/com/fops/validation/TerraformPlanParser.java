package com.fops.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fops.core.model.ChangeAction;
import com.fops.core.model.DriftRecord;
import com.fops.core.model.ResourceChange;
import com.fops.core.model.ValidationReport;
import com.fops.core.model.ValidationStatus;
import com.fops.sandbox.SandboxResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses the newline-delimited JSON stream of {@code terraform plan -json}.
 *
 * <p>Exit codes follow {@code -detailed-exitcode}: 0 means no changes, 2 means a
 * valid plan with changes, anything else is a failure. An {@code error}-level
 * message fails the report whatever the exit code.
 */
@Component
public class TerraformPlanParser implements ToolOutputParser {

    private static final Logger log = LoggerFactory.getLogger(TerraformPlanParser.class);

    static final String TOOL = "terraform";

    private final ObjectMapper objectMapper;

    public TerraformPlanParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ValidationReport parse(SandboxResult raw) {
        var report = ValidationReport.builder(TOOL).rawOutput(raw.stdout());

        if (!raw.completed()) {
            return report.status(ValidationStatus.FAILED)
                    .failedStage(raw.stage())
                    .error(raw.failureReason())
                    .build();
        }

        int skipped = 0;
        for (String line : raw.stdout().split("\n")) {
            if (line.isBlank()) continue;
            JsonNode message;
            try {
                message = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                skipped++;
                continue;
            }
            if (message == null || !message.isObject()) {
                skipped++;
                continue;
            }
            apply(message, report);
        }
        if (skipped > 0) {
            log.debug("Skipped {} non-JSON plan lines", skipped);
        }

        ValidationStatus status = switch (raw.exitCode()) {
            case 0 -> ValidationStatus.NO_CHANGES;
            case 2 -> ValidationStatus.CHANGES_REQUIRED;
            default -> ValidationStatus.FAILED;
        };
        if (report.hasErrors()) {
            status = ValidationStatus.FAILED;
        }
        if (status == ValidationStatus.FAILED) {
            report.failedStage(raw.stage());
            if (!report.hasErrors()) {
                report.error(firstNonBlank(raw.stderr().trim(),
                        "terraform exited with code " + raw.exitCode()));
            }
        }
        return report.status(status).build();
    }

    private void apply(JsonNode message, ValidationReport.Builder report) {
        if ("error".equals(message.path("@level").asText())) {
            report.error(errorText(message));
            return;
        }
        String type = message.path("type").asText();
        JsonNode change = message.path("change");
        JsonNode resource = change.path("resource");
        switch (type) {
            case "planned_change" -> report.resourceChange(new ResourceChange(
                    resource.path("resource_type").asText("unknown"),
                    resource.path("resource_name").asText("unknown"),
                    ChangeAction.fromWire(textOrNull(change.path("action"))),
                    resource.path("provider_name").asText(""),
                    resource.path("resource").asText("")));
            case "resource_drift" -> report.drift(new DriftRecord(
                    resource.path("resource_type").asText("unknown"),
                    resource.path("resource_name").asText("unknown"),
                    change.path("action").asText("unknown")));
            default -> { }
        }
    }

    private static String errorText(JsonNode message) {
        String text = message.path("@message").asText("");
        JsonNode diagnostic = message.path("diagnostic");
        String detail = diagnostic.path("detail").asText("");
        if (!detail.isBlank()) {
            text = text.isBlank() ? detail : text + ": " + detail;
        }
        return firstNonBlank(text, "terraform reported an error");
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static String firstNonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
