package com.fops.validation;

import com.fops.core.metrics.FopsMetrics;
import com.fops.core.model.LintResult;
import com.fops.core.model.SandboxStage;
import com.fops.core.model.ValidationReport;
import com.fops.core.model.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Syntax check for generated CI/CD pipeline files. Runs in-process; no tool binary
 * is involved.
 */
@Component
public class PipelineSyntaxValidator {

    private static final Logger log = LoggerFactory.getLogger(PipelineSyntaxValidator.class);

    static final String TOOL = "yaml";

    private final FopsMetrics metrics;

    public PipelineSyntaxValidator(@Autowired(required = false) FopsMetrics metrics) {
        this.metrics = metrics;
    }

    public ValidationReport validate(String path, String content) {
        var report = ValidationReport.builder(TOOL).rawOutput(content == null ? "" : content);
        var warnings = new ArrayList<String>();
        var errors = new ArrayList<String>();

        if (content == null || content.isBlank()) {
            errors.add("Pipeline file " + path + " is empty");
        } else {
            try {
                var documents = new ArrayList<Object>();
                new Yaml(new SafeConstructor(new LoaderOptions())).loadAll(content).forEach(documents::add);
                checkStructure(path, documents, warnings, errors);
            } catch (YAMLException e) {
                errors.add("Invalid YAML in " + path + ": " + e.getMessage());
            }
        }

        report.lint(new LintResult(errors.isEmpty(), warnings, errors, List.of()));
        if (errors.isEmpty()) {
            report.status(ValidationStatus.SUCCESS);
        } else {
            report.status(ValidationStatus.FAILED).failedStage(SandboxStage.VALIDATE);
            errors.forEach(report::error);
        }
        ValidationReport result = report.build();
        log.info("Pipeline {} syntax check: {}", path, result.status().wireName());
        if (metrics != null) {
            metrics.recordValidation(TOOL, result.status().wireName());
        }
        return result;
    }

    private static void checkStructure(String path, List<Object> documents,
                                       List<String> warnings, List<String> errors) {
        if (documents.isEmpty() || !(documents.get(0) instanceof Map<?, ?> root)) {
            errors.add("Pipeline " + path + " must be a YAML mapping");
            return;
        }
        if (path.startsWith(".github/workflows/")) {
            if (!root.containsKey("jobs")) {
                errors.add("Workflow " + path + " has no jobs");
            }
            // YAML 1.1 reads a bare `on` key as boolean true
            if (!root.containsKey("on") && !root.containsKey(Boolean.TRUE)) {
                warnings.add("Workflow " + path + " has no trigger (on:)");
            }
        } else if (root.isEmpty()) {
            errors.add("Pipeline " + path + " defines nothing");
        }
    }
}
