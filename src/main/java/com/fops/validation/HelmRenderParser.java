package com.fops.validation;

import com.fops.core.model.LintResult;
import com.fops.core.model.ManifestRecord;
import com.fops.core.model.ValidationReport;
import com.fops.core.model.ValidationStatus;
import com.fops.sandbox.SandboxResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a Helm dry-run: rendered manifests, the NOTES section and, when a lint run
 * is supplied, its findings. Status comes from the dry-run alone.
 */
@Component
public class HelmRenderParser implements ToolOutputParser {

    static final String TOOL = "helm";

    private final ManifestStreamExtractor extractor;
    private final HelmLintParser lintParser;

    public HelmRenderParser(ManifestStreamExtractor extractor, HelmLintParser lintParser) {
        this.extractor = extractor;
        this.lintParser = lintParser;
    }

    @Override
    public ValidationReport parse(SandboxResult dryRun) {
        return parse(null, dryRun);
    }

    /**
     * @param lint   lint run, or null when lint was not run
     * @param dryRun dry-run output
     */
    public ValidationReport parse(SandboxResult lint, SandboxResult dryRun) {
        var report = ValidationReport.builder(TOOL).rawOutput(dryRun.stdout());
        if (lint != null) {
            LintResult lintResult = lintParser.parse(lint);
            report.lint(lintResult);
        }

        if (!dryRun.completed()) {
            return report.status(ValidationStatus.FAILED)
                    .failedStage(dryRun.stage())
                    .error(dryRun.failureReason())
                    .build();
        }

        List<ManifestRecord> manifests = extractor.extract(dryRun.stdout());
        report.manifests(manifests).notes(extractNotes(dryRun.stdout()));

        if (dryRun.exitCode() == 0) {
            report.status(ValidationStatus.SUCCESS);
        } else {
            String stderr = dryRun.stderr().trim();
            report.status(ValidationStatus.FAILED)
                    .failedStage(dryRun.stage())
                    .error(stderr.isEmpty() ? "helm exited with code " + dryRun.exitCode() : stderr);
        }
        return report.build();
    }

    /**
     * Lines after the first line containing {@code NOTES:}, up to the next line
     * starting with {@code ---} or {@code apiVersion:}, trimmed as a block.
     */
    static String extractNotes(String output) {
        String[] lines = output.split("\n", -1);
        int start = -1;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].contains("NOTES:")) {
                start = i + 1;
                break;
            }
        }
        if (start < 0) {
            return "";
        }
        var notes = new ArrayList<String>();
        for (int i = start; i < lines.length; i++) {
            if (lines[i].startsWith("---") || lines[i].startsWith("apiVersion:")) {
                break;
            }
            notes.add(lines[i]);
        }
        return String.join("\n", notes).strip();
    }
}
