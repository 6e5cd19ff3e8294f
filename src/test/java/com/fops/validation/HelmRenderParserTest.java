package com.fops.validation;

import com.fops.core.model.LintResult;
import com.fops.core.model.SandboxStage;
import com.fops.core.model.ValidationReport;
import com.fops.core.model.ValidationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.fops.validation.Fixtures.read;
import static com.fops.validation.Fixtures.result;
import static org.junit.jupiter.api.Assertions.*;

class HelmRenderParserTest {

    private final HelmLintParser lintParser = new HelmLintParser();
    private final HelmRenderParser parser = new HelmRenderParser(new ManifestStreamExtractor(), lintParser);

    @Test
    @DisplayName("deployment, service and notes from a successful dry-run")
    void successfulDryRun() {
        ValidationReport report = parser.parse(result("helm", SandboxStage.DRY_RUN, 0, read("helm-dry-run.txt"), ""));

        assertEquals(ValidationStatus.SUCCESS, report.status());
        assertEquals(2, report.manifests().size());
        assertEquals(2, report.manifestSummary().totalCount());
        assertEquals(1, report.manifestSummary().byKind().get("Deployment"));
        assertEquals(1, report.manifestSummary().byKind().get("Service"));
        assertTrue(report.manifestSummary().hasServices());
        assertEquals("1. Get the application URL by running:\n  kubectl port-forward svc/test-release-web 8080:80",
                report.notes());
        assertFalse(report.lint().passed());
    }

    @Test
    @DisplayName("lint findings are attached but do not decide status")
    void lintAttached() {
        var lint = result("helm", SandboxStage.LINT, 1, read("helm-lint.txt"), "");
        var dryRun = result("helm", SandboxStage.DRY_RUN, 0, read("helm-dry-run.txt"), "");
        ValidationReport report = parser.parse(lint, dryRun);

        assertEquals(ValidationStatus.SUCCESS, report.status());
        LintResult lintResult = report.lint();
        assertFalse(lintResult.passed());
        assertEquals(1, lintResult.warningCount());
        assertEquals(1, lintResult.errorCount());
    }

    @Test
    @DisplayName("a failing dry-run is failed at dry_run with stderr")
    void failedDryRun() {
        ValidationReport report = parser.parse(result("helm", SandboxStage.DRY_RUN, 1, "",
                "Error: INSTALLATION FAILED: template: web/templates/deployment.yaml:7: function \"foo\" not defined\n"));

        assertEquals(ValidationStatus.FAILED, report.status());
        assertEquals(SandboxStage.DRY_RUN, report.failedStage());
        assertTrue(report.errors().get(0).startsWith("Error: INSTALLATION FAILED"));
        assertTrue(report.manifests().isEmpty());
    }

    @Test
    @DisplayName("a timed-out dry-run is failed with the timeout reason")
    void timedOut() {
        ValidationReport report = parser.parse(Fixtures.timedOut("helm", SandboxStage.DRY_RUN));
        assertEquals(ValidationStatus.FAILED, report.status());
        assertEquals("helm dry_run timed out after 120s", report.errors().get(0));
    }

    @Test
    @DisplayName("notes stop at the next document and are empty when absent")
    void extractNotes() {
        assertEquals("hello", HelmRenderParser.extractNotes("NOTES:\n  hello\n---\nkind: X"));
        assertEquals("", HelmRenderParser.extractNotes("---\nkind: Service\n"));
    }
}
