package com.fops.validation;

import com.fops.core.model.FileSet;
import com.fops.core.model.SandboxStage;
import com.fops.core.model.ValidationReport;
import com.fops.core.model.ValidationStatus;
import com.fops.core.security.AccessGuard;
import com.fops.core.security.NotAllowListedException;
import com.fops.core.security.SecurityProperties;
import com.fops.sandbox.ChainResult;
import com.fops.sandbox.SandboxProperties;
import com.fops.sandbox.SandboxRunner;
import com.fops.sandbox.StageCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static com.fops.validation.Fixtures.read;
import static com.fops.validation.Fixtures.result;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HelmValidatorTest {

    private static final FileSet CHART = FileSet.of(Map.of(
            "Chart.yaml", "apiVersion: v2\nname: web\nversion: 0.1.0\n",
            "values.yaml", "replicaCount: 1\n",
            "templates/deployment.yaml", "kind: Deployment\n"));

    private SandboxRunner runner;
    private HelmValidator validator;

    @BeforeEach
    void setUp() {
        runner = mock(SandboxRunner.class);
        var security = new SecurityProperties();
        security.setAllowedNamespaces(List.of("default", "staging"));
        var lintParser = new HelmLintParser();
        validator = new HelmValidator(runner, new HelmRenderParser(new ManifestStreamExtractor(), lintParser),
                lintParser, new AccessGuard(security), new SandboxProperties(), null);
    }

    @Test
    @DisplayName("lints, dry-runs and parses the rendered manifests")
    @SuppressWarnings("unchecked")
    void lintThenDryRun() {
        when(runner.runChain(any(), any())).thenReturn(new ChainResult(List.of(
                result("helm", SandboxStage.LINT, 0, "[INFO] Chart.yaml: icon is recommended\n", ""),
                result("helm", SandboxStage.DRY_RUN, 0, read("helm-dry-run.txt"), "")), null));

        ValidationReport report = validator.dryRun(CHART, new HelmOptions("web", "staging", Map.of("replicaCount", 3)));

        assertEquals(ValidationStatus.SUCCESS, report.status());
        assertEquals(2, report.manifests().size());
        assertTrue(report.lint().passed());
        assertEquals(1, report.lint().info().size());

        ArgumentCaptor<FileSet> files = ArgumentCaptor.forClass(FileSet.class);
        ArgumentCaptor<List<StageCommand>> stages = ArgumentCaptor.forClass(List.class);
        verify(runner).runChain(files.capture(), stages.capture());

        assertNotNull(files.getValue().content("chart/Chart.yaml"));
        assertEquals("replicaCount: 3\n", files.getValue().content(HelmValidator.VALUES_FILE));

        StageCommand lint = stages.getValue().get(0);
        StageCommand install = stages.getValue().get(1);
        assertEquals(List.of("lint", "chart"), lint.args());
        assertFalse(lint.haltOnFailure());
        assertEquals(List.of("install", "web", "chart", "--dry-run", "--debug", "--namespace", "staging",
                "-f", "custom-values.yaml"), install.args());
        assertEquals("helm", install.tool());
    }

    @Test
    @DisplayName("a failing lint does not stop the dry-run")
    void lintFailureContinues() {
        when(runner.runChain(any(), any())).thenReturn(new ChainResult(List.of(
                result("helm", SandboxStage.LINT, 1, read("helm-lint.txt"), ""),
                result("helm", SandboxStage.DRY_RUN, 0, read("helm-dry-run.txt"), "")), null));

        ValidationReport report = validator.dryRun(CHART, HelmOptions.defaults());

        assertEquals(ValidationStatus.SUCCESS, report.status());
        assertFalse(report.lint().passed());
        assertEquals(1, report.lint().errorCount());
    }

    @Test
    @DisplayName("a lint timeout short-circuits with failed_stage=lint")
    void lintTimeout() {
        when(runner.runChain(any(), any())).thenReturn(new ChainResult(List.of(
                Fixtures.timedOut("helm", SandboxStage.LINT)), SandboxStage.LINT));

        ValidationReport report = validator.dryRun(CHART, HelmOptions.defaults());

        assertEquals(ValidationStatus.FAILED, report.status());
        assertEquals(SandboxStage.LINT, report.failedStage());
        assertEquals("helm lint timed out after 120s", report.errors().get(0));
    }

    @Test
    @DisplayName("no values means no -f flag")
    @SuppressWarnings("unchecked")
    void noValuesFile() {
        when(runner.runChain(any(), any())).thenReturn(new ChainResult(List.of(
                result("helm", SandboxStage.LINT, 0, "", ""),
                result("helm", SandboxStage.DRY_RUN, 0, "", "")), null));

        validator.dryRun(CHART, HelmOptions.defaults());

        ArgumentCaptor<FileSet> files = ArgumentCaptor.forClass(FileSet.class);
        ArgumentCaptor<List<StageCommand>> stages = ArgumentCaptor.forClass(List.class);
        verify(runner).runChain(files.capture(), stages.capture());
        assertFalse(stages.getValue().get(1).args().contains("-f"));
        assertNull(files.getValue().content(HelmValidator.VALUES_FILE));
    }

    @Test
    @DisplayName("an empty chart fails without touching the sandbox")
    void emptyChart() {
        ValidationReport report = validator.dryRun(FileSet.empty(), HelmOptions.defaults());
        assertEquals(ValidationStatus.FAILED, report.status());
        verifyNoInteractions(runner);
    }

    @Test
    @DisplayName("a namespace outside the allow-list is rejected")
    void namespaceNotAllowed() {
        assertThrows(NotAllowListedException.class,
                () -> validator.dryRun(CHART, new HelmOptions("web", "kube-system", Map.of())));
        verifyNoInteractions(runner);
    }
}
