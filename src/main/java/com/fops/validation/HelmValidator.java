package com.fops.validation;

import com.fops.core.metrics.FopsMetrics;
import com.fops.core.model.FileSet;
import com.fops.core.model.SandboxStage;
import com.fops.core.model.ValidationReport;
import com.fops.core.model.ValidationStatus;
import com.fops.core.security.AccessGuard;
import com.fops.sandbox.ChainResult;
import com.fops.sandbox.SandboxProperties;
import com.fops.sandbox.SandboxResult;
import com.fops.sandbox.SandboxRunner;
import com.fops.sandbox.StageCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates a Helm chart with {@code helm lint} and a {@code --dry-run} install.
 *
 * <p>Lint findings are reported but do not stop the dry run. Only a lint run that
 * timed out or could not be started ends the chain early.
 */
@Service
public class HelmValidator {

    private static final Logger log = LoggerFactory.getLogger(HelmValidator.class);

    static final String CHART_DIR = "chart";
    static final String VALUES_FILE = "custom-values.yaml";

    private final SandboxRunner runner;
    private final HelmRenderParser parser;
    private final HelmLintParser lintParser;
    private final AccessGuard guard;
    private final SandboxProperties properties;
    private final FopsMetrics metrics;

    public HelmValidator(SandboxRunner runner, HelmRenderParser parser, HelmLintParser lintParser,
                         AccessGuard guard, SandboxProperties properties,
                         @Autowired(required = false) FopsMetrics metrics) {
        this.runner = runner;
        this.parser = parser;
        this.lintParser = lintParser;
        this.guard = guard;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Lints and dry-run installs {@code chart}, whose paths are relative to the
     * chart root ({@code Chart.yaml}, {@code templates/...}).
     *
     * @throws com.fops.core.security.NotAllowListedException if the namespace is not allowed
     */
    public ValidationReport dryRun(FileSet chart, HelmOptions options) {
        guard.authorizeNamespace(options.namespace());

        if (chart.isEmpty()) {
            return record(ValidationReport.failed(HelmRenderParser.TOOL, SandboxStage.VALIDATE,
                    "Helm chart configuration is required"));
        }

        FileSet files = chart.prefixed(CHART_DIR);
        var installArgs = new ArrayList<>(List.of("install", options.releaseName(), CHART_DIR,
                "--dry-run", "--debug", "--namespace", options.namespace()));
        if (!options.values().isEmpty()) {
            files = files.merge(FileSet.of(Map.of(VALUES_FILE, dumpValues(options.values()))));
            installArgs.add("-f");
            installArgs.add(VALUES_FILE);
        }

        String binary = properties.getHelmBinary();
        var lint = new StageCommand(SandboxStage.LINT, binary, List.of("lint", CHART_DIR), Map.of(),
                Duration.ofSeconds(properties.getLintTimeoutSeconds()), false);
        var install = new StageCommand(SandboxStage.DRY_RUN, binary, installArgs, Map.of(),
                Duration.ofSeconds(properties.getDryRunTimeoutSeconds()), true);

        log.info("Running helm dry-run for release {} in namespace {}", options.releaseName(), options.namespace());
        ChainResult chain = runner.runChain(files, List.of(lint, install));
        SandboxResult lintRun = chain.stage(SandboxStage.LINT);

        if (chain.shortCircuited()) {
            SandboxResult failed = chain.last();
            var report = ValidationReport.builder(HelmRenderParser.TOOL)
                    .status(ValidationStatus.FAILED)
                    .failedStage(chain.failedStage())
                    .rawOutput(failed.stdout())
                    .error(failed.failureReason());
            if (lintRun != null) {
                report.lint(lintParser.parse(lintRun));
            }
            return record(report.build());
        }
        return record(parser.parse(lintRun, chain.stage(SandboxStage.DRY_RUN)));
    }

    private static String dumpValues(Map<String, Object> values) {
        var options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(values);
    }

    private ValidationReport record(ValidationReport report) {
        log.info("Helm validation finished: {} ({} manifests, lint passed={})", report.status().wireName(),
                report.manifests().size(), report.lint().passed());
        if (metrics != null) {
            metrics.recordValidation(report.tool(), report.status().wireName());
        }
        return report;
    }
}
