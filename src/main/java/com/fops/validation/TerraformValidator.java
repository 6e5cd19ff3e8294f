package com.fops.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
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

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Validates Terraform configurations with {@code init} followed by a JSON plan.
 * Nothing is ever applied: init runs without a backend and plan never locks state.
 */
@Service
public class TerraformValidator {

    private static final Logger log = LoggerFactory.getLogger(TerraformValidator.class);

    static final String VARS_FILE = "terraform.tfvars.json";

    private static final Map<String, String> AUTOMATION_ENV = Map.of(
            "TF_IN_AUTOMATION", "1",
            "TF_INPUT", "0");

    private final SandboxRunner runner;
    private final TerraformPlanParser parser;
    private final AccessGuard guard;
    private final SandboxProperties properties;
    private final ObjectMapper objectMapper;
    private final FopsMetrics metrics;

    public TerraformValidator(SandboxRunner runner, TerraformPlanParser parser, AccessGuard guard,
                              SandboxProperties properties, ObjectMapper objectMapper,
                              @Autowired(required = false) FopsMetrics metrics) {
        this.runner = runner;
        this.parser = parser;
        this.guard = guard;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Plans {@code config} in a sandbox.
     *
     * @throws com.fops.core.security.NotAllowListedException if the workspace is not allowed
     */
    public ValidationReport plan(FileSet config, TerraformOptions options) {
        guard.authorizeWorkspace(options.workspace());

        if (config.isEmpty()) {
            return record(ValidationReport.failed(TerraformPlanParser.TOOL, SandboxStage.VALIDATE,
                    "Terraform configuration is required"));
        }

        FileSet files;
        try {
            files = withVariables(config, options.variables());
        } catch (JsonProcessingException e) {
            return record(ValidationReport.failed(TerraformPlanParser.TOOL, SandboxStage.VALIDATE,
                    "Could not serialize Terraform variables: " + e.getOriginalMessage()));
        }

        String binary = properties.getTerraformBinary();
        var init = new StageCommand(SandboxStage.INIT, binary,
                List.of("init", "-backend=false", "-input=false", "-no-color"),
                AUTOMATION_ENV, Duration.ofSeconds(properties.getInitTimeoutSeconds()), true);
        var plan = new StageCommand(SandboxStage.PLAN, binary,
                List.of("plan", "-json", "-detailed-exitcode", "-input=false", "-lock=false"),
                AUTOMATION_ENV, Duration.ofSeconds(properties.getPlanTimeoutSeconds()), true);

        log.info("Running terraform plan on {} files (workspace {})", files.size(), options.workspace());
        ChainResult chain = runner.runChain(files, List.of(init, plan));

        if (chain.shortCircuited()) {
            SandboxResult failed = chain.last();
            String reason = failed.completed()
                    ? firstNonBlank(failed.stderr(), failed.stdout(), "terraform init exited with code " + failed.exitCode())
                    : failed.failureReason();
            return record(ValidationReport.builder(TerraformPlanParser.TOOL)
                    .status(ValidationStatus.FAILED)
                    .failedStage(chain.failedStage())
                    .rawOutput(failed.stdout())
                    .error(reason.trim())
                    .build());
        }
        return record(parser.parse(chain.last()));
    }

    private FileSet withVariables(FileSet config, Map<String, Object> variables) throws JsonProcessingException {
        if (variables.isEmpty()) {
            return config;
        }
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(variables);
        return config.merge(FileSet.of(Map.of(VARS_FILE, json)));
    }

    private ValidationReport record(ValidationReport report) {
        log.info("Terraform validation finished: {} (+{} ~{} -{})", report.status().wireName(),
                report.summary().add(), report.summary().change(), report.summary().destroy());
        if (metrics != null) {
            metrics.recordValidation(report.tool(), report.status().wireName());
        }
        return report;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return "";
    }
}
