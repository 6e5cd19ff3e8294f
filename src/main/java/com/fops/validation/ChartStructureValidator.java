package com.fops.validation;

import com.fops.core.model.FileSet;
import com.fops.core.model.LintResult;
import com.fops.core.model.SandboxStage;
import com.fops.core.model.ValidationReport;
import com.fops.core.model.ValidationStatus;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Static checks on a chart's layout that need no {@code helm} binary.
 * Template files are only checked for plain YAML validity, so templating
 * directives may produce warnings but never errors.
 */
@Component
public class ChartStructureValidator {

    private static final List<String> REQUIRED_FILES = List.of("Chart.yaml", "values.yaml");
    private static final List<String> REQUIRED_CHART_FIELDS = List.of("name", "version");

    public ValidationReport validate(FileSet chart) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        var info = new ArrayList<String>();

        for (String required : REQUIRED_FILES) {
            if (chart.content(required) == null) {
                errors.add("Missing required file: " + required);
            }
        }

        String chartYaml = chart.content("Chart.yaml");
        if (chartYaml != null) {
            try {
                Object parsed = yaml().load(chartYaml);
                Map<?, ?> fields = parsed instanceof Map<?, ?> m ? m : Map.of();
                for (String field : REQUIRED_CHART_FIELDS) {
                    Object value = fields.get(field);
                    if (value == null || value.toString().isBlank()) {
                        errors.add("Chart.yaml missing required field: " + field);
                    }
                }
                if (fields.get("name") != null) {
                    info.add("chart " + fields.get("name") + " " + fields.get("version"));
                }
            } catch (YAMLException e) {
                errors.add("Invalid Chart.yaml: " + e.getMessage());
            }
        }

        String valuesYaml = chart.content("values.yaml");
        if (valuesYaml != null) {
            try {
                yaml().load(valuesYaml);
            } catch (YAMLException e) {
                errors.add("Invalid values.yaml: " + e.getMessage());
            }
        }

        List<String> templates = chart.paths().stream()
                .filter(p -> p.startsWith("templates/"))
                .toList();
        if (templates.isEmpty()) {
            warnings.add("No template files found");
        }
        for (String template : templates) {
            String content = chart.content(template);
            if (!(template.endsWith(".yaml") || template.endsWith(".yml")) || content.isBlank()) {
                continue;
            }
            try {
                yaml().loadAll(content).forEach(doc -> { });
            } catch (YAMLException e) {
                warnings.add("Template " + template + " may have YAML issues: " + firstLine(e.getMessage()));
            }
        }

        var report = ValidationReport.builder(HelmRenderParser.TOOL)
                .lint(new LintResult(errors.isEmpty(), warnings, errors, info));
        if (errors.isEmpty()) {
            report.status(ValidationStatus.SUCCESS);
        } else {
            report.status(ValidationStatus.FAILED).failedStage(SandboxStage.VALIDATE);
            errors.forEach(report::error);
        }
        return report.build();
    }

    private static Yaml yaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private static String firstLine(String message) {
        if (message == null) return "";
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
