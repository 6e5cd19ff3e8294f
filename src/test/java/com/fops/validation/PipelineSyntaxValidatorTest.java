package com.fops.validation;

import com.fops.core.metrics.FopsMetrics;
import com.fops.core.model.ValidationReport;
import com.fops.core.model.ValidationStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PipelineSyntaxValidatorTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final PipelineSyntaxValidator validator = new PipelineSyntaxValidator(new FopsMetrics(registry));

    private static final String WORKFLOW = """
            name: CI
            on:
              push:
                branches: [main]
            jobs:
              build:
                runs-on: ubuntu-latest
                steps:
                  - uses: actions/checkout@v4
            """;

    @Test
    @DisplayName("a well-formed workflow passes")
    void validWorkflow() {
        ValidationReport report = validator.validate(".github/workflows/ci.yml", WORKFLOW);

        assertEquals(ValidationStatus.SUCCESS, report.status());
        assertEquals("yaml", report.tool());
        assertTrue(report.lint().warnings().isEmpty());
        assertEquals(WORKFLOW, report.rawOutput());
        assertEquals(1.0, registry.find("fops.validation.reports").tag("tool", "yaml").counter().count());
    }

    @Test
    @DisplayName("a workflow without jobs fails and one without on: warns")
    void workflowStructure() {
        ValidationReport noJobs = validator.validate(".github/workflows/ci.yml", "name: CI\non: push\n");
        assertEquals(ValidationStatus.FAILED, noJobs.status());
        assertEquals("Workflow .github/workflows/ci.yml has no jobs", noJobs.errors().get(0));

        ValidationReport noTrigger = validator.validate(".github/workflows/ci.yml", "jobs:\n  a:\n    runs-on: x\n");
        assertEquals(ValidationStatus.SUCCESS, noTrigger.status());
        assertEquals(1, noTrigger.lint().warningCount());
    }

    @Test
    @DisplayName("invalid YAML, empty content and scalar roots fail")
    void failures() {
        assertTrue(validator.validate(".gitlab-ci.yml", "stages: [build\n").errors().get(0)
                .startsWith("Invalid YAML in .gitlab-ci.yml"));
        assertEquals("Pipeline file .gitlab-ci.yml is empty", validator.validate(".gitlab-ci.yml", "  ").errors().get(0));
        assertEquals(ValidationStatus.FAILED, validator.validate("Jenkinsfile.yml", "just text").status());
        assertEquals(ValidationStatus.FAILED, validator.validate(".gitlab-ci.yml", "{}").status());
    }

    @Test
    @DisplayName("non-workflow pipelines only need a non-empty mapping")
    void gitlabPipeline() {
        ValidationReport report = validator.validate(".gitlab-ci.yml", "stages: [build]\nbuild:\n  script: make\n");
        assertEquals(ValidationStatus.SUCCESS, report.status());
    }
}
