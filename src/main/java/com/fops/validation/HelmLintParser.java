package com.fops.validation;

import com.fops.core.model.LintResult;
import com.fops.sandbox.SandboxResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Buckets {@code helm lint} output by its bracketed severity markers.
 */
@Component
public class HelmLintParser {

    public LintResult parse(SandboxResult raw) {
        var warnings = new ArrayList<String>();
        var errors = new ArrayList<String>();
        var info = new ArrayList<String>();

        String output = raw.stdout() + "\n" + raw.stderr();
        for (String line : output.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.contains("[WARNING]")) {
                warnings.add(trimmed.replace("[WARNING]", "").trim());
            } else if (trimmed.contains("[INFO]")) {
                info.add(trimmed.replace("[INFO]", "").trim());
            } else if (trimmed.contains("[ERROR]")) {
                errors.add(trimmed.replace("[ERROR]", "").trim());
            }
        }
        if (!raw.completed()) {
            errors.add(raw.failureReason());
        }

        boolean passed = raw.completed() && raw.exitCode() == 0 && errors.isEmpty();
        return new LintResult(passed, warnings, errors, info);
    }
}
