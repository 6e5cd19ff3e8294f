package com.fops.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Bucketed lint findings.
 *
 * @param passed true when the linter exited 0 and reported no errors
 */
public record LintResult(
    boolean passed,
    List<String> warnings,
    List<String> errors,
    List<String> info
) implements Serializable {

    public LintResult {
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
        info = List.copyOf(info);
    }

    public static LintResult notRun() {
        return new LintResult(false, List.of(), List.of(), List.of());
    }

    public int warningCount() {
        return warnings.size();
    }

    public int errorCount() {
        return errors.size();
    }
}
