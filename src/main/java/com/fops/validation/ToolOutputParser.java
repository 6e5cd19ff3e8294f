package com.fops.validation;

import com.fops.core.model.ValidationReport;
import com.fops.sandbox.SandboxResult;

/**
 * Turns the raw output of one tool run into a {@link ValidationReport}.
 *
 * <p>Implementations never throw for bad tool output: malformed fragments are
 * dropped one at a time and the rest of the report survives. Parsing is
 * idempotent, so equal inputs give equal reports.
 */
public interface ToolOutputParser {

    ValidationReport parse(SandboxResult raw);
}
