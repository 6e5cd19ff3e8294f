package com.fops.sandbox;

import com.fops.core.model.SandboxStage;

import java.time.Duration;

/**
 * Raw outcome of one tool invocation. Never interpreted here; parsers decide
 * what it means.
 *
 * @param tool        binary that was invoked
 * @param stage       stage the invocation belongs to
 * @param exitCode    process exit code, {@code -1} on timeout or launch failure
 * @param stdout      captured standard output
 * @param stderr      captured standard error
 * @param duration    wall-clock time
 * @param timedOut    true when the process was killed at the timeout
 * @param launchError why the process could not be run, or null
 */
public record SandboxResult(
    String tool,
    SandboxStage stage,
    int exitCode,
    String stdout,
    String stderr,
    Duration duration,
    boolean timedOut,
    String launchError
) {

    public static SandboxResult launchFailure(String tool, SandboxStage stage, String error, Duration elapsed) {
        return new SandboxResult(tool, stage, -1, "", "", elapsed, false, error);
    }

    /**
     * True when the process ran to completion on its own, whatever its exit code.
     */
    public boolean completed() {
        return !timedOut && launchError == null;
    }

    public boolean succeeded() {
        return completed() && exitCode == 0;
    }

    /**
     * Human-readable reason for a non-completed run, or null.
     */
    public String failureReason() {
        if (timedOut) {
            return "%s %s timed out after %ds".formatted(tool, stage.wireName(), duration.toSeconds());
        }
        return launchError;
    }
}
