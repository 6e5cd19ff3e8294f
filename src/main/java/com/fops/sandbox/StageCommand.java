package com.fops.sandbox;

import com.fops.core.model.SandboxStage;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * One step of a chained sandbox run.
 *
 * @param stage         stage marker reported on failure
 * @param tool          binary to invoke (resolved on PATH unless absolute)
 * @param args          argv after the binary; never passed through a shell
 * @param environment   extra environment variables
 * @param timeout       hard wall-clock limit
 * @param haltOnFailure stop the chain when this stage exits non-zero; timeouts and
 *                      launch failures always stop it
 */
public record StageCommand(
    SandboxStage stage,
    String tool,
    List<String> args,
    Map<String, String> environment,
    Duration timeout,
    boolean haltOnFailure
) {
    public StageCommand {
        args = List.copyOf(args);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static StageCommand of(SandboxStage stage, String tool, List<String> args, Duration timeout) {
        return new StageCommand(stage, tool, args, Map.of(), timeout, true);
    }
}
