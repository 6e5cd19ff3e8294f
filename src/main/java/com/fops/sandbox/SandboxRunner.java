package com.fops.sandbox;

import com.fops.core.metrics.FopsMetrics;
import com.fops.core.model.FileSet;
import com.fops.core.model.SandboxStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools inside throwaway workspaces.
 *
 * <p>The command is always an argv list handed to {@link ProcessBuilder}; nothing is
 * interpreted by a shell. Each run gets a hard wall-clock timeout after which the
 * process tree is killed. Every call returns a {@link SandboxResult}: timeouts,
 * missing binaries and non-zero exits are reported in it, never thrown. No call is
 * retried.
 *
 * <p>Child processes do not inherit the JVM environment. Only the variables in
 * {@link #INHERITED_ENV} and those starting with {@link #INHERITED_ENV_PREFIXES} are
 * passed through, so platform tokens never reach generated content.
 *
 * <p>The runner holds no per-call state and may be used from any number of threads.
 */
@Service
public class SandboxRunner {

    private static final Logger log = LoggerFactory.getLogger(SandboxRunner.class);

    /** How long to wait for output readers after the process has gone away. */
    private static final long DRAIN_GRACE_MILLIS = 2_000;

    static final Set<String> INHERITED_ENV = Set.of(
            "PATH", "HOME", "TMPDIR", "TMP", "TEMP", "LANG", "LC_ALL", "USER", "SYSTEMROOT",
            "HTTP_PROXY", "HTTPS_PROXY", "NO_PROXY", "http_proxy", "https_proxy", "no_proxy");

    static final List<String> INHERITED_ENV_PREFIXES = List.of("TF_CLI_", "TF_PLUGIN_", "TF_DATA_", "HELM_");

    private final String workDirPrefix;
    private final FopsMetrics metrics;
    private final Map<String, String> parentEnv;

    @Autowired
    public SandboxRunner(SandboxProperties properties,
                         @Autowired(required = false) FopsMetrics metrics) {
        this(properties.getWorkDirPrefix(), metrics);
    }

    public SandboxRunner(String workDirPrefix, FopsMetrics metrics) {
        this(workDirPrefix, metrics, System.getenv());
    }

    SandboxRunner(String workDirPrefix, FopsMetrics metrics, Map<String, String> parentEnv) {
        this.workDirPrefix = workDirPrefix;
        this.metrics = metrics;
        this.parentEnv = Map.copyOf(parentEnv);
    }

    /**
     * Materializes {@code files} into a fresh workspace, runs {@code tool args...} there
     * and removes the workspace again.
     */
    public SandboxResult execute(SandboxStage stage, String tool, FileSet files,
                                 List<String> args, Duration timeout) {
        long start = System.nanoTime();
        try (Workspace workspace = Workspace.create(workDirPrefix, files)) {
            return execute(workspace, StageCommand.of(stage, tool, args, timeout));
        } catch (IOException e) {
            log.warn("Could not prepare workspace for {} {}: {}", tool, stage.wireName(), e.getMessage());
            return SandboxResult.launchFailure(tool, stage,
                    "Could not prepare workspace: " + e.getMessage(), elapsedSince(start));
        }
    }

    /**
     * Runs the stages in order inside one workspace. The chain stops after a stage
     * that timed out, could not be launched, or exited non-zero while marked
     * {@link StageCommand#haltOnFailure()}; that stage is reported as
     * {@link ChainResult#failedStage()}. The last stage never counts as a
     * short-circuit, whatever its exit code.
     */
    public ChainResult runChain(FileSet files, List<StageCommand> stages) {
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("runChain needs at least one stage");
        }
        long start = System.nanoTime();
        var results = new ArrayList<SandboxResult>(stages.size());
        try (Workspace workspace = Workspace.create(workDirPrefix, files)) {
            for (int i = 0; i < stages.size(); i++) {
                StageCommand command = stages.get(i);
                SandboxResult result = execute(workspace, command);
                results.add(result);
                boolean last = i == stages.size() - 1;
                if (!last && haltsChain(command, result)) {
                    log.info("{} chain stopped at stage {} (exit {}, timedOut={})",
                            command.tool(), command.stage().wireName(), result.exitCode(), result.timedOut());
                    return new ChainResult(results, command.stage());
                }
            }
            return new ChainResult(results, null);
        } catch (IOException e) {
            StageCommand first = stages.get(0);
            log.warn("Could not prepare workspace for {} chain: {}", first.tool(), e.getMessage());
            results.add(SandboxResult.launchFailure(first.tool(), first.stage(),
                    "Could not prepare workspace: " + e.getMessage(), elapsedSince(start)));
            return new ChainResult(results, first.stage());
        }
    }

    /**
     * Runs one command in an existing workspace.
     */
    public SandboxResult execute(Workspace workspace, StageCommand command) {
        var argv = new ArrayList<String>(command.args().size() + 1);
        argv.add(command.tool());
        argv.addAll(command.args());

        var builder = new ProcessBuilder(argv).directory(workspace.root().toFile());
        Map<String, String> env = builder.environment();
        env.clear();
        env.putAll(inheritedEnvironment());
        env.putAll(command.environment());

        long start = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            Duration elapsed = elapsedSince(start);
            log.warn("Failed to launch {} for stage {}: {}", command.tool(), command.stage().wireName(), e.getMessage());
            record(command, elapsed, false);
            return SandboxResult.launchFailure(command.tool(), command.stage(),
                    "Failed to launch " + command.tool() + ": " + e.getMessage(), elapsed);
        }

        var stdout = new StreamCollector(process.getInputStream(), command.tool() + "-stdout");
        var stderr = new StreamCollector(process.getErrorStream(), command.tool() + "-stderr");
        stdout.start();
        stderr.start();

        boolean timedOut = false;
        String launchError = null;
        int exitCode;
        try {
            if (process.waitFor(command.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                exitCode = process.exitValue();
            } else {
                timedOut = true;
                exitCode = -1;
                kill(process);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            exitCode = -1;
            launchError = "Interrupted while waiting for " + command.tool();
        }

        stdout.await(DRAIN_GRACE_MILLIS);
        stderr.await(DRAIN_GRACE_MILLIS);
        Duration elapsed = elapsedSince(start);
        record(command, elapsed, timedOut);

        if (timedOut) {
            log.warn("{} {} timed out after {}s, process killed",
                    command.tool(), command.stage().wireName(), command.timeout().toSeconds());
        } else if (exitCode != 0) {
            log.debug("{} {} exited {}: {}", command.tool(), command.stage().wireName(), exitCode,
                    abbreviate(stderr.text()));
        }
        return new SandboxResult(command.tool(), command.stage(), exitCode,
                stdout.text(), stderr.text(), elapsed, timedOut, launchError);
    }

    private static boolean haltsChain(StageCommand command, SandboxResult result) {
        if (!result.completed()) {
            return true;
        }
        return command.haltOnFailure() && result.exitCode() != 0;
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(DRAIN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void record(StageCommand command, Duration elapsed, boolean timedOut) {
        if (metrics != null) {
            metrics.recordSandboxRun(command.tool(), command.stage().wireName(), elapsed, timedOut);
        }
    }

    Map<String, String> inheritedEnvironment() {
        var kept = new HashMap<String, String>();
        parentEnv.forEach((name, value) -> {
            if (INHERITED_ENV.contains(name) || INHERITED_ENV_PREFIXES.stream().anyMatch(name::startsWith)) {
                kept.put(name, value);
            }
        });
        return kept;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String abbreviate(String text) {
        String trimmed = text.trim();
        return trimmed.length() > 500 ? trimmed.substring(0, 500) + "..." : trimmed;
    }

    /**
     * Drains one process stream on its own daemon thread. The text read so far stays
     * available even if the stream never reaches EOF.
     */
    private static final class StreamCollector extends Thread {

        private final InputStream stream;
        private final StringBuilder buffer = new StringBuilder();

        StreamCollector(InputStream stream, String name) {
            super(name);
            this.stream = stream;
            setDaemon(true);
        }

        @Override
        public void run() {
            char[] chunk = new char[8192];
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                int n;
                while ((n = reader.read(chunk)) != -1) {
                    synchronized (buffer) {
                        buffer.append(chunk, 0, n);
                    }
                }
            } catch (IOException e) {
                log.debug("{} closed: {}", getName(), e.getMessage());
            }
        }

        void await(long millis) {
            try {
                join(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        String text() {
            synchronized (buffer) {
                return buffer.toString();
            }
        }
    }
}
