package com.fops.validation;

import com.fops.core.model.SandboxStage;
import com.fops.sandbox.SandboxResult;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/** Loads files under {@code src/test/resources/fixtures} and wraps them as sandbox results. */
final class Fixtures {

    private Fixtures() {}

    static String read(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static SandboxResult result(String tool, SandboxStage stage, int exitCode, String stdout, String stderr) {
        return new SandboxResult(tool, stage, exitCode, stdout, stderr, Duration.ofMillis(250), false, null);
    }

    static SandboxResult timedOut(String tool, SandboxStage stage) {
        return new SandboxResult(tool, stage, -1, "", "", Duration.ofSeconds(120), true, null);
    }
}
