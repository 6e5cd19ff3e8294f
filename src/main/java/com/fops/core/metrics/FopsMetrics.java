package com.fops.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for proposal validation and publishing.
 */
@Service
public class FopsMetrics {

    private final MeterRegistry registry;

    public FopsMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSandboxRun(String tool, String stage, Duration duration, boolean timedOut) {
        Timer.builder("fops.sandbox.duration")
                .tag("tool", tool)
                .tag("stage", stage)
                .register(registry)
                .record(duration);
        if (timedOut) {
            Counter.builder("fops.sandbox.timeouts")
                    .description("Sandbox invocations killed at the wall-clock timeout")
                    .tag("tool", tool)
                    .tag("stage", stage)
                    .register(registry)
                    .increment();
        }
    }

    public void recordValidation(String tool, String status) {
        Counter.builder("fops.validation.reports")
                .tag("tool", tool)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * @param platform "github" or "gitlab"
     * @param operation "publish" or "attach"
     */
    public void recordPublish(String platform, String operation, boolean success) {
        Counter.builder("fops.publish.operations")
                .description("Git platform proposal operations")
                .tag("platform", platform)
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordProposalOutcome(String status) {
        Counter.builder("fops.proposals.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordAuditAppend(boolean success) {
        Counter.builder("fops.audit.appends")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }
}
