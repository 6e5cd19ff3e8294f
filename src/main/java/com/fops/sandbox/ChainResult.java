package com.fops.sandbox;

import com.fops.core.model.SandboxStage;

import java.util.List;

/**
 * Results of a chained run, one per stage that was started.
 *
 * @param results     stage results in execution order
 * @param failedStage stage that stopped the chain before its last step, or null
 */
public record ChainResult(List<SandboxResult> results, SandboxStage failedStage) {

    public ChainResult {
        results = List.copyOf(results);
    }

    public boolean shortCircuited() {
        return failedStage != null;
    }

    public SandboxResult last() {
        return results.isEmpty() ? null : results.get(results.size() - 1);
    }

    public SandboxResult stage(SandboxStage stage) {
        for (SandboxResult r : results) {
            if (r.stage() == stage) {
                return r;
            }
        }
        return null;
    }
}
