package com.fops.validation;

import java.util.Map;

/**
 * @param releaseName release name passed to {@code helm install}
 * @param namespace   target namespace; checked against the allow-list
 * @param values      overrides written to {@code custom-values.yaml}, none when empty
 */
public record HelmOptions(String releaseName, String namespace, Map<String, Object> values) {

    public HelmOptions {
        if (releaseName == null || releaseName.isBlank()) {
            releaseName = "test-release";
        }
        if (namespace == null || namespace.isBlank()) {
            namespace = "default";
        }
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    public static HelmOptions defaults() {
        return new HelmOptions("test-release", "default", Map.of());
    }
}
