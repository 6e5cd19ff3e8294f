package com.fops.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view over rendered manifests, used for policy checks.
 */
public record ManifestSummary(
    int totalCount,
    Map<String, Integer> byKind,
    Map<String, Integer> byNamespace,
    List<String> resourceNames,
    boolean hasSecrets,
    boolean hasConfigMaps,
    boolean hasServices,
    boolean hasIngress
) implements Serializable {

    public ManifestSummary {
        byKind = Collections.unmodifiableMap(new LinkedHashMap<>(byKind));
        byNamespace = Collections.unmodifiableMap(new LinkedHashMap<>(byNamespace));
        resourceNames = List.copyOf(resourceNames);
    }

    public static ManifestSummary empty() {
        return new ManifestSummary(0, Map.of(), Map.of(), List.of(), false, false, false, false);
    }

    public static ManifestSummary of(List<ManifestRecord> manifests) {
        var byKind = new LinkedHashMap<String, Integer>();
        var byNamespace = new LinkedHashMap<String, Integer>();
        var names = new ArrayList<String>();
        boolean secrets = false;
        boolean configMaps = false;
        boolean services = false;
        boolean ingress = false;

        for (ManifestRecord m : manifests) {
            byKind.merge(m.kind(), 1, Integer::sum);
            byNamespace.merge(m.namespace(), 1, Integer::sum);
            names.add(m.kind() + "/" + m.name());
            switch (m.kind()) {
                case "Secret" -> secrets = true;
                case "ConfigMap" -> configMaps = true;
                case "Service" -> services = true;
                case "Ingress" -> ingress = true;
                default -> { }
            }
        }
        return new ManifestSummary(manifests.size(), byKind, byNamespace, names,
                secrets, configMaps, services, ingress);
    }
}
