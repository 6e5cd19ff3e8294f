package com.fops.core.model;

import java.io.Serializable;

/**
 * Identity of one rendered Kubernetes resource.
 *
 * @param kind      resource kind, never blank
 * @param namespace metadata.namespace, {@code default} when absent
 * @param name      metadata.name, {@code unknown} when absent
 */
public record ManifestRecord(
    String kind,
    String namespace,
    String name
) implements Serializable {}
