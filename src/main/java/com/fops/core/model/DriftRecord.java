package com.fops.core.model;

import java.io.Serializable;

/**
 * A resource whose real state drifted from the last known state.
 */
public record DriftRecord(
    String type,
    String name,
    String action
) implements Serializable {}
