package com.fops.core.model;

import java.io.Serializable;

public record Citation(
    String sourceId,
    String title,
    String excerpt
) implements Serializable {}
