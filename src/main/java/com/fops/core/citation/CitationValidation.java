package com.fops.core.citation;

public record CitationValidation(
    boolean hasCitations,
    int citationCount,
    boolean hasCitationSection
) {
    public boolean valid() {
        return hasCitations && hasCitationSection;
    }
}
