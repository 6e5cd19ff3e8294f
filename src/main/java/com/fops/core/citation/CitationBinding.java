package com.fops.core.citation;

import com.fops.core.model.Citation;

import java.util.List;

/**
 * Content with its citation footer appended.
 *
 * @param contentWithFooter original content followed by the {@code # Citations} section
 * @param contentHash       SHA-256 hex of the original content, footer excluded
 * @param citations         sources in the order they were supplied
 */
public record CitationBinding(
    String contentWithFooter,
    String contentHash,
    List<Citation> citations
) {
    public CitationBinding {
        citations = List.copyOf(citations);
    }
}
