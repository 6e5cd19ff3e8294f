package com.fops.core.model;

import java.io.Serializable;

/**
 * One knowledge-store hit used while generating content.
 *
 * @param sourceId opaque identifier from the store's metadata
 * @param title    document title, may be blank
 * @param excerpt  text passage that was retrieved
 * @param citation opaque citation string supplied by the store
 */
public record KnowledgeSource(
    String sourceId,
    String title,
    String excerpt,
    String citation
) implements Serializable {

    public Citation toCitation() {
        return new Citation(sourceId, title, excerpt);
    }
}
