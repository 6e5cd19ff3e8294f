package com.fops.core.citation;

import com.fops.core.model.Citation;
import com.fops.core.model.KnowledgeSource;
import com.fops.core.util.Hashes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Binds generated content to the knowledge sources used to produce it.
 *
 * <p>Sources keep the order they were supplied in and are never deduplicated:
 * a repeated source means it was retrieved more than once.
 */
@Service
public class CitationTracker {

    private static final Logger log = LoggerFactory.getLogger(CitationTracker.class);

    static final String SECTION_HEADER = "# Citations";

    private static final Pattern CITATION_MARKER = Pattern.compile("\\[\\d+]");

    public CitationBinding bind(String content, List<KnowledgeSource> sources) {
        String original = content == null ? "" : content;
        String hash = contentHash(original);
        List<KnowledgeSource> ordered = sources == null ? List.of() : sources;

        var citations = new ArrayList<Citation>(ordered.size());
        for (KnowledgeSource source : ordered) {
            citations.add(source.toCitation());
        }

        if (ordered.isEmpty()) {
            return new CitationBinding(original, hash, citations);
        }

        var sb = new StringBuilder(original);
        sb.append("\n\n").append(SECTION_HEADER).append('\n');
        for (int i = 0; i < ordered.size(); i++) {
            KnowledgeSource source = ordered.get(i);
            if (i > 0) {
                sb.append('\n');
            }
            sb.append('[').append(i + 1).append("] ")
              .append(citationText(source))
              .append(": ")
              .append(titleOf(source));
        }

        log.info("Bound {} sources to content {}", ordered.size(), hash.substring(0, 8));
        return new CitationBinding(sb.toString(), hash, citations);
    }

    public CitationValidation validate(String content) {
        if (content == null || content.isEmpty()) {
            return new CitationValidation(false, 0, false);
        }
        int count = 0;
        var matcher = CITATION_MARKER.matcher(content);
        while (matcher.find()) {
            count++;
        }
        return new CitationValidation(count > 0, count, content.contains(SECTION_HEADER));
    }

    /**
     * Numbered list for proposal bodies.
     */
    public String formatCitationList(List<KnowledgeSource> sources) {
        if (sources == null || sources.isEmpty()) {
            return "No knowledge base sources referenced.";
        }
        var lines = new ArrayList<String>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            lines.add((i + 1) + ". " + citationText(sources.get(i)));
        }
        return String.join("\n", lines);
    }

    /**
     * Citation strings in source order, as recorded in audit entries.
     */
    public List<String> citationTexts(List<KnowledgeSource> sources) {
        if (sources == null) {
            return List.of();
        }
        return sources.stream().map(CitationTracker::citationText).toList();
    }

    public static String contentHash(String content) {
        return Hashes.sha256Hex(content);
    }

    private static String citationText(KnowledgeSource source) {
        if (source.citation() != null && !source.citation().isBlank()) {
            return source.citation();
        }
        return source.sourceId() == null ? "unknown" : source.sourceId();
    }

    private static String titleOf(KnowledgeSource source) {
        return source.title() == null || source.title().isBlank() ? "Untitled" : source.title();
    }
}
