package com.fops.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders dry-run artifacts as one Markdown comment: a heading per artifact key
 * and one fenced block per value. Structured values are pretty-printed JSON.
 */
@Component
public class ArtifactCommentFormatter {

    static final String HEADING = "## F-Ops Dry-Run Artifacts";
    static final String FOOTER = "---\n*Generated by F-Ops*";

    /** Per-section cap. */
    static final int MAX_SECTION_CHARS = 15_000;

    /** Whole-comment cap, below GitHub's 65536-character limit. */
    static final int MAX_COMMENT_CHARS = 60_000;

    /** Room kept for the omission note and footer. */
    private static final int RESERVED_CHARS = 2_000;

    private static final Pattern BACKTICK_RUN = Pattern.compile("`+");

    private final ObjectMapper objectMapper;

    public ArtifactCommentFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Sections that would push the comment past {@link #MAX_COMMENT_CHARS} are
     * left out and named in a note above the footer.
     */
    public String format(Map<String, Object> artifacts) {
        var sb = new StringBuilder(HEADING).append("\n\n");
        var omitted = new ArrayList<String>();
        artifacts.forEach((key, value) -> {
            String section = section(key, value);
            if (omitted.isEmpty() && sb.length() + section.length() + RESERVED_CHARS <= MAX_COMMENT_CHARS) {
                sb.append(section);
            } else {
                omitted.add(key);
            }
        });
        if (!omitted.isEmpty()) {
            sb.append("_Omitted to stay within the comment size limit: ")
              .append(String.join(", ", omitted)).append("_\n\n");
        }
        sb.append(FOOTER);
        return sb.toString();
    }

    private String section(String key, Object value) {
        String body = truncate(render(value));
        String fence = fenceFor(body);
        boolean structured = !(value instanceof CharSequence);
        return "### " + titleCase(key) + "\n\n"
                + fence + (structured ? "json" : "") + "\n"
                + body + "\n"
                + fence + "\n\n";
    }

    /** A backtick fence longer than any backtick run inside {@code body}. */
    static String fenceFor(String body) {
        int longest = 0;
        Matcher m = BACKTICK_RUN.matcher(body);
        while (m.find()) {
            longest = Math.max(longest, m.end() - m.start());
        }
        return "`".repeat(Math.max(3, longest + 1));
    }

    static String titleCase(String key) {
        var sb = new StringBuilder();
        for (String word : key.split("[_\\-\\s]+")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
              .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private String render(Object value) {
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String truncate(String text) {
        if (text.length() <= MAX_SECTION_CHARS) {
            return text;
        }
        return text.substring(0, MAX_SECTION_CHARS) + "\n... (truncated, " + text.length() + " chars total)";
    }
}
