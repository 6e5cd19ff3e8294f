package com.fops.validation;

import com.fops.core.model.ManifestRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pulls Kubernetes resources out of {@code helm install --dry-run --debug} output.
 *
 * <p>Line state machine:
 * <pre>
 *   BEFORE_FIRST_SEPARATOR --"---"--> IN_DOCUMENT
 *   IN_DOCUMENT            --"---"--> IN_DOCUMENT  (closes the current document)
 *   IN_DOCUMENT            --"NOTES:"--> TRAILER    (closes the current document)
 *   TRAILER                --"---"--> IN_DOCUMENT
 * </pre>
 * A separator is any line starting with {@code ---} except {@code ---#}. Blank lines
 * and {@code #} comment lines are never buffered. Each closed document is parsed on
 * its own; one that fails to parse, is not a mapping, or has no {@code kind} is
 * dropped without affecting the others.
 */
@Component
public class ManifestStreamExtractor {

    private static final Logger log = LoggerFactory.getLogger(ManifestStreamExtractor.class);

    enum State { BEFORE_FIRST_SEPARATOR, IN_DOCUMENT, TRAILER }

    public List<ManifestRecord> extract(String output) {
        var manifests = new ArrayList<ManifestRecord>();
        var buffer = new StringBuilder();
        State state = State.BEFORE_FIRST_SEPARATOR;

        for (String line : output.split("\n", -1)) {
            if (isSeparator(line)) {
                flush(buffer, manifests);
                state = State.IN_DOCUMENT;
            } else if (state == State.IN_DOCUMENT && line.startsWith("NOTES:")) {
                flush(buffer, manifests);
                state = State.TRAILER;
            } else if (state == State.IN_DOCUMENT && !line.isBlank() && !line.startsWith("#")) {
                buffer.append(line).append('\n');
            }
        }
        flush(buffer, manifests);
        return manifests;
    }

    static boolean isSeparator(String line) {
        return line.startsWith("---") && !line.startsWith("---#");
    }

    private void flush(StringBuilder buffer, List<ManifestRecord> manifests) {
        if (buffer.length() == 0) {
            return;
        }
        String document = buffer.toString();
        buffer.setLength(0);

        Object parsed;
        try {
            parsed = newYaml().load(document);
        } catch (YAMLException e) {
            log.debug("Dropping unparsable manifest document: {}", e.getMessage());
            return;
        }
        if (!(parsed instanceof Map<?, ?> map)) {
            return;
        }
        String kind = text(map.get("kind"));
        if (kind == null || kind.isBlank()) {
            return;
        }
        String namespace = "default";
        String name = "unknown";
        if (map.get("metadata") instanceof Map<?, ?> metadata) {
            namespace = orDefault(text(metadata.get("namespace")), namespace);
            name = orDefault(text(metadata.get("name")), name);
        }
        manifests.add(new ManifestRecord(kind, namespace, name));
    }

    // Yaml instances are not thread-safe
    private static Yaml newYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
