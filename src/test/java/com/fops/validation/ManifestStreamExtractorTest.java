package com.fops.validation;

import com.fops.core.model.ManifestRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestStreamExtractorTest {

    private final ManifestStreamExtractor extractor = new ManifestStreamExtractor();

    @Test
    @DisplayName("extracts every document after the first separator")
    void dryRunFixture() {
        List<ManifestRecord> manifests = extractor.extract(Fixtures.read("helm-dry-run.txt"));

        assertEquals(List.of(
                new ManifestRecord("Deployment", "default", "test-release-web"),
                new ManifestRecord("Service", "staging", "test-release-web")), manifests);
    }

    @Test
    @DisplayName("a NOTES trailer does not break the last document")
    void notesClosesDocument() {
        String output = "---\nkind: ConfigMap\nmetadata:\n  name: cfg\nNOTES:\nThank you for installing: yes\n  - and: [unclosed\n";
        List<ManifestRecord> manifests = extractor.extract(output);

        assertEquals(List.of(new ManifestRecord("ConfigMap", "default", "cfg")), manifests);
    }

    @Test
    @DisplayName("header lines before the first separator are ignored")
    void headerIgnored() {
        String output = "NAME: x\nkind: Secret\n---\nkind: Service\n";
        assertEquals(List.of(new ManifestRecord("Service", "default", "unknown")), extractor.extract(output));
    }

    @Test
    @DisplayName("invalid, scalar and kind-less documents are dropped individually")
    void dropsBadDocuments() {
        String output = String.join("\n",
                "---",
                "kind: [unclosed",
                "---",
                "just a scalar",
                "---",
                "metadata:",
                "  name: no-kind",
                "---",
                "kind: Ingress",
                "metadata:",
                "  name: web",
                "  namespace: prod",
                "");
        assertEquals(List.of(new ManifestRecord("Ingress", "prod", "web")), extractor.extract(output));
    }

    @Test
    @DisplayName("separator detection excludes ---#")
    void separators() {
        assertTrue(ManifestStreamExtractor.isSeparator("---"));
        assertTrue(ManifestStreamExtractor.isSeparator("--- # Source: x"));
        assertFalse(ManifestStreamExtractor.isSeparator("---# not a separator"));
        assertFalse(ManifestStreamExtractor.isSeparator(" ---"));
    }

    @Test
    @DisplayName("empty output yields no manifests")
    void empty() {
        assertTrue(extractor.extract("").isEmpty());
    }
}
