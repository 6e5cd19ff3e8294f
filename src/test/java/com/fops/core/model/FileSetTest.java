package com.fops.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileSetTest {

    @Nested
    @DisplayName("path checks")
    class PathChecks {

        @ParameterizedTest
        @ValueSource(strings = {"/etc/passwd", "../main.tf", "modules/../../x.tf", "C:/x.tf", "modules\\x.tf", " "})
        @DisplayName("rejects paths that could leave the sandbox root")
        void rejectsUnsafePaths(String path) {
            assertThrows(IllegalArgumentException.class, () -> FileSet.of(Map.of(path, "x")));
        }

        @Test
        @DisplayName("accepts nested relative paths")
        void acceptsNested() {
            FileSet files = FileSet.of(Map.of("templates/deployment.yaml", "kind: Deployment"));
            assertEquals("kind: Deployment", files.content("templates/deployment.yaml"));
        }
    }

    @Test
    @DisplayName("null content becomes empty string and order is kept")
    void orderAndNulls() {
        var map = new LinkedHashMap<String, String>();
        map.put("main.tf", "a");
        map.put("variables.tf", null);
        FileSet files = FileSet.of(map);

        assertEquals(List.of("main.tf", "variables.tf"), List.copyOf(files.paths()));
        assertEquals("", files.content("variables.tf"));
    }

    @Test
    @DisplayName("prefixed re-roots every path")
    void prefixed() {
        FileSet files = FileSet.of(Map.of("Chart.yaml", "name: web")).prefixed("deploy/chart");
        assertEquals(List.of("deploy/chart/Chart.yaml"), List.copyOf(files.paths()));
        assertSame(files, files.prefixed(""));
    }

    @Test
    @DisplayName("merge lets later entries win")
    void merge() {
        FileSet a = FileSet.of(Map.of("main.tf", "old"));
        FileSet b = FileSet.of(Map.of("main.tf", "new", "outputs.tf", "o"));
        FileSet merged = a.merge(b);

        assertEquals(2, merged.size());
        assertEquals("new", merged.content("main.tf"));
        assertSame(a, a.merge(FileSet.empty()));
    }

    @Test
    @DisplayName("fingerprint depends on content, not insertion order")
    void fingerprint() {
        var first = new LinkedHashMap<String, String>();
        first.put("a.tf", "1");
        first.put("b.tf", "2");
        var second = new LinkedHashMap<String, String>();
        second.put("b.tf", "2");
        second.put("a.tf", "1");

        assertEquals(FileSet.of(first).fingerprint(), FileSet.of(second).fingerprint());
        assertNotEquals(FileSet.of(first).fingerprint(), FileSet.of(Map.of("a.tf", "1")).fingerprint());
        assertEquals(FileSet.of(first), FileSet.of(second));
    }
}
