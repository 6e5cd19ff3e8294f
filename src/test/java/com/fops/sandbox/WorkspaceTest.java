package com.fops.sandbox;

import com.fops.core.model.FileSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceTest {

    @Test
    @DisplayName("create writes nested files and close deletes the tree")
    void createAndClose() throws Exception {
        Path root;
        try (Workspace workspace = Workspace.create("fops-ws-test-", FileSet.of(Map.of(
                "chart/Chart.yaml", "name: web",
                "chart/templates/svc.yaml", "kind: Service")))) {
            root = workspace.root();
            assertEquals("name: web", Files.readString(root.resolve("chart/Chart.yaml")));
            assertTrue(Files.isRegularFile(root.resolve("chart/templates/svc.yaml")));
            assertTrue(workspace.exists());
        }
        assertFalse(Files.exists(root));
    }

    @Test
    @DisplayName("close is idempotent")
    void closeTwice() throws Exception {
        Workspace workspace = Workspace.create("fops-ws-test-", FileSet.empty());
        workspace.close();
        assertDoesNotThrow(workspace::close);
        assertFalse(workspace.exists());
    }

    @Test
    @DisplayName("write adds files after creation")
    void writeLater() throws Exception {
        try (Workspace workspace = Workspace.create("fops-ws-test-", FileSet.empty())) {
            workspace.write(FileSet.of(Map.of("terraform.tfvars.json", "{}")));
            assertEquals("{}", Files.readString(workspace.root().resolve("terraform.tfvars.json")));
        }
    }
}
