package com.fops.core.engine;

import com.fops.core.model.FileSet;
import com.fops.validation.HelmOptions;
import com.fops.validation.TerraformOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InfrastructureProposalTest {

    @Test
    @DisplayName("needs at least one of terraform files or a chart")
    void requiresArtifacts() {
        assertThrows(IllegalArgumentException.class, () -> new InfrastructureProposal(
                "https://github.com/acme/shop", "ecs", List.of(), null, null, null, null, null, null));
    }

    @Test
    @DisplayName("fills defaults and re-roots files")
    void defaultsAndLayout() {
        var request = new InfrastructureProposal("https://github.com/acme/shop", "ecs", null, null,
                FileSet.of(Map.of("main.tf", "x")), null, null, null, null);

        assertEquals(TerraformOptions.defaults(), request.terraformOptions());
        assertEquals(HelmOptions.defaults(), request.helmOptions());
        assertTrue(request.sources().isEmpty());
        assertEquals("infrastructure-ecs", request.branchKind());
        assertEquals("[F-Ops] Add ecs infrastructure configuration", request.title());
        assertEquals("x", request.repositoryFiles().content("infra/main.tf"));
    }

    @Test
    @DisplayName("pipeline paths are checked for traversal")
    void pipelinePath() {
        assertThrows(IllegalArgumentException.class,
                () -> new PipelineProposal("https://github.com/acme/shop", "../.github/workflows/ci.yml", "x", null));
        var ok = new PipelineProposal("https://github.com/acme/shop", ".gitlab-ci.yml", null, null);
        assertEquals("", ok.repositoryFiles().content(".gitlab-ci.yml"));
    }
}
