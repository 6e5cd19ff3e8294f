package com.fops.validation;

import java.util.Map;

/**
 * @param workspace workspace the plan is meant for; checked against the allow-list
 * @param variables values written to {@code terraform.tfvars.json}, none when empty
 */
public record TerraformOptions(String workspace, Map<String, Object> variables) {

    public TerraformOptions {
        if (workspace == null || workspace.isBlank()) {
            workspace = "default";
        }
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }

    public static TerraformOptions defaults() {
        return new TerraformOptions("default", Map.of());
    }
}
