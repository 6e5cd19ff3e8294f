package com.fops.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "fops.security")
public class SecurityProperties {

    /** Substring patterns a repository URL must contain, e.g. {@code github.com/acme/}. */
    private List<String> allowedRepos = List.of();

    /** Kubernetes namespaces a chart may be dry-run against. */
    private List<String> allowedNamespaces = List.of("default", "staging", "prod");

    /** Terraform workspaces a plan may target. */
    private List<String> allowedWorkspaces = List.of("default", "dev", "staging", "prod");

    public List<String> getAllowedRepos() {
        return allowedRepos;
    }

    public void setAllowedRepos(List<String> allowedRepos) {
        this.allowedRepos = allowedRepos;
    }

    public List<String> getAllowedNamespaces() {
        return allowedNamespaces;
    }

    public void setAllowedNamespaces(List<String> allowedNamespaces) {
        this.allowedNamespaces = allowedNamespaces;
    }

    public List<String> getAllowedWorkspaces() {
        return allowedWorkspaces;
    }

    public void setAllowedWorkspaces(List<String> allowedWorkspaces) {
        this.allowedWorkspaces = allowedWorkspaces;
    }
}
