package com.fops.publish;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "fops.publish")
public class PublishProperties {

    private String githubToken = "";
    private String gitlabToken = "";
    private String githubApiUrl = "https://api.github.com";
    private String gitlabApiUrl = "https://gitlab.com/api/v4";
    private String baseBranch = "main";
    private boolean publishFailedValidations = true;

    public String getGithubToken() { return githubToken; }
    public void setGithubToken(String githubToken) { this.githubToken = githubToken; }
    public String getGitlabToken() { return gitlabToken; }
    public void setGitlabToken(String gitlabToken) { this.gitlabToken = gitlabToken; }
    public String getGithubApiUrl() { return githubApiUrl; }
    public void setGithubApiUrl(String githubApiUrl) { this.githubApiUrl = githubApiUrl; }
    public String getGitlabApiUrl() { return gitlabApiUrl; }
    public void setGitlabApiUrl(String gitlabApiUrl) { this.gitlabApiUrl = gitlabApiUrl; }
    public String getBaseBranch() { return baseBranch; }
    public void setBaseBranch(String baseBranch) { this.baseBranch = baseBranch; }
    public boolean isPublishFailedValidations() { return publishFailedValidations; }
    public void setPublishFailedValidations(boolean publishFailedValidations) { this.publishFailedValidations = publishFailedValidations; }
}
