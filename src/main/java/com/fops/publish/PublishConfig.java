package com.fops.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

@Configuration
public class PublishConfig {

    private static final Logger log = LoggerFactory.getLogger(PublishConfig.class);

    @Bean
    public HttpClient platformHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public GitHubPublisher gitHubPublisher(HttpClient platformHttpClient, ObjectMapper objectMapper,
                                           PublishProperties properties, ArtifactCommentFormatter formatter) {
        var http = RestPlatformHttp.github(platformHttpClient, objectMapper, properties.getGithubToken());
        if (!http.hasCredential()) {
            log.warn("No GitHub token configured; GitHub proposals will be rejected");
        }
        return new GitHubPublisher(http, properties.getGithubApiUrl(), properties.getBaseBranch(), formatter);
    }

    @Bean
    public GitLabPublisher gitLabPublisher(HttpClient platformHttpClient, ObjectMapper objectMapper,
                                           PublishProperties properties, ArtifactCommentFormatter formatter) {
        var http = RestPlatformHttp.gitlab(platformHttpClient, objectMapper, properties.getGitlabToken());
        if (!http.hasCredential()) {
            log.warn("No GitLab token configured; GitLab proposals will be rejected");
        }
        return new GitLabPublisher(http, properties.getGitlabApiUrl(), properties.getBaseBranch(), formatter);
    }

    @Bean
    public PublisherRouter publisherRouter(List<ProposalPublisher> publishers) {
        return new PublisherRouter(publishers);
    }
}
