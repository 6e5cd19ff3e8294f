package com.fops.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PublisherRouterTest {

    private final ArtifactCommentFormatter formatter = new ArtifactCommentFormatter(new ObjectMapper());
    private final GitHubPublisher github = new GitHubPublisher(new FakePlatformHttp(), "https://api.github.com", "main", formatter);
    private final GitLabPublisher gitlab = new GitLabPublisher(new FakePlatformHttp(), "https://gitlab.com/api/v4", "main", formatter);
    private final PublisherRouter router = new PublisherRouter(List.of(github, gitlab));

    @Test
    @DisplayName("routes by host")
    void routesByHost() {
        assertSame(github, router.route("https://github.com/acme/shop"));
        assertSame(gitlab, router.route("https://gitlab.com/platform/infra.git"));
    }

    @Test
    @DisplayName("unknown hosts are unsupported")
    void unsupported() {
        var e = assertThrows(UnsupportedPlatformException.class, () -> router.route("https://bitbucket.org/acme/shop"));
        assertEquals("Unsupported repository platform: https://bitbucket.org/acme/shop", e.getMessage());
    }
}
