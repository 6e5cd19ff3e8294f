package com.fops.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fops.core.error.MissingCredentialException;
import com.fops.core.model.FileSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GitLabPublisherTest {

    private static final String API = "https://gitlab.test/api/v4";
    private static final String PROJECT = API + "/projects/platform%2Fteam%2Finfra";

    private FakePlatformHttp http;
    private GitLabPublisher publisher;

    @BeforeEach
    void setUp() {
        http = new FakePlatformHttp()
                .respond("POST", "/merge_requests", "{\"web_url\":\"https://gitlab.com/platform/team/infra/-/merge_requests/12\"}");
        publisher = new GitLabPublisher(http, API, "main", new ArtifactCommentFormatter(new ObjectMapper()));
    }

    private static PublishRequest request(FileSet files) {
        return new PublishRequest("https://gitlab.com/platform/team/infra", "fops-infrastructure-web-20260310-090000",
                "develop", files, "[F-Ops] Add web infrastructure configuration", "description");
    }

    @Test
    @DisplayName("nested group paths are URL-encoded as the project id")
    @SuppressWarnings("unchecked")
    void createsBranchFilesAndMergeRequest() {
        http.fail("GET", "/repository/files/", 404, "{\"message\":\"404 File Not Found\"}");

        String url = publisher.publish(request(FileSet.of(Map.of("infra/main.tf", "resource {}"))));

        assertEquals("https://gitlab.com/platform/team/infra/-/merge_requests/12", url);
        var branch = (Map<String, Object>) http.calls("POST", PROJECT + "/repository/branches").get(0).body();
        assertEquals("develop", branch.get("ref"));

        var create = http.calls("POST", "/repository/files/").get(0);
        assertEquals(PROJECT + "/repository/files/infra%2Fmain.tf", create.url());
        assertEquals("Add infra/main.tf", ((Map<String, Object>) create.body()).get("commit_message"));
        assertTrue(http.calls("PUT", "/repository/files/").isEmpty());

        var mr = (Map<String, Object>) http.calls("POST", PROJECT + "/merge_requests").get(0).body();
        assertEquals("develop", mr.get("target_branch"));
        assertEquals("description", mr.get("description"));
    }

    @Test
    @DisplayName("existing files are updated with PUT")
    void updatesExistingFile() {
        http.respond("GET", "/repository/files/", "{\"file_path\":\"infra/main.tf\"}");

        publisher.publish(request(FileSet.of(Map.of("infra/main.tf", "x"))));

        assertEquals(1, http.calls("PUT", "/repository/files/").size());
        assertTrue(http.calls("POST", "/repository/files/").isEmpty());
    }

    @Test
    @DisplayName("an existing branch is reused")
    void branchAlreadyExists() {
        http.fail("POST", "/repository/branches", 400, "{\"message\":\"Branch already exists\"}");

        assertNotNull(publisher.publish(request(FileSet.of(Map.of("a.tf", "a")))));
    }

    @Test
    @DisplayName("an open merge request for the source branch is returned on conflict")
    void mergeRequestAlreadyOpen() {
        var existing = new FakePlatformHttp()
                .fail("POST", "/merge_requests", 409,
                        "{\"message\":[\"Another open merge request already exists for this source branch: !9\"]}")
                .respond("GET", "/merge_requests?state=opened",
                        "[{\"web_url\":\"https://gitlab.com/platform/team/infra/-/merge_requests/9\"}]");
        var gitlab = new GitLabPublisher(existing, API, "main", new ArtifactCommentFormatter(new ObjectMapper()));

        assertEquals("https://gitlab.com/platform/team/infra/-/merge_requests/9",
                gitlab.publish(request(FileSet.empty())));
        assertEquals(PROJECT + "/merge_requests?state=opened&source_branch=fops-infrastructure-web-20260310-090000",
                existing.calls("GET", "/merge_requests?").get(0).url());
    }

    @Test
    @DisplayName("a missing web_url is a platform error")
    void missingWebUrl() {
        var bare = new GitLabPublisher(new FakePlatformHttp(), API, "main",
                new ArtifactCommentFormatter(new ObjectMapper()));
        assertThrows(PlatformApiException.class, () -> bare.publish(request(FileSet.empty())));
    }

    @Test
    @DisplayName("merge request URLs are not repository URLs")
    void rejectsMergeRequestUrl() {
        var req = new PublishRequest("https://gitlab.com/platform/infra/-/merge_requests/3", "b", null,
                FileSet.empty(), "t", "b");
        assertThrows(InvalidRepoUrlException.class, () -> publisher.publish(req));
    }

    @Test
    @DisplayName("attach posts a merge request note")
    void attach() {
        assertTrue(publisher.attach("https://gitlab.com/platform/team/infra/-/merge_requests/12",
                Map.of("helm_dry_run", Map.of("status", "success"))));
        assertEquals(PROJECT + "/merge_requests/12/notes", http.calls("POST", "/notes").get(0).url());
    }

    @Test
    @DisplayName("a missing token is a MissingCredentialException")
    void missingToken() {
        var noToken = new GitLabPublisher(new FakePlatformHttp(false), API, "main",
                new ArtifactCommentFormatter(new ObjectMapper()));
        assertThrows(MissingCredentialException.class, noToken::checkCredentials);
    }
}
