package com.fops.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fops.core.error.MissingCredentialException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GitLab REST v4 publisher. Projects are addressed by their URL-encoded path,
 * so nested groups work without a project id lookup.
 */
public class GitLabPublisher implements ProposalPublisher {

    private static final Logger log = LoggerFactory.getLogger(GitLabPublisher.class);

    static final Pattern REPO_URL = Pattern.compile("^https?://gitlab\\.com/(.+?)(?:\\.git)?/?$");
    static final Pattern MERGE_REQUEST_URL = Pattern.compile("^https?://gitlab\\.com/(.+?)/-/merge_requests/(\\d+)/?$");

    private final PlatformHttp http;
    private final String apiUrl;
    private final String defaultBaseBranch;
    private final ArtifactCommentFormatter formatter;

    public GitLabPublisher(PlatformHttp http, String apiUrl, String defaultBaseBranch,
                           ArtifactCommentFormatter formatter) {
        this.http = http;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.defaultBaseBranch = defaultBaseBranch;
        this.formatter = formatter;
    }

    @Override
    public String platform() {
        return "gitlab";
    }

    @Override
    public boolean supports(String repoUrl) {
        return repoUrl != null && repoUrl.contains("gitlab.com");
    }

    @Override
    public void checkCredentials() {
        if (!http.hasCredential()) {
            throw new MissingCredentialException(platform());
        }
    }

    @Override
    public String publish(PublishRequest request) {
        checkCredentials();
        Matcher m = REPO_URL.matcher(request.repoUrl());
        if (!m.matches() || m.group(1).contains("/-/")) {
            throw new InvalidRepoUrlException("GitLab", request.repoUrl());
        }
        String project = apiUrl + "/projects/" + encode(m.group(1));
        String base = request.baseBranch() != null ? request.baseBranch() : defaultBaseBranch;
        String branch = request.branchName();

        try {
            http.post(project + "/repository/branches", Map.of("branch", branch, "ref", base));
            log.info("Created branch {} from {}", branch, base);
        } catch (PlatformApiException e) {
            if (!e.isAlreadyExists()) {
                throw e;
            }
            log.info("Branch {} already exists, continuing", branch);
        }

        for (Map.Entry<String, String> file : request.files().asMap().entrySet()) {
            upsertFile(project, branch, file.getKey(), file.getValue());
        }

        var mergeRequest = new LinkedHashMap<String, Object>();
        mergeRequest.put("source_branch", branch);
        mergeRequest.put("target_branch", base);
        mergeRequest.put("title", request.title());
        mergeRequest.put("description", request.body());
        JsonNode created;
        try {
            created = http.post(project + "/merge_requests", mergeRequest);
        } catch (PlatformApiException e) {
            if (!e.isAlreadyExists()) {
                throw e;
            }
            return openMergeRequestFor(project, branch);
        }
        String url = created.path("web_url").asText("");
        if (url.isBlank()) {
            throw new PlatformApiException(platform(), 502, "Merge request response has no web_url", created.toString());
        }
        log.info("Opened merge request {}", url);
        return url;
    }

    private String openMergeRequestFor(String project, String branch) {
        JsonNode requests = http.get(project + "/merge_requests?state=opened&source_branch=" + encode(branch));
        String url = requests.path(0).path("web_url").asText("");
        if (url.isBlank()) {
            throw new PlatformApiException(platform(), 409,
                    "Merge request for " + branch + " reported as existing but none is open", requests.toString());
        }
        log.info("Merge request for {} already open, updated {}", branch, url);
        return url;
    }

    private void upsertFile(String project, String branch, String path, String content) {
        String fileUrl = project + "/repository/files/" + encode(path);
        boolean exists = true;
        try {
            http.get(fileUrl + "?ref=" + encode(branch));
        } catch (PlatformApiException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            exists = false;
        }

        var payload = new LinkedHashMap<String, Object>();
        payload.put("branch", branch);
        payload.put("content", content);
        payload.put("commit_message", (exists ? "Update " : "Add ") + path);
        if (exists) {
            http.put(fileUrl, payload);
        } else {
            http.post(fileUrl, payload);
        }
        log.debug("{} {} on {}", exists ? "Updated" : "Created", path, branch);
    }

    @Override
    public boolean attach(String proposalUrl, Map<String, Object> artifacts) {
        checkCredentials();
        Matcher m = MERGE_REQUEST_URL.matcher(proposalUrl);
        if (!m.matches()) {
            throw new InvalidRepoUrlException("GitLab merge request", proposalUrl);
        }
        if (artifacts == null || artifacts.isEmpty()) {
            return false;
        }
        String notes = apiUrl + "/projects/" + encode(m.group(1)) + "/merge_requests/" + m.group(2) + "/notes";
        http.post(notes, Map.of("body", formatter.format(artifacts)));
        log.info("Attached {} artifacts to {}", artifacts.size(), proposalUrl);
        return true;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
