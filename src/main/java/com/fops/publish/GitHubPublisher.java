package com.fops.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fops.core.error.MissingCredentialException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GitHub REST v3 publisher.
 */
public class GitHubPublisher implements ProposalPublisher {

    private static final Logger log = LoggerFactory.getLogger(GitHubPublisher.class);

    static final Pattern REPO_URL = Pattern.compile("^https?://github\\.com/([^/]+)/([^/]+?)(?:\\.git)?/?$");
    static final Pattern PULL_URL = Pattern.compile("^https?://github\\.com/([^/]+)/([^/]+)/pull/(\\d+)/?$");

    private final PlatformHttp http;
    private final String apiUrl;
    private final String defaultBaseBranch;
    private final ArtifactCommentFormatter formatter;

    public GitHubPublisher(PlatformHttp http, String apiUrl, String defaultBaseBranch,
                           ArtifactCommentFormatter formatter) {
        this.http = http;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.defaultBaseBranch = defaultBaseBranch;
        this.formatter = formatter;
    }

    @Override
    public String platform() {
        return "github";
    }

    @Override
    public boolean supports(String repoUrl) {
        return repoUrl != null && repoUrl.contains("github.com");
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
        if (!m.matches()) {
            throw new InvalidRepoUrlException("GitHub", request.repoUrl());
        }
        String repo = apiUrl + "/repos/" + m.group(1) + "/" + m.group(2);
        String base = request.baseBranch() != null ? request.baseBranch() : defaultBaseBranch;
        String branch = request.branchName();

        String baseSha = http.get(repo + "/git/ref/heads/" + encode(base)).path("object").path("sha").asText("");
        if (baseSha.isBlank()) {
            throw new PlatformApiException(platform(), 502, "Could not read head sha of " + base, "");
        }

        try {
            http.post(repo + "/git/refs", Map.of("ref", "refs/heads/" + branch, "sha", baseSha));
            log.info("Created branch {} from {}", branch, base);
        } catch (PlatformApiException e) {
            if (!e.isAlreadyExists()) {
                throw e;
            }
            log.info("Branch {} already exists, continuing", branch);
        }

        for (Map.Entry<String, String> file : request.files().asMap().entrySet()) {
            upsertFile(repo, branch, file.getKey(), file.getValue());
        }

        var pull = new LinkedHashMap<String, Object>();
        pull.put("title", request.title());
        pull.put("head", branch);
        pull.put("base", base);
        pull.put("body", request.body());
        JsonNode created;
        try {
            created = http.post(repo + "/pulls", pull);
        } catch (PlatformApiException e) {
            if (!e.isAlreadyExists()) {
                throw e;
            }
            return openPullFor(repo, m.group(1), branch);
        }
        String url = created.path("html_url").asText("");
        if (url.isBlank()) {
            throw new PlatformApiException(platform(), 502, "Pull request response has no html_url", created.toString());
        }
        log.info("Opened pull request {}", url);
        return url;
    }

    /**
     * The open pull request whose head is {@code branch}; used when an earlier
     * publish on the same branch already opened one.
     */
    private String openPullFor(String repo, String owner, String branch) {
        JsonNode pulls = http.get(repo + "/pulls?state=open&head=" + encode(owner + ":" + branch));
        String url = pulls.path(0).path("html_url").asText("");
        if (url.isBlank()) {
            throw new PlatformApiException(platform(), 409,
                    "Pull request for " + branch + " reported as existing but none is open", pulls.toString());
        }
        log.info("Pull request for {} already open, updated {}", branch, url);
        return url;
    }

    private void upsertFile(String repo, String branch, String path, String content) {
        String fileUrl = repo + "/contents/" + encodePath(path);
        String sha = null;
        try {
            sha = http.get(fileUrl + "?ref=" + encode(branch)).path("sha").asText(null);
        } catch (PlatformApiException e) {
            if (!e.isNotFound()) {
                throw e;
            }
        }

        var payload = new LinkedHashMap<String, Object>();
        payload.put("message", (sha != null ? "Update " : "Add ") + path);
        payload.put("content", Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8)));
        payload.put("branch", branch);
        if (sha != null) {
            payload.put("sha", sha);
        }
        http.put(fileUrl, payload);
        log.debug("{} {} on {}", sha != null ? "Updated" : "Created", path, branch);
    }

    @Override
    public boolean attach(String proposalUrl, Map<String, Object> artifacts) {
        checkCredentials();
        Matcher m = PULL_URL.matcher(proposalUrl);
        if (!m.matches()) {
            throw new InvalidRepoUrlException("GitHub pull request", proposalUrl);
        }
        if (artifacts == null || artifacts.isEmpty()) {
            return false;
        }
        String comments = apiUrl + "/repos/" + m.group(1) + "/" + m.group(2) + "/issues/" + m.group(3) + "/comments";
        http.post(comments, Map.of("body", formatter.format(artifacts)));
        log.info("Attached {} artifacts to {}", artifacts.size(), proposalUrl);
        return true;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String encodePath(String path) {
        var sb = new StringBuilder();
        for (String segment : path.split("/")) {
            if (sb.length() > 0) sb.append('/');
            sb.append(encode(segment));
        }
        return sb.toString();
    }
}
