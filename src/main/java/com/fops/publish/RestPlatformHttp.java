package com.fops.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fops.core.logging.Redaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link PlatformHttp} over {@link HttpClient}. The token is sent as a header and
 * never appears in logs or exception messages.
 */
public final class RestPlatformHttp implements PlatformHttp {

    private static final Logger log = LoggerFactory.getLogger(RestPlatformHttp.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String platform;
    private final String token;
    private final Map<String, String> headers;

    private RestPlatformHttp(HttpClient httpClient, ObjectMapper objectMapper, String platform,
                             String token, Map<String, String> headers) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.platform = platform;
        this.token = token;
        this.headers = headers;
    }

    public static RestPlatformHttp github(HttpClient httpClient, ObjectMapper objectMapper, String token) {
        var headers = new LinkedHashMap<String, String>();
        headers.put("Accept", "application/vnd.github+json");
        headers.put("X-GitHub-Api-Version", "2022-11-28");
        if (token != null && !token.isBlank()) {
            headers.put("Authorization", "Bearer " + token);
        }
        return new RestPlatformHttp(httpClient, objectMapper, "github", token, headers);
    }

    public static RestPlatformHttp gitlab(HttpClient httpClient, ObjectMapper objectMapper, String token) {
        var headers = new LinkedHashMap<String, String>();
        headers.put("Accept", "application/json");
        if (token != null && !token.isBlank()) {
            headers.put("PRIVATE-TOKEN", token);
        }
        return new RestPlatformHttp(httpClient, objectMapper, "gitlab", token, headers);
    }

    @Override
    public boolean hasCredential() {
        return token != null && !token.isBlank();
    }

    @Override
    public JsonNode get(String url) {
        return send("GET", url, requestBuilder(url).GET());
    }

    @Override
    public JsonNode post(String url, Object body) {
        return send("POST", url, requestBuilder(url)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body))));
    }

    @Override
    public JsonNode put(String url, Object body) {
        return send("PUT", url, requestBuilder(url)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(toJson(body))));
    }

    private HttpRequest.Builder requestBuilder(String url) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT);
        headers.forEach(builder::header);
        return builder;
    }

    private JsonNode send(String method, String url, HttpRequest.Builder builder) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PlatformApiException(platform, "%s %s request failed: %s"
                    .formatted(platform, method, Redaction.mask(e.getMessage(), token)), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformApiException(platform, platform + " " + method + " interrupted", e);
        }

        int status = response.statusCode();
        String body = Redaction.mask(response.body(), token);
        if (status >= 400) {
            log.debug("{} {} {} -> HTTP {}", platform, method, url, status);
            throw new PlatformApiException(platform, status,
                    "%s API %s %s failed (HTTP %d): %s".formatted(platform, method, url, status, abbreviate(body)),
                    body);
        }
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PlatformApiException(platform, status,
                    "%s API %s %s returned invalid JSON".formatted(platform, method, url), body);
        }
    }

    private String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not serializable", e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
