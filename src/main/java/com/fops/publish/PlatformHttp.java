package com.fops.publish;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Minimal JSON-over-HTTP access to one git platform's REST API.
 * Non-2xx responses surface as {@link PlatformApiException}.
 */
public interface PlatformHttp {

    JsonNode get(String url);

    JsonNode post(String url, Object body);

    JsonNode put(String url, Object body);

    /**
     * Whether an API token is configured.
     */
    boolean hasCredential();
}
