package com.fops.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Scripted {@link PlatformHttp}. Routes match on method and a URL fragment, first
 * match wins; unmatched calls answer with an empty JSON object. Every call is
 * recorded.
 */
class FakePlatformHttp implements PlatformHttp {

    static final ObjectMapper JSON = new ObjectMapper();

    record Call(String method, String url, Object body) {}

    private record Route(String method, String fragment, Function<Call, JsonNode> answer) {}

    private final List<Route> routes = new ArrayList<>();
    private final List<Call> calls = new ArrayList<>();
    private final boolean credential;

    FakePlatformHttp(boolean credential) {
        this.credential = credential;
    }

    FakePlatformHttp() {
        this(true);
    }

    synchronized FakePlatformHttp on(String method, String fragment, Function<Call, JsonNode> answer) {
        routes.add(new Route(method, fragment, answer));
        return this;
    }

    FakePlatformHttp respond(String method, String fragment, String json) {
        JsonNode node = parse(json);
        return on(method, fragment, call -> node);
    }

    FakePlatformHttp fail(String method, String fragment, int status, String body) {
        return on(method, fragment, call -> {
            throw new PlatformApiException("fake", status, "HTTP " + status, body);
        });
    }

    synchronized List<Call> calls() {
        return List.copyOf(calls);
    }

    synchronized List<Call> calls(String method, String fragment) {
        return calls.stream()
                .filter(c -> c.method().equals(method) && c.url().contains(fragment))
                .toList();
    }

    @Override
    public JsonNode get(String url) {
        return dispatch(new Call("GET", url, null));
    }

    @Override
    public JsonNode post(String url, Object body) {
        return dispatch(new Call("POST", url, body));
    }

    @Override
    public JsonNode put(String url, Object body) {
        return dispatch(new Call("PUT", url, body));
    }

    @Override
    public boolean hasCredential() {
        return credential;
    }

    private JsonNode dispatch(Call call) {
        Route match = null;
        synchronized (this) {
            calls.add(call);
            for (Route route : routes) {
                if (route.method().equals(call.method()) && call.url().contains(route.fragment())) {
                    match = route;
                    break;
                }
            }
        }
        return match == null ? JSON.createObjectNode() : match.answer().apply(call);
    }

    static JsonNode parse(String json) {
        try {
            return JSON.readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException(json, e);
        }
    }
}
