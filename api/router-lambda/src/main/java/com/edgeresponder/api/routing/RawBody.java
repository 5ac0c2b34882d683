package com.edgeresponder.api.routing;

/**
 * A response body that is already rendered. {@link Responses} writes it as-is
 * with its own content type instead of running it through the ObjectMapper.
 */
public record RawBody(String contentType, String body) {
    public static final String JSON = "application/json";
    public static final String HTML = "text/html; charset=utf-8";

    public static RawBody json(String body) {
        return new RawBody(JSON, body);
    }

    public static RawBody html(String body) {
        return new RawBody(HTML, body);
    }
}
