package com.edgeresponder.api.routing;

import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Fixed (method, path) route table. Routes are matched on the exact raw path;
 * there are no path parameters. A GET route also answers HEAD.
 */
public final class Router {
    private final Map<Key, Entry> routes = new LinkedHashMap<>();

    public Router add(String method, String path, Route handler) {
        return add(method, path, null, handler);
    }

    /**
     * Registers a route. Routes with a {@code null} summary are served but left
     * out of {@link #routes()}' documented set.
     */
    public Router add(String method, String path, String summary, Route handler) {
        routes.put(new Key(method.toUpperCase(), path), new Entry(summary, handler));
        return this;
    }

    /**
     * Registers a GET route whose body is serialized once, here, and replayed
     * verbatim on every request.
     */
    public Router addStatic(ObjectMapper om, String path, String summary, Object body) {
        RawBody rendered;
        try {
            rendered = RawBody.json(om.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize static body for " + path, e);
        }
        return add("GET", path, summary, (evt, ctx) -> rendered);
    }

    public Route match(String method, String path) {
        if (method == null || path == null) return null;

        String m = method.toUpperCase();
        Entry e = routes.get(new Key(m, path));
        if (e == null && "HEAD".equals(m)) {
            e = routes.get(new Key("GET", path));
        }
        return e == null ? null : e.handler();
    }

    /** Methods registered for {@code path}, sorted; empty when the path is unknown. */
    public Set<String> allowedMethods(String path) {
        Set<String> out = new TreeSet<>();
        for (Key k : routes.keySet()) {
            if (k.path().equals(path)) {
                out.add(k.method());
                if ("GET".equals(k.method())) out.add("HEAD");
            }
        }
        return out;
    }

    public boolean hasPath(String path) {
        return !allowedMethods(path).isEmpty();
    }

    /** Documented routes in registration order. */
    public List<RouteInfo> routes() {
        List<RouteInfo> out = new ArrayList<>();
        routes.forEach((k, e) -> {
            if (e.summary() != null) out.add(new RouteInfo(k.method(), k.path(), e.summary()));
        });
        return out;
    }

    public static String method(APIGatewayV2HTTPEvent e) {
        if (e == null || e.getRequestContext() == null || e.getRequestContext().getHttp() == null) {
            return null;
        }
        return e.getRequestContext().getHttp().getMethod();
    }

    public record RouteInfo(String method, String path, String summary) {}

    private record Key(String method, String path) {}

    private record Entry(String summary, Route handler) {}
}
