package com.edgeresponder.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.edgeresponder.api.routing.RawBody;
import com.edgeresponder.api.routing.Route;
import com.edgeresponder.api.routing.Router;
import com.fasterxml.jackson.databind.ObjectMapper;

public class RouterTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void match_is_exact_on_path() {
        Route r = (evt, ctx) -> "x";
        Router router = new Router().add("GET", "/api", r);

        assertSame(r, router.match("GET", "/api"));
        assertNull(router.match("GET", "/api/"));
        assertNull(router.match("GET", "/API"));
        assertNull(router.match("POST", "/api"));
        assertNull(router.match(null, "/api"));
    }

    @Test
    void head_falls_back_to_get() {
        Route r = (evt, ctx) -> "x";
        Router router = new Router().add("get", "/", r);

        assertSame(r, router.match("HEAD", "/"));
        assertEquals(Set.of("GET", "HEAD"), router.allowedMethods("/"));
    }

    @Test
    void allowed_methods_sorted() {
        Router router = new Router()
                .add("POST", "/things", (evt, ctx) -> null)
                .add("GET", "/things", (evt, ctx) -> null);

        assertEquals(List.of("GET", "HEAD", "POST"), List.copyOf(router.allowedMethods("/things")));
        assertTrue(router.allowedMethods("/nothing").isEmpty());
        assertFalse(router.hasPath("/nothing"));
    }

    @Test
    void static_body_rendered_once() throws Exception {
        Router router = new Router().addStatic(om, "/api/health", "Health", Map.of("status", "healthy"));

        Object first = router.match("GET", "/api/health").handle(null, null);
        Object second = router.match("GET", "/api/health").handle(null, null);

        assertSame(first, second);
        assertEquals(RawBody.json("{\"status\":\"healthy\"}"), first);
    }

    @Test
    void static_body_that_cannot_serialize_fails_fast() {
        assertThrows(IllegalStateException.class,
                () -> new Router().addStatic(om, "/bad", "Bad", new Object()));
    }

    @Test
    void routes_lists_only_documented() {
        Router router = new Router()
                .add("GET", "/a", "A", (evt, ctx) -> null)
                .add("GET", "/hidden", (evt, ctx) -> null)
                .add("GET", "/b", "B", (evt, ctx) -> null);

        var routes = router.routes();
        assertEquals(2, routes.size());
        assertEquals("/a", routes.get(0).path());
        assertEquals("/b", routes.get(1).path());
        assertNotNull(router.match("GET", "/hidden"));
    }
}
