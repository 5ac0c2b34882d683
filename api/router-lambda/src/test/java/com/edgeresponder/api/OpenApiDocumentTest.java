package com.edgeresponder.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.edgeresponder.api.docs.OpenApiDocument;
import com.edgeresponder.api.docs.SwaggerUiPage;
import com.edgeresponder.api.routing.RawBody;
import com.edgeresponder.api.routing.Router.RouteInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class OpenApiDocumentTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void document_has_info_and_operations() throws Exception {
        RawBody body = OpenApiDocument.render(om, "FastAPI on Vercel", "0.1.0", List.of(
                new RouteInfo("GET", "/", "Main"),
                new RouteInfo("GET", "/api/health", "Health")
        ));

        assertEquals(RawBody.JSON, body.contentType());
        JsonNode doc = om.readTree(body.body());
        assertEquals("3.1.0", doc.path("openapi").asText());
        assertEquals("FastAPI on Vercel", doc.path("info").path("title").asText());
        assertEquals("0.1.0", doc.path("info").path("version").asText());

        JsonNode health = doc.path("paths").path("/api/health").path("get");
        assertEquals("Health", health.path("summary").asText());
        assertEquals("health_api_health_get", health.path("operationId").asText());
        assertTrue(health.path("responses").path("200").path("content").has("application/json"));

        assertEquals("main__get", doc.path("paths").path("/").path("get").path("operationId").asText());
    }

    @Test
    void docs_page_escapes_title() {
        RawBody page = SwaggerUiPage.render("<Edge & \"Co\">", "/openapi.json");

        assertEquals(RawBody.HTML, page.contentType());
        assertTrue(page.body().contains("<title>&lt;Edge &amp; &quot;Co&quot;&gt; - Swagger UI</title>"));
        assertFalse(page.body().contains("<Edge"));
    }
}
