package com.edgeresponder.api.docs;

import com.edgeresponder.api.routing.RawBody;
import com.edgeresponder.api.routing.Router.RouteInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Renders the OpenAPI 3.1 document for the documented routes. The route table
 * is fixed at startup, so the document is rendered once.
 */
public final class OpenApiDocument {
    public static final String PATH = "/openapi.json";

    private OpenApiDocument() {}

    public static RawBody render(ObjectMapper om, String title, String version, List<RouteInfo> routes) {
        ObjectNode root = om.createObjectNode();
        root.put("openapi", "3.1.0");

        ObjectNode info = root.putObject("info");
        info.put("title", title);
        info.put("version", version);

        ObjectNode paths = root.putObject("paths");
        for (RouteInfo r : routes) {
            ObjectNode item = paths.has(r.path()) ? (ObjectNode) paths.get(r.path()) : paths.putObject(r.path());
            ObjectNode op = item.putObject(r.method().toLowerCase());
            op.put("summary", r.summary());
            op.put("operationId", operationId(r));
            op.putObject("responses")
                    .putObject("200")
                    .put("description", "Successful Response")
                    .putObject("content")
                    .putObject(RawBody.JSON)
                    .putObject("schema");
        }

        try {
            return RawBody.json(om.writeValueAsString(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot render openapi document", e);
        }
    }

    // "Health" + "/api/health" + GET -> health_api_health_get
    static String operationId(RouteInfo r) {
        String base = (r.summary() + r.path()).toLowerCase().replaceAll("\\W", "_");
        return base + "_" + r.method().toLowerCase();
    }
}
