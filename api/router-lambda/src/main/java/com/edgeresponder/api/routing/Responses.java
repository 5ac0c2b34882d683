package com.edgeresponder.api.routing;

import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPResponse;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashMap;
import java.util.Map;

public final class Responses {
    private Responses() {}

    public static APIGatewayV2HTTPResponse json(ObjectMapper om, int status, Object body) {
        return json(om, status, body, Map.of());
    }

    public static APIGatewayV2HTTPResponse json(ObjectMapper om, int status, Object body, Map<String, String> headers) {
        if (body instanceof RawBody raw) {
            return raw(status, raw, headers);
        }
        try {
            String s = om.writeValueAsString(body);
            return raw(status, RawBody.json(s), headers);
        } catch (Exception e) {
            return APIGatewayV2HTTPResponse.builder()
                    .withStatusCode(500)
                    .withHeaders(Map.of("content-type", RawBody.JSON))
                    .withBody("{\"error\":{\"code\":\"SERIALIZE_ERROR\",\"message\":\"failed to serialize response\",\"details\":[]}}")
                    .build();
        }
    }

    public static APIGatewayV2HTTPResponse error(ObjectMapper om, int status, ApiError err) {
        return error(om, status, err, Map.of());
    }

    public static APIGatewayV2HTTPResponse error(ObjectMapper om, int status, ApiError err, Map<String, String> headers) {
        return json(om, status, Map.of("error", err), headers);
    }

    public static APIGatewayV2HTTPResponse redirect(int status, String location) {
        return APIGatewayV2HTTPResponse.builder()
                .withStatusCode(status)
                .withHeaders(Map.of("location", location))
                .build();
    }

    // HEAD: same status and headers, no body
    public static APIGatewayV2HTTPResponse withoutBody(APIGatewayV2HTTPResponse resp) {
        return APIGatewayV2HTTPResponse.builder()
                .withStatusCode(resp.getStatusCode())
                .withHeaders(resp.getHeaders())
                .build();
    }

    private static APIGatewayV2HTTPResponse raw(int status, RawBody body, Map<String, String> extra) {
        Map<String, String> headers = new HashMap<>(extra);
        headers.put("content-type", body.contentType());
        return APIGatewayV2HTTPResponse.builder()
                .withStatusCode(status)
                .withHeaders(headers)
                .withBody(body.body())
                .build();
    }
}
