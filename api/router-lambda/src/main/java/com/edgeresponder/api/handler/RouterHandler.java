package com.edgeresponder.api.handler;

import java.util.Map;
import java.util.Set;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPResponse;
import com.edgeresponder.api.app.App;
import com.edgeresponder.api.routing.ApiError;
import com.edgeresponder.api.routing.Responses;
import com.edgeresponder.api.routing.Router;
import com.edgeresponder.api.util.ApiException;

/**
 * Lambda entry point for API Gateway HTTP API (payload format 2.0) events.
 */
public class RouterHandler implements RequestHandler<APIGatewayV2HTTPEvent, APIGatewayV2HTTPResponse> {
    private final App app;

    public RouterHandler() {
        this(App.get());
    }

    public RouterHandler(App app) {
        this.app = app;
    }

    @Override
    public APIGatewayV2HTTPResponse handleRequest(APIGatewayV2HTTPEvent event, Context context) {
        String method = Router.method(event);
        String path = event == null ? null : event.getRawPath();

        APIGatewayV2HTTPResponse resp = dispatch(event, method, path, context);
        if ("HEAD".equalsIgnoreCase(method)) {
            resp = Responses.withoutBody(resp);
        }

        if (app.config.accessLog()) {
            log(context, method + " " + path + " -> " + resp.getStatusCode());
        }
        return resp;
    }

    private APIGatewayV2HTTPResponse dispatch(APIGatewayV2HTTPEvent event, String method, String path, Context context) {
        try {
            if (method == null || path == null) {
                throw new ApiException(400, "request has no method or path");
            }

            var route = app.router.match(method, path);
            if (route != null) {
                Object out = route.handle(event, context);
                return Responses.json(app.om, 200, out);
            }

            Set<String> allowed = app.router.allowedMethods(path);
            if (!allowed.isEmpty()) {
                return Responses.error(app.om, 405,
                        ApiError.of("METHOD_NOT_ALLOWED", method.toUpperCase() + " is not allowed on " + path),
                        Map.of("allow", String.join(", ", allowed)));
            }

            String alternate = toggleTrailingSlash(path);
            if (alternate != null && app.router.hasPath(alternate)) {
                String query = event.getRawQueryString();
                return Responses.redirect(307, (query == null || query.isEmpty()) ? alternate : alternate + "?" + query);
            }

            return Responses.error(app.om, 404, ApiError.of("NOT_FOUND", "no route for this method/path"));

        } catch (ApiException e) {
            int code = e.status();
            String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "error" : e.getMessage();
            return Responses.error(app.om, code, ApiError.of(errorCode(code), msg));

        } catch (IllegalArgumentException e) {
            return Responses.error(app.om, 400, ApiError.of("BAD_REQUEST", e.getMessage()));

        } catch (Exception e) {
            log(context, "unhandled error on " + method + " " + path + ": " + e);
            return Responses.error(app.om, 500, ApiError.of("INTERNAL_ERROR", "unexpected error"));
        }
    }

    static String errorCode(int status) {
        switch (status) {
            case 400: return "BAD_REQUEST";
            case 404: return "NOT_FOUND";
            case 405: return "METHOD_NOT_ALLOWED";
            default: return "ERROR";
        }
    }

    // "/api/" <-> "/api"; the root path has no alternate
    static String toggleTrailingSlash(String path) {
        if (path.isEmpty() || "/".equals(path)) return null;
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path + "/";
    }

    private static void log(Context context, String message) {
        if (context == null || context.getLogger() == null) return;
        context.getLogger().log(message);
    }
}
