package com.edgeresponder.api.docs;

import com.edgeresponder.api.routing.RawBody;

/**
 * Interactive docs page. Swagger UI is loaded from a CDN and pointed at the
 * OpenAPI document.
 */
public final class SwaggerUiPage {
    public static final String PATH = "/docs";

    private static final String CDN = "https://cdn.jsdelivr.net/npm/swagger-ui-dist@5";

    private SwaggerUiPage() {}

    public static RawBody render(String title, String openApiUrl) {
        String html = """
                <!DOCTYPE html>
                <html>
                <head>
                <link type="text/css" rel="stylesheet" href="%1$s/swagger-ui.css">
                <title>%2$s - Swagger UI</title>
                </head>
                <body>
                <div id="swagger-ui"></div>
                <script src="%1$s/swagger-ui-bundle.js"></script>
                <script>
                const ui = SwaggerUIBundle({
                    url: '%3$s',
                    dom_id: '#swagger-ui',
                    layout: 'BaseLayout',
                    deepLinking: true,
                    presets: [
                        SwaggerUIBundle.presets.apis,
                        SwaggerUIBundle.SwaggerUIStandalonePreset
                    ],
                })
                </script>
                </body>
                </html>
                """.formatted(CDN, escape(title), openApiUrl);
        return RawBody.html(html);
    }

    static String escape(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#x27;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
