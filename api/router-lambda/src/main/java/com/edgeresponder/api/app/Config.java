package com.edgeresponder.api.app;

public record Config(
        // OpenAPI info block
        String apiTitle,
        String apiVersion,

        // /docs and /openapi.json
        boolean docsEnabled,

        // one line per request through the Lambda logger
        boolean accessLog
) {
    public static Config fromEnv() {
        return new Config(
                env("API_TITLE", "FastAPI on Vercel"),
                env("API_VERSION", "0.1.0"),
                flag("DOCS_ENABLED", true),
                flag("ACCESS_LOG", true)
        );
    }

    private static String env(String key, String def) {
        // Lambda uses env vars; unit tests can use System properties.
        String v = System.getenv(key);
        if (v == null) v = System.getProperty(key);
        if (v == null) return def;
        v = v.trim();
        return v.isEmpty() ? def : v;
    }

    private static boolean flag(String key, boolean def) {
        String v = env(key, String.valueOf(def)).toLowerCase();
        switch (v) {
            case "true", "1", "yes", "on":
                return true;
            case "false", "0", "no", "off":
                return false;
            default:
                throw new IllegalArgumentException(key + " must be a boolean, got '" + v + "'");
        }
    }
}
