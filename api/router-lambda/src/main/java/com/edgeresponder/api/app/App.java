package com.edgeresponder.api.app;

import com.edgeresponder.api.docs.OpenApiDocument;
import com.edgeresponder.api.docs.SwaggerUiPage;
import com.edgeresponder.api.model.ApiStatus;
import com.edgeresponder.api.model.Greeting;
import com.edgeresponder.api.model.Health;
import com.edgeresponder.api.routing.RawBody;
import com.edgeresponder.api.routing.Router;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class App {
    private static volatile App INSTANCE;

    public final Config config;
    public final ObjectMapper om;
    public final Router router;

    public App(Config config) {
        this.config = config;
        this.om = new ObjectMapper();

        this.router = new Router()
                .addStatic(om, "/", "Main", new Greeting("world", SwaggerUiPage.PATH))
                .addStatic(om, "/api", "Root", new ApiStatus(true, "FastAPI running on Vercel"))
                .addStatic(om, "/api/health", "Health", new Health("healthy"));

        if (config.docsEnabled()) {
            // rendered after the data routes so they are the only ones listed
            RawBody openApi = OpenApiDocument.render(om, config.apiTitle(), config.apiVersion(), router.routes());
            RawBody docs = SwaggerUiPage.render(config.apiTitle(), OpenApiDocument.PATH);

            router.add("GET", OpenApiDocument.PATH, (evt, ctx) -> openApi)
                  .add("GET", SwaggerUiPage.PATH, (evt, ctx) -> docs);
        }
    }

    public static App get() {
        if (INSTANCE == null) {
            synchronized (App.class) {
                if (INSTANCE == null) INSTANCE = new App(Config.fromEnv());
            }
        }
        return INSTANCE;
    }
}
