package io.debugtoolbar.javalin;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.debugtoolbar.core.toolbar.DebugToolbar;
import io.debugtoolbar.core.toolbar.StoredRequest;
import io.debugtoolbar.core.toolbar.ToolbarConfig;
import io.javalin.Javalin;
import io.javalin.http.Context;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The toolbar's own endpoints, mounted under the configured API and static paths:
 *
 * <ul>
 * <li>{@code GET {api}/}: history page
 * <li>{@code GET {api}/{id}}: detail page of one request
 * <li>{@code GET {api}/api/requests}: history as JSON, newest first
 * <li>{@code GET {api}/api/requests/{id}}: one request as JSON
 * <li>{@code GET {static}/toolbar.css} and {@code toolbar.js}
 * </ul>
 *
 * Unknown or malformed ids answer 404.
 */
public final class ToolbarRoutes {

    static final String RESOURCE_ROOT = "/debug-toolbar/static/";

    private final DebugToolbar toolbar;
    private final ToolbarPages pages;

    public ToolbarRoutes(DebugToolbar toolbar) {
        this.toolbar = toolbar;
        ToolbarConfig config = toolbar.config();
        this.pages = new ToolbarPages(toolbar.mapper(), config.apiPath(), config.staticPath());
    }

    /** Registers every route on {@code app}. */
    public void register(Javalin app) {
        String api = toolbar.config().apiPath();
        String assets = toolbar.config().staticPath();

        app.get(api + "/api/requests", this::listJson);
        app.get(api + "/api/requests/{id}", this::detailJson);
        app.get(assets + "/toolbar.css", ctx -> asset(ctx, "toolbar.css", "text/css; charset=utf-8"));
        app.get(assets + "/toolbar.js", ctx -> asset(ctx, "toolbar.js", "application/javascript; charset=utf-8"));
        app.get(api, ctx -> ctx.html(pages.history(toolbar.storage().all())));
        app.get(api + "/{id}", this::detailPage);
    }

    private void listJson(Context ctx) throws JsonProcessingException {
        List<Map<String, Object>> summaries = new ArrayList<>();
        for (StoredRequest request : toolbar.storage().all()) {
            summaries.add(summary(request));
        }
        json(ctx, Map.of("requests", summaries));
    }

    private void detailJson(Context ctx) throws JsonProcessingException {
        StoredRequest request = find(ctx.pathParam("id"));
        if (request == null) {
            ctx.status(404);
            json(ctx, Map.of("error", "Request not found"));
            return;
        }
        Map<String, Object> detail = summary(request);
        detail.put("metadata", request.metadata());
        detail.put("timing", request.timingData());
        detail.put("panels", request.panelData());
        json(ctx, detail);
    }

    private void detailPage(Context ctx) {
        StoredRequest request = find(ctx.pathParam("id"));
        if (request == null) {
            ctx.status(404).html("<!DOCTYPE html><html><body><h1>Request not found</h1></body></html>");
            return;
        }
        ctx.html(pages.detail(request));
    }

    private StoredRequest find(String id) {
        try {
            return toolbar.storage().get(UUID.fromString(id));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static Map<String, Object> summary(StoredRequest request) {
        Map<String, Object> meta = request.metadata();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("request_id", request.requestId().toString());
        summary.put("method", meta.get("method"));
        summary.put("path", meta.get("path"));
        summary.put("status_code", meta.get("status_code"));
        summary.put("total_time", request.totalTime());
        summary.put("toolbar_injected", meta.get("toolbar_injected"));
        summary.put("stored_at", request.storedAt().toString());
        return summary;
    }

    private void json(Context ctx, Object body) throws JsonProcessingException {
        ctx.contentType("application/json").result(toolbar.mapper().writeValueAsString(body));
    }

    private static void asset(Context ctx, String name, String contentType) {
        InputStream in = ToolbarRoutes.class.getResourceAsStream(RESOURCE_ROOT + name);
        if (in == null) {
            ctx.status(404).result("Not found");
            return;
        }
        ctx.contentType(contentType).header("Cache-Control", "max-age=3600").result(in);
    }
}
