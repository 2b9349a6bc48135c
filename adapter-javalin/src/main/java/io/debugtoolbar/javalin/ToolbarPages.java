package io.debugtoolbar.javalin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.debugtoolbar.core.toolbar.Html;
import io.debugtoolbar.core.toolbar.StoredRequest;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Server-rendered history and detail pages. */
final class ToolbarPages {

    private static final Logger LOG = LoggerFactory.getLogger(ToolbarPages.class);

    private final ObjectMapper mapper;
    private final String apiPath;
    private final String staticPath;

    ToolbarPages(ObjectMapper mapper, String apiPath, String staticPath) {
        this.mapper = mapper;
        this.apiPath = apiPath;
        this.staticPath = staticPath;
    }

    String history(List<StoredRequest> requests) {
        StringBuilder rows = new StringBuilder();
        for (StoredRequest request : requests) {
            Map<String, Object> meta = request.metadata();
            String id = request.requestId().toString();
            rows.append("<tr>")
                    .append("<td><a href=\"").append(Html.escape(apiPath)).append('/').append(id).append("\">")
                    .append(id, 0, 8).append("</a></td>")
                    .append("<td>").append(Html.escape(meta.get("method"))).append("</td>")
                    .append("<td>").append(Html.escape(meta.get("path"))).append("</td>")
                    .append("<td>").append(Html.escape(meta.get("status_code"))).append("</td>")
                    .append("<td>").append(millis(request.totalTime())).append("</td>")
                    .append("<td>").append(Html.escape(request.storedAt())).append("</td>")
                    .append("</tr>");
        }
        if (requests.isEmpty()) {
            rows.append("<tr><td colspan=\"6\">No requests recorded yet.</td></tr>");
        }
        return page(
                "Request history",
                "<table class=\"toolbar-history\"><thead><tr><th>Request</th><th>Method</th><th>Path</th>"
                        + "<th>Status</th><th>Time</th><th>Stored</th></tr></thead><tbody>" + rows
                        + "</tbody></table>");
    }

    String detail(StoredRequest request) {
        Map<String, Object> meta = request.metadata();
        StringBuilder body = new StringBuilder();
        body.append("<p><a href=\"").append(Html.escape(apiPath)).append("/\">&larr; History</a></p>")
                .append("<p class=\"toolbar-summary\">")
                .append(Html.escape(meta.get("method"))).append(' ')
                .append(Html.escape(meta.get("path"))).append(" &rarr; ")
                .append(Html.escape(meta.get("status_code"))).append(" in ")
                .append(millis(request.totalTime()))
                .append("</p>");
        request.panelData().forEach((panelId, stats) -> {
            body.append("<section class=\"toolbar-panel\" id=\"panel-").append(Html.identifier(panelId)).append("\">")
                    .append("<h2>").append(Html.escape(panelId)).append("</h2>")
                    .append(table(stats))
                    .append("</section>");
        });
        body.append("<section class=\"toolbar-panel\" id=\"panel-metadata\"><h2>Metadata</h2>")
                .append(table(meta))
                .append("</section>");
        return page("Request " + request.requestId(), body.toString());
    }

    private String table(Map<String, ?> values) {
        StringBuilder rows = new StringBuilder("<table class=\"toolbar-stats\"><tbody>");
        values.forEach((key, value) -> rows.append("<tr><th>")
                .append(Html.escape(key))
                .append("</th><td>")
                .append(value instanceof Map<?, ?> || value instanceof List<?> ? "<pre>" + Html.escape(json(value)) + "</pre>" : Html.escape(value))
                .append("</td></tr>"));
        return rows.append("</tbody></table>").toString();
    }

    private String json(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOG.warn("Panel value not serializable: {}", e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    private String page(String title, String body) {
        return "<!DOCTYPE html>\n<html><head><meta charset=\"utf-8\"><title>" + Html.escape(title)
                + " - Debug Toolbar</title><link rel=\"stylesheet\" href=\"" + Html.escape(staticPath)
                + "/toolbar.css\"></head><body class=\"toolbar-page\"><h1>" + Html.escape(title) + "</h1>" + body
                + "</body></html>";
    }

    private static String millis(double seconds) {
        return String.format(Locale.ROOT, "%.2f ms", seconds * 1000);
    }
}
