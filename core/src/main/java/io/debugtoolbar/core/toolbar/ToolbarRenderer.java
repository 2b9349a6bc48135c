package io.debugtoolbar.core.toolbar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders the toolbar fragment injected into HTML pages.
 *
 * <p>
 * The fragment is a self-contained block: stylesheet link, the toolbar bar with one button per
 * panel, links to the request detail and history pages, the toolbar data as embedded JSON, and
 * the script tag. Every value is HTML-escaped.
 */
public final class ToolbarRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(ToolbarRenderer.class);

    private final ObjectMapper mapper;
    private final String apiPath;
    private final String staticPath;

    public ToolbarRenderer(ObjectMapper mapper, String apiPath, String staticPath) {
        this.mapper = mapper;
        this.apiPath = apiPath;
        this.staticPath = staticPath;
    }

    /**
     * Renders the fragment from {@link DebugToolbar#toolbarData} output.
     *
     * @param data map with {@code request_id}, {@code panels} and {@code timing}
     * @return HTML fragment
     */
    public String render(Map<String, Object> data) {
        String requestId = String.valueOf(data.getOrDefault("request_id", "N/A"));
        String shortId = requestId.length() > 8 ? requestId.substring(0, 8) : requestId;
        double totalMs = totalSeconds(data) * 1000;

        StringBuilder buttons = new StringBuilder();
        for (Map<?, ?> panel : panels(data)) {
            Object navSubtitle = panel.get("nav_subtitle");
            String subtitle = navSubtitle == null ? "" : String.valueOf(navSubtitle);
            buttons.append("<button class=\"toolbar-panel-btn\" data-panel-id=\"")
                    .append(Html.escape(panel.get("panel_id")))
                    .append("\"><span class=\"panel-title\">")
                    .append(Html.escape(panel.get("nav_title")))
                    .append("</span>");
            if (!subtitle.isEmpty()) {
                buttons.append("<span class=\"panel-subtitle\">")
                        .append(Html.escape(subtitle))
                        .append("</span>");
            }
            buttons.append("</button>");
        }

        String id = Html.escape(requestId);
        return "\n<link rel=\"stylesheet\" href=\"" + Html.escape(staticPath) + "/toolbar.css\">\n"
                + "<div id=\"debug-toolbar\" data-request-id=\"" + id + "\" data-api-path=\""
                + Html.escape(apiPath) + "\">"
                + "<div class=\"toolbar-bar\">"
                + "<span class=\"toolbar-brand\" title=\"Click to toggle\">Debug Toolbar</span>"
                + "<span class=\"toolbar-time\">" + String.format(Locale.ROOT, "%.2f", totalMs) + "ms</span>"
                + "<div class=\"toolbar-panels\">" + buttons + "</div>"
                + "<span class=\"toolbar-request-id\"><a href=\"" + Html.escape(apiPath) + "/" + id
                + "\" class=\"toolbar-history-link\" title=\"View request details\">" + Html.escape(shortId)
                + "</a></span>"
                + "<a href=\"" + Html.escape(apiPath) + "/\" class=\"toolbar-history-link\""
                + " title=\"View request history\">History</a>"
                + "</div>"
                + "<div class=\"toolbar-details\"></div>"
                + "</div>\n"
                + "<script type=\"application/json\" id=\"debug-toolbar-data\">" + json(data) + "</script>\n"
                + "<script src=\"" + Html.escape(staticPath) + "/toolbar.js\"></script>\n";
    }

    /**
     * JSON with every {@code <} written as a unicode escape, so no value can end the surrounding
     * script element or open a comment inside it. {@code <} only occurs inside JSON strings.
     */
    String json(Map<String, Object> data) {
        try {
            return mapper.writeValueAsString(data).replace("<", "\\u003c");
        } catch (JsonProcessingException e) {
            LOG.warn("Toolbar data not serializable: {}", e.getOriginalMessage());
            return "{}";
        }
    }

    private static List<Map<?, ?>> panels(Map<String, Object> data) {
        List<Map<?, ?>> panels = new ArrayList<>();
        if (data.get("panels") instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> panel) {
                    panels.add(panel);
                }
            }
        }
        return panels;
    }

    private static double totalSeconds(Map<String, Object> data) {
        if (data.get("timing") instanceof Map<?, ?> timing
                && timing.get(DebugToolbar.TOTAL_TIME) instanceof Number total) {
            return total.doubleValue();
        }
        return 0.0;
    }
}
