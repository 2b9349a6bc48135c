package io.debugtoolbar.core.toolbar;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolbarRendererTest {

    private final ToolbarRenderer renderer = new ToolbarRenderer(new ObjectMapper(), "/_debug_toolbar", "/_debug_toolbar/static");

    private static Map<String, Object> data(String subtitle) {
        Map<String, Object> panel = new LinkedHashMap<>();
        panel.put("panel_id", "RequestPanel");
        panel.put("title", "Request");
        panel.put("nav_title", "Request");
        panel.put("nav_subtitle", subtitle);
        panel.put("has_content", true);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("request_id", "0123456789abcdef");
        data.put("panels", List.of(panel));
        data.put("timing", Map.of("total_time", 0.0125));
        return data;
    }

    @Test
    void rendersBarLinksAndAssets() {
        String html = renderer.render(data("GET"));

        assertThat(html)
                .contains("<link rel=\"stylesheet\" href=\"/_debug_toolbar/static/toolbar.css\">")
                .contains("data-request-id=\"0123456789abcdef\"")
                .contains("<span class=\"toolbar-time\">12.50ms</span>")
                .contains("data-panel-id=\"RequestPanel\"")
                .contains("<span class=\"panel-subtitle\">GET</span>")
                .contains("href=\"/_debug_toolbar/0123456789abcdef\"")
                .contains(">01234567</a>")
                .contains("href=\"/_debug_toolbar/\"")
                .contains("<script src=\"/_debug_toolbar/static/toolbar.js\"></script>");
    }

    @Test
    void escapesPanelText() {
        String html = renderer.render(data("<img src=x onerror=\"alert(1)\">"));

        assertThat(html).contains("&lt;img src=x onerror=&quot;alert(1)&quot;&gt;").doesNotContain("<img");
    }

    @Test
    void embeddedJsonCannotCloseScript() {
        String html = renderer.render(data("</script><script>alert(1)</script>"));

        assertThat(renderer.json(data("</script>"))).contains("\\u003c/script>").doesNotContain("<");
        assertThat(html.indexOf("</script>")).isGreaterThan(html.indexOf("id=\"debug-toolbar-data\""));
        assertThat(html).doesNotContain("\"</script>");
    }

    @Test
    void embeddedJsonCannotOpenCommentInsideScript() {
        String html = renderer.render(data("<!--<script>"));

        String dataBlock = html.substring(
                html.indexOf("id=\"debug-toolbar-data\">"), html.indexOf("<script src="));
        assertThat(dataBlock).doesNotContain("<!--").contains("\\u003c!--\\u003cscript>");
        assertThat(html).endsWith("<script src=\"/_debug_toolbar/static/toolbar.js\"></script>\n");
    }

    @Test
    void panelEntriesThatAreNotMapsAreSkipped() {
        Map<String, Object> data = data("GET");
        data.put("panels", List.of("TimerPanel", Map.of("panel_id", "ResponsePanel", "nav_title", "Response")));

        String html = renderer.render(data);

        assertThat(html)
                .contains("data-panel-id=\"ResponsePanel\"")
                .doesNotContain("data-panel-id=\"TimerPanel\"")
                .doesNotContain("panel-subtitle");
    }

    @Test
    void emptySubtitleIsOmitted() {
        assertThat(renderer.render(data(""))).doesNotContain("panel-subtitle");
    }

    @Test
    void missingDataRendersPlaceholder() {
        String html = renderer.render(Map.of());

        assertThat(html).contains("data-request-id=\"N/A\"").contains("0.00ms");
    }
}
