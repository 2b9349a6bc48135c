package io.debugtoolbar.core.panels;

import io.debugtoolbar.core.context.RequestContext;
import io.debugtoolbar.core.toolbar.AbstractPanel;
import io.debugtoolbar.core.toolbar.DebugToolbar;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Request line, headers, cookies and client address, as recorded by the adapter. */
public final class RequestPanel extends AbstractPanel {

    static final List<String> KEYS = List.of(
            "method", "path", "query_string", "query_params", "host", "scheme", "content_type", "headers", "cookies",
            "client_host", "client_port");

    public RequestPanel(DebugToolbar toolbar) {
        super(toolbar);
    }

    @Override
    public String title() {
        return "Request";
    }

    @Override
    public String navSubtitle(RequestContext context) {
        Object method = context.metadata("method");
        return method == null ? "" : method.toString();
    }

    @Override
    public Map<String, Object> generateStats(RequestContext context) {
        Map<String, Object> stats = new LinkedHashMap<>();
        for (String key : KEYS) {
            Object value = context.metadata(key);
            if (value != null) {
                stats.put(key, value);
            }
        }
        return stats;
    }
}
