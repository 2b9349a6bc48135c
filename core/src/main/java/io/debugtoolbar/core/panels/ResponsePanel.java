package io.debugtoolbar.core.panels;

import io.debugtoolbar.core.context.RequestContext;
import io.debugtoolbar.core.toolbar.AbstractPanel;
import io.debugtoolbar.core.toolbar.DebugToolbar;
import java.util.LinkedHashMap;
import java.util.Map;

/** Response status, content type and headers. */
public final class ResponsePanel extends AbstractPanel {

    public ResponsePanel(DebugToolbar toolbar) {
        super(toolbar);
    }

    @Override
    public String title() {
        return "Response";
    }

    @Override
    public String navSubtitle(RequestContext context) {
        Object status = context.metadata("status_code");
        return status == null ? "" : status.toString();
    }

    @Override
    public Map<String, Object> generateStats(RequestContext context) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("status_code", context.metadata("status_code"));
        stats.put("content_type", context.metadata("response_content_type"));
        Object headers = context.metadata("response_headers");
        stats.put("headers", headers == null ? Map.of() : headers);
        return stats;
    }
}
