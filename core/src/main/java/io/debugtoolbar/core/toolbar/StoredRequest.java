package io.debugtoolbar.core.toolbar;

import io.debugtoolbar.core.context.RequestContext;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Snapshot of one request's diagnostics, as kept in {@link ToolbarStorage}.
 *
 * @param requestId request identifier
 * @param panelData statistics per panel id
 * @param timingData named timings in seconds
 * @param metadata request and response metadata
 * @param storedAt when the snapshot was taken
 */
public record StoredRequest(
        UUID requestId,
        Map<String, Map<String, Object>> panelData,
        Map<String, Double> timingData,
        Map<String, Object> metadata,
        Instant storedAt) {

    /** Maps are kept as given; {@link #from} passes ordered, unmodifiable copies. */
    public StoredRequest {
        panelData = panelData == null ? Map.of() : panelData;
        timingData = timingData == null ? Map.of() : timingData;
        metadata = metadata == null ? Map.of() : metadata;
    }

    /** Copies the current contents of a context. */
    public static StoredRequest from(RequestContext context) {
        return new StoredRequest(
                context.requestId(),
                context.allPanelData(),
                context.allTimings(),
                context.allMetadata(),
                Instant.now());
    }

    /** Total request time in seconds, or 0 if not recorded. */
    public double totalTime() {
        Double total = timingData.get(DebugToolbar.TOTAL_TIME);
        return total == null ? 0.0 : total;
    }
}
