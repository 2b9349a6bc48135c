package io.debugtoolbar.core.spi;

import io.debugtoolbar.core.context.RequestContext;
import java.util.Map;

/**
 * A diagnostic panel: receives request lifecycle callbacks and produces a bag of statistics.
 *
 * <p>
 * Panels are loaded by class name. An implementation needs a public constructor taking a
 * {@link io.debugtoolbar.core.toolbar.DebugToolbar} or a public no-arg constructor. One instance
 * serves every request, so per-request state belongs in the {@link RequestContext}, never in
 * fields. Exceptions thrown from any callback are logged and never affect the response.
 */
public interface Panel {

    /** Stable identifier; the simple class name unless overridden. */
    default String id() {
        return getClass().getSimpleName();
    }

    /** Title shown in the panel detail view. */
    String title();

    /** Label on the toolbar button; falls back to {@link #title()}. */
    default String navTitle() {
        String title = title();
        return title == null ? "" : title;
    }

    /** Short per-request text under the button, e.g. {@code "12.3 ms"}. */
    default String navSubtitle(RequestContext context) {
        return "";
    }

    /** Whether the panel has a detail view. */
    default boolean hasContent() {
        return true;
    }

    boolean isEnabled();

    void setEnabled(boolean enabled);

    /** Called before the application handles the request. */
    default void processRequest(RequestContext context) {}

    /** Called once the application produced its response. */
    default void processResponse(RequestContext context) {}

    /** Statistics for this request, stored in the history. */
    Map<String, Object> generateStats(RequestContext context);

    /** Server-Timing metrics, metric name to duration in seconds. */
    default Map<String, Double> generateServerTiming(RequestContext context) {
        return Map.of();
    }
}
