package io.debugtoolbar.core.toolbar;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.debugtoolbar.core.context.RequestContext;
import io.debugtoolbar.core.encoding.CodecRegistry;
import io.debugtoolbar.core.engine.ResponseInterceptor;
import io.debugtoolbar.core.engine.ResponsePipeline;
import io.debugtoolbar.core.model.RequestInfo;
import io.debugtoolbar.core.spi.Panel;
import io.debugtoolbar.core.spi.ResponseHook;
import io.debugtoolbar.core.spi.ResponseSink;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the panels around each request and stores the results.
 *
 * <p>
 * Lifecycle of one request:
 * <ol>
 * <li>{@link #processRequest} creates a {@link RequestContext}, binds it to the thread and lets
 * every enabled panel observe the request.
 * <li>The application runs; its response goes through a {@link ResponseInterceptor} obtained
 * from {@link #intercept}.
 * <li>{@link #processResponse} records the total time, collects panel statistics, stores them in
 * the history and unbinds the context. For HTML responses this happens just before the fragment
 * is rendered, so the injected toolbar shows the final numbers.
 * </ol>
 *
 * <p>
 * Panel failures are logged and never affect the response.
 */
public final class DebugToolbar {

    private static final Logger LOG = LoggerFactory.getLogger(DebugToolbar.class);

    /** Timing name of the request start timestamp (seconds, monotonic clock). */
    public static final String REQUEST_START = "request_start";

    /** Timing name of the total request duration in seconds. */
    public static final String TOTAL_TIME = "total_time";

    private final ToolbarConfig config;
    private final ToolbarStorage storage;
    private final ResponsePipeline pipeline;
    private final ToolbarRenderer renderer;
    private final ObjectMapper mapper;
    private final List<Panel> panels;

    public DebugToolbar(ToolbarConfig config) {
        this(config, CodecRegistry.standard());
    }

    public DebugToolbar(ToolbarConfig config, CodecRegistry codecs) {
        this(config, codecs, new ObjectMapper());
    }

    public DebugToolbar(ToolbarConfig config, CodecRegistry codecs, ObjectMapper mapper) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.storage = new ToolbarStorage(config.maxRequestHistory());
        this.pipeline = new ResponsePipeline(config.interceptionSettings(), codecs);
        this.renderer = new ToolbarRenderer(mapper, config.apiPath(), config.staticPath());
        this.panels = Collections.unmodifiableList(loadPanels());
        LOG.info(
                "Debug toolbar {} with panels {} and codecs {}",
                config.enabled() ? "enabled" : "disabled",
                panels.stream().map(Panel::id).toList(),
                codecs.availableTokens());
    }

    // ── Panel loading ──

    private List<Panel> loadPanels() {
        List<Panel> loaded = new ArrayList<>();
        if (!config.enabled()) {
            return loaded;
        }
        for (String className : config.allPanels()) {
            Panel panel = instantiate(className);
            if (panel != null) {
                loaded.add(panel);
            }
        }
        return loaded;
    }

    /** Creates a panel from its class name, or returns {@code null} after logging why it cannot. */
    private Panel instantiate(String className) {
        try {
            Class<?> type = Class.forName(className, true, panelClassLoader());
            if (!Panel.class.isAssignableFrom(type)) {
                LOG.warn("Skipping panel {}: does not implement {}", className, Panel.class.getName());
                return null;
            }
            return (Panel) newInstance(type);
        } catch (ClassNotFoundException e) {
            LOG.warn("Skipping panel {}: class not found", className);
        } catch (NoSuchMethodException e) {
            LOG.warn("Skipping panel {}: needs a public (DebugToolbar) or no-arg constructor", className);
        } catch (InvocationTargetException e) {
            LOG.warn("Skipping panel {}: constructor failed", className, e.getCause());
        } catch (ReflectiveOperationException | LinkageError | RuntimeException e) {
            LOG.warn("Skipping panel {}: {}", className, e.toString());
        }
        return null;
    }

    private Object newInstance(Class<?> type) throws ReflectiveOperationException {
        try {
            Constructor<?> withToolbar = type.getConstructor(DebugToolbar.class);
            return withToolbar.newInstance(this);
        } catch (NoSuchMethodException e) {
            return type.getConstructor().newInstance();
        }
    }

    private static ClassLoader panelClassLoader() {
        ClassLoader context = Thread.currentThread().getContextClassLoader();
        return context != null ? context : DebugToolbar.class.getClassLoader();
    }

    // ── Accessors ──

    public ToolbarConfig config() {
        return config;
    }

    public ToolbarStorage storage() {
        return storage;
    }

    public ResponsePipeline pipeline() {
        return pipeline;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /** Loaded panels in display order. */
    public List<Panel> panels() {
        return panels;
    }

    /** Loaded panels that are currently enabled. */
    public List<Panel> enabledPanels() {
        return panels.stream().filter(Panel::isEnabled).toList();
    }

    /** The panel with the given id, or {@code null}. */
    public Panel panel(String panelId) {
        for (Panel panel : panels) {
            if (panel.id().equals(panelId)) {
                return panel;
            }
        }
        return null;
    }

    // ── Request lifecycle ──

    /**
     * Opens and binds a context for a new request and runs the panels' request hooks.
     *
     * @param request the incoming request
     * @return the new context
     */
    public RequestContext processRequest(RequestInfo request) {
        RequestContext context = new RequestContext();
        RequestContext.bind(context);
        context.recordTiming(REQUEST_START, System.nanoTime() / 1_000_000_000.0);
        context.putMetadata("method", request.method());
        context.putMetadata("path", request.path());
        context.putMetadata("query_string", request.query() == null ? "" : request.query());
        context.putMetadata("host", request.host());

        for (Panel panel : enabledPanels()) {
            try {
                panel.processRequest(context);
            } catch (RuntimeException e) {
                LOG.warn("Panel {} failed in processRequest", panel.id(), e);
            }
        }
        return context;
    }

    /**
     * Finishes a request: records the total time, collects statistics from every enabled panel,
     * stores the snapshot and unbinds the context. A {@code null} context is ignored.
     */
    public void processResponse(RequestContext context) {
        if (context == null) {
            return;
        }
        try {
            Double start = context.timing(REQUEST_START);
            double total = start != null
                    ? System.nanoTime() / 1_000_000_000.0 - start
                    : context.elapsedSeconds();
            context.recordTiming(TOTAL_TIME, total);

            for (Panel panel : enabledPanels()) {
                try {
                    panel.processResponse(context);
                    Map<String, Object> stats = panel.generateStats(context);
                    if (stats != null) {
                        stats.forEach((key, value) -> context.storePanelData(panel.id(), key, value));
                    }
                } catch (RuntimeException e) {
                    LOG.warn("Panel {} failed in processResponse", panel.id(), e);
                }
            }
            storage.storeFromContext(context);
        } finally {
            if (RequestContext.current() == context) {
                RequestContext.unbind();
            }
        }
    }

    /**
     * {@code Server-Timing} header value: every panel's metrics followed by {@code total}, or the
     * empty string for a {@code null} context.
     */
    public String serverTimingHeader(RequestContext context) {
        if (context == null) {
            return "";
        }
        List<String> metrics = new ArrayList<>();
        for (Panel panel : enabledPanels()) {
            try {
                panel.generateServerTiming(context).forEach((name, seconds) -> metrics.add(metric(name, seconds)));
            } catch (RuntimeException e) {
                LOG.warn("Panel {} failed in generateServerTiming", panel.id(), e);
            }
        }
        Double total = context.timing(TOTAL_TIME);
        metrics.add(metric("total", total != null ? total : context.elapsedSeconds()));
        return String.join(", ", metrics);
    }

    private static String metric(String name, double seconds) {
        return name + ";dur=" + String.format(Locale.ROOT, "%.2f", seconds * 1000);
    }

    /**
     * Data the injected toolbar is rendered from: {@code request_id}, {@code panels} (id, titles,
     * content flag) and {@code timing}. Empty for a {@code null} context.
     */
    public Map<String, Object> toolbarData(RequestContext context) {
        if (context == null) {
            return Map.of();
        }
        List<Map<String, Object>> panelSummaries = new ArrayList<>();
        for (Panel panel : enabledPanels()) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("panel_id", panel.id());
            summary.put("title", panel.title());
            summary.put("nav_title", panel.navTitle());
            summary.put("nav_subtitle", subtitle(panel, context));
            summary.put("has_content", panel.hasContent());
            panelSummaries.add(summary);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("request_id", context.requestId().toString());
        data.put("panels", panelSummaries);
        data.put("timing", context.allTimings());
        return data;
    }

    private static String subtitle(Panel panel, RequestContext context) {
        try {
            String subtitle = panel.navSubtitle(context);
            return subtitle == null ? "" : subtitle;
        } catch (RuntimeException e) {
            LOG.warn("Panel {} failed in navSubtitle", panel.id(), e);
            return "";
        }
    }

    /** Renders the fragment for a finished request. */
    public String renderFragment(RequestContext context) {
        return renderer.render(toolbarData(context));
    }

    // ── Pipeline bridge ──

    /** A response hook that finishes {@code context} and renders its toolbar. */
    public ResponseHook newResponseHook(RequestContext context) {
        return new ToolbarResponseHook(this, context);
    }

    /**
     * Starts intercepting the response to {@code request}.
     *
     * @param request the request being answered
     * @param context the context returned by {@link #processRequest}
     * @param downstream the transport
     * @return the sink the application's response events must be sent to
     */
    public ResponseInterceptor intercept(RequestInfo request, RequestContext context, ResponseSink downstream) {
        return pipeline.intercept(request, newResponseHook(context), downstream);
    }
}
