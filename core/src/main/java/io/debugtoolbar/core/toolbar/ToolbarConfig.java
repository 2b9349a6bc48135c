package io.debugtoolbar.core.toolbar;

import io.debugtoolbar.core.engine.EligibilityGate;
import io.debugtoolbar.core.engine.InterceptionSettings;
import io.debugtoolbar.core.error.ToolbarConfigException;
import io.debugtoolbar.core.model.RequestInfo;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Toolbar configuration.
 *
 * <p>
 * Use {@link #builder()}; every field has a default.
 *
 * @param enabled master switch; when off no panels load and nothing is intercepted
 * @param insertBefore marker the toolbar is inserted in front of
 * @param maxRequestHistory number of requests kept in {@link ToolbarStorage}
 * @param apiPath mount point of the toolbar's own pages and JSON API
 * @param staticPath mount point of the toolbar stylesheet and script
 * @param panels panel class names, in display order
 * @param extraPanels panel class names appended after {@code panels}
 * @param excludePanels panels to drop, by simple or fully qualified class name
 * @param excludePaths request path prefixes never instrumented
 * @param allowedHosts hosts the toolbar is shown for; empty means all
 * @param interceptRedirects whether 3xx HTML responses get the toolbar
 * @param maxBodyBytes largest HTML body buffered for injection
 * @param serverTiming whether rewritten responses carry a {@code Server-Timing} header
 * @param showToolbar final per-request veto
 */
public record ToolbarConfig(
        boolean enabled,
        String insertBefore,
        int maxRequestHistory,
        String apiPath,
        String staticPath,
        List<String> panels,
        List<String> extraPanels,
        List<String> excludePanels,
        List<String> excludePaths,
        List<String> allowedHosts,
        boolean interceptRedirects,
        long maxBodyBytes,
        boolean serverTiming,
        Predicate<RequestInfo> showToolbar) {

    public static final List<String> DEFAULT_PANELS = List.of(
            "io.debugtoolbar.core.panels.TimerPanel",
            "io.debugtoolbar.core.panels.RequestPanel",
            "io.debugtoolbar.core.panels.ResponsePanel",
            "io.debugtoolbar.core.panels.VersionsPanel");

    public ToolbarConfig {
        if (insertBefore == null || insertBefore.isEmpty()) {
            throw new ToolbarConfigException("insert-before marker must not be empty");
        }
        if (maxRequestHistory < 1) {
            throw new ToolbarConfigException("max-request-history must be at least 1, got " + maxRequestHistory);
        }
        if (maxBodyBytes < 1) {
            throw new ToolbarConfigException("max-body-bytes must be positive, got " + maxBodyBytes);
        }
        apiPath = normalizePath(apiPath, "api-path");
        staticPath = normalizePath(staticPath, "static-path");
        panels = List.copyOf(panels);
        extraPanels = List.copyOf(extraPanels);
        excludePanels = List.copyOf(excludePanels);
        excludePaths = List.copyOf(excludePaths);
        allowedHosts = List.copyOf(allowedHosts);
        showToolbar = showToolbar == null ? request -> true : showToolbar;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** {@link #panels()} followed by {@link #extraPanels()}, minus {@link #excludePanels()}. */
    public List<String> allPanels() {
        List<String> all = new ArrayList<>(panels.size() + extraPanels.size());
        for (String name : panels) {
            if (!isExcludedPanel(name) && !all.contains(name)) {
                all.add(name);
            }
        }
        for (String name : extraPanels) {
            if (!isExcludedPanel(name) && !all.contains(name)) {
                all.add(name);
            }
        }
        return List.copyOf(all);
    }

    private boolean isExcludedPanel(String className) {
        String simpleName = className.substring(className.lastIndexOf('.') + 1);
        return excludePanels.contains(className) || excludePanels.contains(simpleName);
    }

    /** Settings for the interception pipeline; the toolbar's own paths are always excluded. */
    public InterceptionSettings interceptionSettings() {
        List<String> excluded = new ArrayList<>(excludePaths);
        excluded.add(apiPath);
        if (!EligibilityGate.matchesPrefix(staticPath, apiPath)) {
            excluded.add(staticPath);
        }
        return new InterceptionSettings(enabled, insertBefore, excluded, maxBodyBytes, interceptRedirects);
    }

    /** Whether the toolbar applies to this request at all. */
    public boolean shouldShowToolbar(RequestInfo request) {
        if (!enabled || !isHostAllowed(request.host())) {
            return false;
        }
        return showToolbar.test(request);
    }

    /** True if {@code host} is allowed; an empty allow-list allows every host. */
    public boolean isHostAllowed(String host) {
        if (allowedHosts.isEmpty()) {
            return true;
        }
        if (host == null) {
            return false;
        }
        String bare = host.toLowerCase(Locale.ROOT);
        for (String allowed : allowedHosts) {
            if (allowed.equalsIgnoreCase(bare)) {
                return true;
            }
        }
        return false;
    }

    private static String normalizePath(String path, String name) {
        if (path == null || path.isBlank() || !path.startsWith("/")) {
            throw new ToolbarConfigException(name + " must start with '/', got '" + path + "'");
        }
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    /** Builder for {@link ToolbarConfig}. */
    public static final class Builder {

        private boolean enabled = true;
        private String insertBefore = InterceptionSettings.DEFAULT_MARKER;
        private int maxRequestHistory = 50;
        private String apiPath = "/_debug_toolbar";
        private String staticPath = "/_debug_toolbar/static";
        private List<String> panels = DEFAULT_PANELS;
        private List<String> extraPanels = List.of();
        private List<String> excludePanels = List.of();
        private List<String> excludePaths = List.of();
        private List<String> allowedHosts = List.of();
        private boolean interceptRedirects = false;
        private long maxBodyBytes = InterceptionSettings.DEFAULT_MAX_BODY_BYTES;
        private boolean serverTiming = false;
        private Predicate<RequestInfo> showToolbar = request -> true;

        Builder() {}

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder insertBefore(String insertBefore) {
            this.insertBefore = insertBefore;
            return this;
        }

        public Builder maxRequestHistory(int maxRequestHistory) {
            this.maxRequestHistory = maxRequestHistory;
            return this;
        }

        public Builder apiPath(String apiPath) {
            this.apiPath = apiPath;
            return this;
        }

        public Builder staticPath(String staticPath) {
            this.staticPath = staticPath;
            return this;
        }

        public Builder panels(List<String> panels) {
            this.panels = panels;
            return this;
        }

        public Builder extraPanels(List<String> extraPanels) {
            this.extraPanels = extraPanels;
            return this;
        }

        public Builder excludePanels(List<String> excludePanels) {
            this.excludePanels = excludePanels;
            return this;
        }

        public Builder excludePaths(List<String> excludePaths) {
            this.excludePaths = excludePaths;
            return this;
        }

        public Builder allowedHosts(List<String> allowedHosts) {
            this.allowedHosts = allowedHosts;
            return this;
        }

        public Builder interceptRedirects(boolean interceptRedirects) {
            this.interceptRedirects = interceptRedirects;
            return this;
        }

        public Builder maxBodyBytes(long maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder serverTiming(boolean serverTiming) {
            this.serverTiming = serverTiming;
            return this;
        }

        public Builder showToolbar(Predicate<RequestInfo> showToolbar) {
            this.showToolbar = showToolbar;
            return this;
        }

        public ToolbarConfig build() {
            return new ToolbarConfig(
                    enabled,
                    insertBefore,
                    maxRequestHistory,
                    apiPath,
                    staticPath,
                    panels,
                    extraPanels,
                    excludePanels,
                    excludePaths,
                    allowedHosts,
                    interceptRedirects,
                    maxBodyBytes,
                    serverTiming,
                    showToolbar);
        }
    }
}
