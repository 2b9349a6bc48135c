package io.debugtoolbar.core.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-request diagnostic state shared by the panels.
 *
 * <p>
 * Holds panel statistics keyed by panel id, named timings in seconds, and free-form request
 * metadata (method, path, status). The context of the request being handled on the current
 * thread is available through {@link #current()}.
 *
 * <p>
 * Thread-safe: log appenders and async handlers may record into a context from other threads.
 */
public final class RequestContext {

    private static final ThreadLocal<RequestContext> CURRENT = new ThreadLocal<>();

    private final UUID requestId;
    private final long createdNanos;
    private final Map<String, Map<String, Object>> panelData = new LinkedHashMap<>();
    private final Map<String, Double> timingData = new LinkedHashMap<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public RequestContext() {
        this(UUID.randomUUID());
    }

    public RequestContext(UUID requestId) {
        this.requestId = requestId;
        this.createdNanos = System.nanoTime();
    }

    public UUID requestId() {
        return requestId;
    }

    /** Seconds elapsed since this context was created. */
    public double elapsedSeconds() {
        return (System.nanoTime() - createdNanos) / 1_000_000_000.0;
    }

    // ── Panel data ──

    /** Stores one statistic for a panel, replacing any earlier value under the same key. */
    public synchronized void storePanelData(String panelId, String key, Object value) {
        panelData.computeIfAbsent(panelId, id -> new LinkedHashMap<>()).put(key, value);
    }

    /**
     * Appends {@code value} to the list stored under {@code key}, starting a new list if there is
     * none. Readers always see an unmodifiable snapshot.
     */
    public synchronized void appendPanelData(String panelId, String key, Object value) {
        Map<String, Object> data = panelData.computeIfAbsent(panelId, id -> new LinkedHashMap<>());
        List<Object> values = new ArrayList<>();
        if (data.get(key) instanceof List<?> existing) {
            values.addAll(existing);
        }
        values.add(value);
        data.put(key, Collections.unmodifiableList(values));
    }

    /** Statistics recorded by a panel, or an empty map if it recorded none. */
    public synchronized Map<String, Object> panelData(String panelId) {
        Map<String, Object> data = panelData.get(panelId);
        return data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /** Copy of every panel's statistics. */
    public synchronized Map<String, Map<String, Object>> allPanelData() {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        panelData.forEach((id, data) -> copy.put(id, Collections.unmodifiableMap(new LinkedHashMap<>(data))));
        return Collections.unmodifiableMap(copy);
    }

    // ── Timings ──

    /** Records a named duration (or timestamp) in seconds. */
    public synchronized void recordTiming(String name, double seconds) {
        timingData.put(name, seconds);
    }

    /** A recorded timing, or {@code null} if absent. */
    public synchronized Double timing(String name) {
        return timingData.get(name);
    }

    public synchronized Map<String, Double> allTimings() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(timingData));
    }

    // ── Metadata ──

    public synchronized void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    /** A metadata value, or {@code null} if absent. */
    public synchronized Object metadata(String key) {
        return metadata.get(key);
    }

    public synchronized Map<String, Object> allMetadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    // ── Current-thread binding ──

    /** The context bound to the current thread, or {@code null}. */
    public static RequestContext current() {
        return CURRENT.get();
    }

    /** Binds {@code context} to the current thread; {@code null} clears the binding. */
    public static void bind(RequestContext context) {
        if (context == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(context);
        }
    }

    /** Clears the current thread's binding. */
    public static void unbind() {
        CURRENT.remove();
    }

    /** The current context, creating and binding a fresh one if none is bound. */
    public static RequestContext ensure() {
        RequestContext context = CURRENT.get();
        if (context == null) {
            context = new RequestContext();
            CURRENT.set(context);
        }
        return context;
    }

    @Override
    public String toString() {
        return "RequestContext[" + requestId + "]";
    }
}
