package io.debugtoolbar.core.engine;

import io.debugtoolbar.core.model.MediaType;
import io.debugtoolbar.core.model.PassThroughReason;
import io.debugtoolbar.core.model.RequestInfo;
import io.debugtoolbar.core.model.ResponseStart;
import java.util.Optional;

/**
 * Decides from the request and the response start alone whether a response is buffered for
 * rewriting. Anything ineligible is streamed through untouched, so the decision is made before the
 * first body chunk arrives.
 */
public final class EligibilityGate {

    private final InterceptionSettings settings;

    public EligibilityGate(InterceptionSettings settings) {
        this.settings = settings;
    }

    /**
     * Evaluates one response.
     *
     * @return empty if the response should be buffered, otherwise why it is passed through
     */
    public Optional<PassThroughReason> evaluate(RequestInfo request, ResponseStart start) {
        if (!settings.enabled()) {
            return Optional.of(PassThroughReason.DISABLED);
        }
        if (isExcluded(request.path())) {
            return Optional.of(PassThroughReason.EXCLUDED_PATH);
        }
        int status = start.status();
        if (request.isHead() || status < 200 || status == 204 || status == 304) {
            return Optional.of(PassThroughReason.NO_CONTENT);
        }
        if (status >= 300 && status < 400 && !settings.interceptRedirects()) {
            return Optional.of(PassThroughReason.REDIRECT);
        }
        if (!MediaType.fromContentType(start.headers().first("Content-Type")).isHtml()) {
            return Optional.of(PassThroughReason.NOT_HTML);
        }
        long declared = declaredLength(start);
        if (declared > settings.maxBodyBytes()) {
            return Optional.of(PassThroughReason.BODY_TOO_LARGE);
        }
        return Optional.empty();
    }

    /** True if {@code path} equals an excluded prefix or lies below it. */
    public boolean isExcluded(String path) {
        for (String prefix : settings.excludedPathPrefixes()) {
            if (matchesPrefix(path, prefix)) {
                return true;
            }
        }
        return false;
    }

    /** True if {@code path} equals {@code prefix} or continues it at a {@code /} boundary. */
    public static boolean matchesPrefix(String path, String prefix) {
        if (prefix.isEmpty() || !path.startsWith(prefix)) {
            return false;
        }
        return path.length() == prefix.length() || prefix.endsWith("/") || path.charAt(prefix.length()) == '/';
    }

    /** Declared Content-Length, or {@code -1} when absent or unparseable. */
    private static long declaredLength(ResponseStart start) {
        String value = start.headers().first("Content-Length");
        if (value == null) {
            return -1;
        }
        try {
            return Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
