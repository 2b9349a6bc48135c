package io.debugtoolbar.core.model;

import java.util.Objects;

/**
 * The parts of the request the interception pipeline looks at.
 *
 * @param method HTTP method, upper case
 * @param path request path without the query string
 * @param host value of the Host header without port, or {@code null}
 * @param query raw query string, or {@code null}
 */
public record RequestInfo(String method, String path, String host, String query) {

    public RequestInfo {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }

    /** Shorthand for tests and adapters that only know method and path. */
    public static RequestInfo of(String method, String path) {
        return new RequestInfo(method, path, null, null);
    }

    public boolean isHead() {
        return "HEAD".equalsIgnoreCase(method);
    }
}
