package io.debugtoolbar.core.engine;

import java.util.List;
import java.util.Objects;

/**
 * Configuration consumed by the interception pipeline.
 *
 * @param enabled {@code false} turns the pipeline into a pure pass-through that buffers nothing
 * @param insertBefore marker the fragment is spliced in front of
 * @param excludedPathPrefixes request path prefixes that are never rewritten
 * @param maxBodyBytes largest body, compressed or decoded, the pipeline will buffer
 * @param interceptRedirects whether 3xx responses with an HTML body are rewritten
 */
public record InterceptionSettings(
        boolean enabled,
        String insertBefore,
        List<String> excludedPathPrefixes,
        long maxBodyBytes,
        boolean interceptRedirects) {

    public static final String DEFAULT_MARKER = "</body>";
    public static final long DEFAULT_MAX_BODY_BYTES = 5L * 1024 * 1024;

    public InterceptionSettings {
        Objects.requireNonNull(insertBefore, "insertBefore must not be null");
        if (insertBefore.isEmpty()) {
            throw new IllegalArgumentException("insertBefore must not be empty");
        }
        excludedPathPrefixes = excludedPathPrefixes == null ? List.of() : List.copyOf(excludedPathPrefixes);
        if (maxBodyBytes <= 0) {
            throw new IllegalArgumentException("maxBodyBytes must be positive, got " + maxBodyBytes);
        }
    }

    /** Enabled, {@code </body>} marker, no exclusions, 5 MiB limit, redirects not rewritten. */
    public static InterceptionSettings defaults() {
        return new InterceptionSettings(true, DEFAULT_MARKER, List.of(), DEFAULT_MAX_BODY_BYTES, false);
    }

    /** Copy with interception switched off. */
    public InterceptionSettings disabled() {
        return new InterceptionSettings(false, insertBefore, excludedPathPrefixes, maxBodyBytes, interceptRedirects);
    }
}
