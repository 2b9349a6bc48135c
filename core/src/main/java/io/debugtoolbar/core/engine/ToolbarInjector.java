package io.debugtoolbar.core.engine;

import io.debugtoolbar.core.model.InjectionResult;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Marker-based insertion of the toolbar fragment.
 *
 * <p>
 * The fragment goes immediately before the last occurrence of the marker. If the exact marker is
 * absent a case-insensitive match is tried ({@code </BODY>}), and failing that the fragment is
 * appended. No HTML parsing is done.
 */
public final class ToolbarInjector {

    private final String marker;

    public ToolbarInjector(String marker) {
        this.marker = Objects.requireNonNull(marker, "marker must not be null");
        if (marker.isEmpty()) {
            throw new IllegalArgumentException("marker must not be empty");
        }
    }

    /**
     * Splices {@code fragment} into {@code body}.
     *
     * @return the new body text
     */
    public String inject(String body, String fragment) {
        int at = insertionPoint(body);
        if (at < 0) {
            return body + fragment;
        }
        return new StringBuilder(body.length() + fragment.length())
                .append(body, 0, at)
                .append(fragment)
                .append(body, at, body.length())
                .toString();
    }

    /**
     * Splices {@code fragment} into {@code body} and encodes the result as UTF-8.
     *
     * @param encodingRemoved carried through to the result for the header rewrite
     */
    public InjectionResult inject(String body, String fragment, boolean encodingRemoved) {
        byte[] bytes = inject(body, fragment).getBytes(StandardCharsets.UTF_8);
        return InjectionResult.of(bytes, encodingRemoved);
    }

    /** Index of the last marker occurrence, exact first, then ignoring case; {@code -1} if none. */
    int insertionPoint(String body) {
        int exact = body.lastIndexOf(marker);
        if (exact >= 0) {
            return exact;
        }
        for (int i = body.length() - marker.length(); i >= 0; i--) {
            if (body.regionMatches(true, i, marker, 0, marker.length())) {
                return i;
            }
        }
        return -1;
    }

    public String marker() {
        return marker;
    }
}
