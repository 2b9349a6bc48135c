package io.debugtoolbar.core.model;

import java.util.Arrays;

/**
 * Rewritten body ready for emission.
 *
 * @param body final body bytes
 * @param contentLength byte length of {@code body}, the value of the fresh Content-Length header
 * @param encodingRemoved whether the body was decoded, so Content-Encoding must be dropped
 */
public record InjectionResult(byte[] body, int contentLength, boolean encodingRemoved) {

    public InjectionResult {
        if (body == null) {
            throw new IllegalArgumentException("body must not be null");
        }
        if (contentLength != body.length) {
            throw new IllegalArgumentException(
                    "contentLength " + contentLength + " does not match body length " + body.length);
        }
    }

    public static InjectionResult of(byte[] body, boolean encodingRemoved) {
        return new InjectionResult(body, body.length, encodingRemoved);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InjectionResult that)) return false;
        return encodingRemoved == that.encodingRemoved && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(body) + Boolean.hashCode(encodingRemoved);
    }

    @Override
    public String toString() {
        return "InjectionResult[" + contentLength + " bytes, encodingRemoved=" + encodingRemoved + "]";
    }
}
