package io.debugtoolbar.core.model;

import java.util.Objects;

/** Start of a response: status code and declared headers. */
public record ResponseStart(int status, HttpHeaders headers) implements ResponseEvent {

    public ResponseStart {
        if (status < 100 || status > 999) {
            throw new IllegalArgumentException("invalid HTTP status: " + status);
        }
        Objects.requireNonNull(headers, "headers must not be null; use HttpHeaders.empty()");
    }
}
