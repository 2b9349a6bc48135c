package io.debugtoolbar.core.engine;

import io.debugtoolbar.core.model.HttpHeaders;
import io.debugtoolbar.core.model.InjectionResult;

/**
 * Final headers for a rewritten response.
 *
 * <p>
 * The body is emitted as one complete, unframed buffer, so every Content-Length is replaced by a
 * fresh one and Transfer-Encoding is dropped. Content-Encoding is dropped only when the body was
 * decoded. All other lines keep their order and duplicates.
 */
public final class HeaderRewriter {

    static final String CONTENT_LENGTH = "Content-Length";
    static final String CONTENT_ENCODING = "Content-Encoding";
    static final String TRANSFER_ENCODING = "Transfer-Encoding";

    /**
     * @param original headers declared by the application
     * @param result rewritten body
     * @param extra headers appended after the original ones (may be empty)
     * @return the headers to emit
     */
    public HttpHeaders rewrite(HttpHeaders original, InjectionResult result, HttpHeaders extra) {
        HttpHeaders headers = original.without(CONTENT_LENGTH).without(TRANSFER_ENCODING);
        if (result.encodingRemoved()) {
            headers = headers.without(CONTENT_ENCODING);
        }
        for (HttpHeaders.Header header : extra.entries()) {
            headers = headers.with(header.name(), header.value());
        }
        return headers.with(CONTENT_LENGTH, Integer.toString(result.contentLength()));
    }
}
