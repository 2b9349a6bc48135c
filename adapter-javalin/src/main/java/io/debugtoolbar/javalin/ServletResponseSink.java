package io.debugtoolbar.javalin;

import io.debugtoolbar.core.model.HttpHeaders;
import io.debugtoolbar.core.model.ResponseBody;
import io.debugtoolbar.core.model.ResponseEvent;
import io.debugtoolbar.core.model.ResponseStart;
import io.debugtoolbar.core.spi.ResponseSink;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes response events to the container's real response.
 *
 * <p>
 * The application set its status and headers on the real response already (the capturing wrapper
 * only intercepts the body), so a start event is applied as a diff against the {@link #snapshot()}
 * it was built from: names the snapshot had and the event no longer carries are removed, changed
 * ones are replaced. Headers added to the response after the snapshot are left alone, and
 * pass-through responses touch no header at all.
 */
final class ServletResponseSink implements ResponseSink {

    private final HttpServletResponse response;
    private ServletOutputStream out;
    private HttpHeaders baseline = HttpHeaders.empty();

    ServletResponseSink(HttpServletResponse response) {
        this.response = response;
    }

    @Override
    public void send(ResponseEvent event) throws IOException {
        if (event instanceof ResponseStart start) {
            applyStart(start);
        } else if (event instanceof ResponseBody body) {
            ServletOutputStream stream = stream();
            if (body.size() > 0) {
                stream.write(body.body());
            }
            if (!body.moreBody()) {
                stream.flush();
            }
        }
    }

    /** Captures the response's current headers as the base the next start event is diffed against. */
    HttpHeaders snapshot() {
        baseline = headersOf(response);
        return baseline;
    }

    private void applyStart(ResponseStart start) {
        response.setStatus(start.status());
        HttpHeaders current = headersOf(response);
        HttpHeaders desired = start.headers();
        if (current.equals(desired)) {
            return;
        }
        for (String name : baseline.names()) {
            if (!desired.contains(name) && current.contains(name)) {
                response.setHeader(name, null);
            }
        }
        for (String name : desired.names()) {
            List<String> values = desired.all(name);
            if (values.equals(current.all(name))) {
                continue;
            }
            response.setHeader(name, values.get(0));
            for (int i = 1; i < values.size(); i++) {
                response.addHeader(name, values.get(i));
            }
        }
    }

    private ServletOutputStream stream() throws IOException {
        if (out == null) {
            out = response.getOutputStream();
        }
        return out;
    }

    /** Snapshot of the headers currently set on {@code response}, in container order. */
    static HttpHeaders headersOf(HttpServletResponse response) {
        List<HttpHeaders.Header> headers = new ArrayList<>();
        boolean hasContentType = false;
        for (String name : response.getHeaderNames()) {
            if ("Content-Type".equalsIgnoreCase(name)) {
                hasContentType = true;
            }
            for (String value : response.getHeaders(name)) {
                headers.add(new HttpHeaders.Header(name, value));
            }
        }
        if (!hasContentType && response.getContentType() != null) {
            headers.add(new HttpHeaders.Header("Content-Type", response.getContentType()));
        }
        return HttpHeaders.of(headers);
    }
}
