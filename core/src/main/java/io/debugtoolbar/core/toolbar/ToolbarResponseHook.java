package io.debugtoolbar.core.toolbar;

import io.debugtoolbar.core.context.RequestContext;
import io.debugtoolbar.core.model.HttpHeaders;
import io.debugtoolbar.core.spi.InterceptionOutcome;
import io.debugtoolbar.core.spi.ResponseHook;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connects one request's {@link RequestContext} to the interception pipeline: records response
 * metadata, finishes the request before rendering, and makes sure responses that were never
 * rewritten are still stored in the history.
 */
final class ToolbarResponseHook implements ResponseHook {

    private final DebugToolbar toolbar;
    private final RequestContext context;
    private final AtomicBoolean finished = new AtomicBoolean();

    ToolbarResponseHook(DebugToolbar toolbar, RequestContext context) {
        this.toolbar = toolbar;
        this.context = context;
    }

    @Override
    public void responseStarted(int status, HttpHeaders headers) {
        context.putMetadata("status_code", status);
        context.putMetadata("response_headers", headers.toSingleValueMap());
        String contentType = headers.first("Content-Type");
        context.putMetadata("response_content_type", contentType == null ? "" : contentType);
    }

    @Override
    public String renderFragment(String body, HttpHeaders headers) {
        finish();
        return toolbar.renderFragment(context);
    }

    @Override
    public HttpHeaders extraHeaders() {
        if (!toolbar.config().serverTiming()) {
            return HttpHeaders.empty();
        }
        return HttpHeaders.of("Server-Timing", toolbar.serverTimingHeader(context));
    }

    @Override
    public void onComplete(InterceptionOutcome outcome) {
        context.putMetadata("toolbar_injected", outcome.isInjected());
        if (outcome.reason() != null) {
            context.putMetadata("pass_through_reason", outcome.reason().name());
        }
        context.putMetadata("response_size", outcome.bodyBytes());
        if (finished.get()) {
            // already stored by renderFragment; refresh the snapshot with the final metadata
            toolbar.storage().storeFromContext(context);
        } else {
            finish();
        }
    }

    private void finish() {
        if (finished.compareAndSet(false, true)) {
            toolbar.processResponse(context);
        }
    }
}
