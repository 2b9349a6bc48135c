package io.debugtoolbar.core.spi;

import io.debugtoolbar.core.model.HttpHeaders;

/**
 * Collaborator that turns a finished HTML response into the fragment to embed.
 *
 * <p>
 * The interceptor calls the hook on the request's own thread, in this order:
 * {@link #responseStarted} once, then, only for responses that are rewritten,
 * {@link #renderFragment} followed by {@link #extraHeaders}, and finally {@link #onComplete}
 * exactly once. Exceptions thrown from {@code renderFragment} or {@code extraHeaders} abort the
 * injection and the original response is passed through; exceptions from the notification methods
 * are logged and ignored.
 */
public interface ResponseHook {

    /** Hook that injects nothing and observes nothing. */
    ResponseHook NONE = (body, headers) -> "";

    /**
     * The wrapped application started its response.
     *
     * @param status response status
     * @param headers headers as declared by the application
     */
    default void responseStarted(int status, HttpHeaders headers) {}

    /**
     * Renders the fragment for a complete, decoded HTML body.
     *
     * @param body plaintext body
     * @param headers headers as declared by the application
     * @return HTML to splice before the marker; never {@code null}
     */
    String renderFragment(String body, HttpHeaders headers);

    /** Headers to append to a rewritten response, e.g. {@code Server-Timing}. */
    default HttpHeaders extraHeaders() {
        return HttpHeaders.empty();
    }

    /** The response has left the pipeline (or was cancelled). */
    default void onComplete(InterceptionOutcome outcome) {}
}
