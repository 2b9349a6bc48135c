package io.debugtoolbar.core.spi;

import io.debugtoolbar.core.model.ResponseEvent;
import java.io.IOException;

/**
 * Receiver of response events: the transport on the downstream side, the interceptor on the
 * upstream side.
 *
 * <p>
 * Byte arrays inside {@link io.debugtoolbar.core.model.ResponseBody} events are handed over:
 * receivers may keep them, senders must not reuse them.
 */
@FunctionalInterface
public interface ResponseSink {

    /**
     * Delivers one event.
     *
     * @throws IOException if the transport can no longer accept writes
     */
    void send(ResponseEvent event) throws IOException;
}
