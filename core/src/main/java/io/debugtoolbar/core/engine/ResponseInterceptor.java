package io.debugtoolbar.core.engine;

import io.debugtoolbar.core.capture.ResponseCapture;
import io.debugtoolbar.core.encoding.DecodeOutcome;
import io.debugtoolbar.core.encoding.DecompressionCascade;
import io.debugtoolbar.core.encoding.EncodingStack;
import io.debugtoolbar.core.error.ProtocolViolationException;
import io.debugtoolbar.core.model.HttpHeaders;
import io.debugtoolbar.core.model.InjectionResult;
import io.debugtoolbar.core.model.PassThroughReason;
import io.debugtoolbar.core.model.RequestInfo;
import io.debugtoolbar.core.model.ResponseBody;
import io.debugtoolbar.core.model.ResponseEvent;
import io.debugtoolbar.core.model.ResponseStart;
import io.debugtoolbar.core.spi.InterceptionOutcome;
import io.debugtoolbar.core.spi.ResponseHook;
import io.debugtoolbar.core.spi.ResponseSink;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Intercepts the response events of one request and forwards them downstream.
 *
 * <p>
 * Eligible responses (see {@link EligibilityGate}) are buffered until the final chunk, decoded,
 * given the toolbar fragment and re-emitted as one start followed by one final body. Everything
 * else is forwarded event by event as it arrives.
 *
 * <p>
 * Failure handling:
 * <ul>
 * <li>Decode failures, protocol violations, oversized bodies and hook failures all degrade to
 * passing the captured bytes through unmodified. Nothing of that kind escapes {@link #send}.
 * <li>An {@link IOException} from the downstream sink means the transport is gone: buffers are
 * released, the exception propagates and nothing more is written.
 * <li>{@link #cancel()} releases buffers and suppresses every later write.
 * <li>{@link #abandon()} flushes whatever was captured when the application fails mid-response.
 * </ul>
 *
 * <p>
 * One instance per response. Methods are synchronized because cancellation may be signalled from a
 * container thread other than the one producing events.
 */
public final class ResponseInterceptor implements ResponseSink {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseInterceptor.class);

    /** Interceptor lifecycle. */
    public enum Mode {
        AWAITING_START,
        BUFFERING,
        STREAMING,
        DONE,
        CANCELLED
    }

    private final InterceptionSettings settings;
    private final EligibilityGate gate;
    private final DecompressionCascade cascade;
    private final ToolbarInjector injector;
    private final HeaderRewriter rewriter;
    private final RequestInfo request;
    private final ResponseHook hook;
    private final ResponseSink downstream;

    private final ResponseCapture capture = new ResponseCapture();
    private Mode mode = Mode.AWAITING_START;
    private PassThroughReason streamingReason;
    private boolean startEmitted;
    private int status;
    private long emittedBytes;
    private boolean completed;

    ResponseInterceptor(
            InterceptionSettings settings,
            EligibilityGate gate,
            DecompressionCascade cascade,
            ToolbarInjector injector,
            HeaderRewriter rewriter,
            RequestInfo request,
            ResponseHook hook,
            ResponseSink downstream) {
        this.settings = settings;
        this.gate = gate;
        this.cascade = cascade;
        this.injector = injector;
        this.rewriter = rewriter;
        this.request = request;
        this.hook = hook;
        this.downstream = downstream;
    }

    @Override
    public synchronized void send(ResponseEvent event) throws IOException {
        switch (mode) {
            case AWAITING_START -> onFirstEvent(event);
            case BUFFERING -> buffer(event);
            case STREAMING -> forward(event);
            case DONE -> LOG.warn(
                    "Rejected {} after the response to {} {} completed", event, request.method(), request.path());
            case CANCELLED -> LOG.trace("Dropped {} for cancelled response", event);
        }
    }

    /**
     * The request was cancelled or the client went away. Buffers are released and nothing is
     * written downstream afterwards.
     */
    public synchronized void cancel() {
        if (mode == Mode.DONE || mode == Mode.CANCELLED) {
            return;
        }
        LOG.debug("Response to {} {} cancelled in mode {}", request.method(), request.path(), mode);
        mode = Mode.CANCELLED;
        capture.release();
        complete(InterceptionOutcome.cancelled(status));
    }

    /**
     * The application failed after (possibly) starting its response. A buffered response is
     * emitted exactly as captured; a streaming one is left as it is.
     *
     * @throws IOException if the downstream sink fails while flushing
     */
    public synchronized void abandon() throws IOException {
        switch (mode) {
            case BUFFERING -> {
                LOG.debug(
                        "Application failed mid-response on {} {}, flushing captured bytes",
                        request.method(),
                        request.path());
                ResponseStart start = capture.startEvent();
                byte[] bytes = capture.body();
                capture.release();
                emit(start, bytes, PassThroughReason.APPLICATION_ERROR);
            }
            case AWAITING_START, STREAMING -> {
                mode = Mode.DONE;
                complete(InterceptionOutcome.passedThrough(
                        PassThroughReason.APPLICATION_ERROR, status, emittedBytes));
            }
            default -> LOG.trace("abandon() ignored in mode {}", mode);
        }
    }

    /**
     * Stops buffering for good: captured data is flushed and later events are forwarded as they
     * come. Used when the host switches the response to a mode that cannot be held back.
     *
     * @throws IOException if the downstream sink fails while flushing
     */
    public synchronized void detach() throws IOException {
        switch (mode) {
            case AWAITING_START -> startStreaming(PassThroughReason.DETACHED);
            case BUFFERING -> flushCaptured(PassThroughReason.DETACHED);
            default -> LOG.trace("detach() ignored in mode {}", mode);
        }
    }

    public synchronized Mode mode() {
        return mode;
    }

    /** True while the response is being held back for rewriting. */
    public synchronized boolean isBuffering() {
        return mode == Mode.BUFFERING;
    }

    // ── Event handling ──

    private void onFirstEvent(ResponseEvent event) throws IOException {
        if (!(event instanceof ResponseStart start)) {
            LOG.warn("Body chunk before response start on {} {}, passing through", request.method(), request.path());
            startStreaming(PassThroughReason.PROTOCOL_VIOLATION);
            forward(event);
            return;
        }
        status = start.status();
        notifyStarted(start);
        Optional<PassThroughReason> ineligible = gate.evaluate(request, start);
        if (ineligible.isPresent()) {
            LOG.trace("Streaming {} {}: {}", request.method(), request.path(), ineligible.get());
            startStreaming(ineligible.get());
            forward(start);
            return;
        }
        capture.start(start);
        mode = Mode.BUFFERING;
    }

    private void buffer(ResponseEvent event) throws IOException {
        try {
            if (event instanceof ResponseStart start) {
                capture.start(start);
            } else if (event instanceof ResponseBody chunk) {
                capture.append(chunk);
            }
        } catch (ProtocolViolationException e) {
            LOG.warn(
                    "Protocol violation on {} {}: {}; passing captured response through",
                    request.method(),
                    request.path(),
                    e.getMessage());
            flushCaptured(PassThroughReason.PROTOCOL_VIOLATION);
            return;
        }

        if (capture.size() > settings.maxBodyBytes()) {
            LOG.debug(
                    "Body of {} {} exceeds {} bytes, streaming the rest",
                    request.method(),
                    request.path(),
                    settings.maxBodyBytes());
            flushCaptured(PassThroughReason.BODY_TOO_LARGE);
            return;
        }
        if (capture.isComplete()) {
            rewrite();
        }
    }

    /** Emits the captured start and bytes as they are and switches to streaming. */
    private void flushCaptured(PassThroughReason reason) throws IOException {
        ResponseStart start = capture.startEvent();
        byte[] bytes = capture.body();
        boolean complete = capture.isComplete();
        capture.release();
        startStreaming(reason);
        if (start != null) {
            forward(start);
        }
        if (bytes.length > 0 || complete) {
            forward(new ResponseBody(bytes, !complete));
        }
    }

    private void startStreaming(PassThroughReason reason) {
        mode = Mode.STREAMING;
        streamingReason = reason;
    }

    private void forward(ResponseEvent event) throws IOException {
        if (event instanceof ResponseStart start) {
            if (startEmitted) {
                LOG.warn("Dropped duplicate response start on {} {}", request.method(), request.path());
                return;
            }
            if (status == 0) {
                status = start.status();
                notifyStarted(start);
            }
            startEmitted = true;
            write(start);
        } else if (event instanceof ResponseBody chunk) {
            write(chunk);
            emittedBytes += chunk.size();
            if (!chunk.moreBody()) {
                mode = Mode.DONE;
                complete(InterceptionOutcome.passedThrough(streamingReason, status, emittedBytes));
            }
        }
    }

    // ── Rewrite ──

    private void rewrite() throws IOException {
        ResponseStart start = capture.startEvent();
        byte[] original = capture.body();
        capture.release();

        PassThroughReason fallback = null;
        ResponseStart rewrittenStart = null;
        InjectionResult result = null;
        try {
            DecodeOutcome decoded = cascade.decode(EncodingStack.from(start.headers()), original);
            if (decoded.isDecoded()) {
                String text = new String(decoded.body(), StandardCharsets.UTF_8);
                String fragment = hook.renderFragment(text, start.headers());
                result = injector.inject(text, fragment == null ? "" : fragment, decoded.encodingRemoved());
                HttpHeaders extra = hook.extraHeaders();
                HttpHeaders headers =
                        rewriter.rewrite(start.headers(), result, extra == null ? HttpHeaders.empty() : extra);
                rewrittenStart = new ResponseStart(start.status(), headers);
            } else {
                fallback = decoded.reason();
            }
        } catch (RuntimeException e) {
            LOG.warn(
                    "Toolbar injection failed for {} {}, passing response through", request.method(), request.path(), e);
            fallback = PassThroughReason.INJECTION_FAILED;
        }
        if (fallback != null) {
            emit(start, original, fallback);
            return;
        }

        startEmitted = true;
        mode = Mode.DONE;
        try {
            downstream.send(rewrittenStart);
            downstream.send(ResponseBody.last(result.body()));
        } catch (IOException e) {
            transportFailed();
            throw e;
        }
        emittedBytes = result.contentLength();
        complete(InterceptionOutcome.injected(status, emittedBytes));
    }

    /** Emits one start and one final body, unmodified. */
    private void emit(ResponseStart start, byte[] body, PassThroughReason reason) throws IOException {
        startEmitted = true;
        mode = Mode.DONE;
        try {
            downstream.send(start);
            downstream.send(ResponseBody.last(body));
        } catch (IOException e) {
            transportFailed();
            throw e;
        }
        emittedBytes = body.length;
        complete(InterceptionOutcome.passedThrough(reason, status, emittedBytes));
    }

    private void write(ResponseEvent event) throws IOException {
        try {
            downstream.send(event);
        } catch (IOException e) {
            transportFailed();
            throw e;
        }
    }

    private void transportFailed() {
        LOG.debug("Transport failed while writing {} {}", request.method(), request.path());
        mode = Mode.CANCELLED;
        capture.release();
        complete(InterceptionOutcome.cancelled(status));
    }

    // ── Hook notifications ──

    private void notifyStarted(ResponseStart start) {
        try {
            hook.responseStarted(start.status(), start.headers());
        } catch (RuntimeException e) {
            LOG.warn("Response hook failed on start of {} {}", request.method(), request.path(), e);
        }
    }

    private void complete(InterceptionOutcome outcome) {
        if (completed) {
            return;
        }
        completed = true;
        try {
            hook.onComplete(outcome);
        } catch (RuntimeException e) {
            LOG.warn("Response hook failed on completion of {} {}", request.method(), request.path(), e);
        }
    }
}
