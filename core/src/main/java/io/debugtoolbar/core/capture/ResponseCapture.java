package io.debugtoolbar.core.capture;

import io.debugtoolbar.core.error.ProtocolViolationException;
import io.debugtoolbar.core.model.HttpHeaders;
import io.debugtoolbar.core.model.ResponseBody;
import io.debugtoolbar.core.model.ResponseStart;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State of one in-flight response while it is being buffered.
 *
 * <pre>
 * IDLE ──start──▶ HEADERS_RECEIVED ──chunk──▶ BUFFERING ──final chunk──▶ COMPLETE
 *                         └──────────────final chunk──────────────────────────┘
 * </pre>
 *
 * <p>
 * Status and headers are captured once. A second start, a chunk before the start, or a chunk
 * after the final one throw {@link ProtocolViolationException}; the captured data stays intact so
 * the caller can still pass it through. Chunks are kept as received and never mutated.
 *
 * <p>
 * Not thread-safe: owned by the single task handling the response.
 */
public final class ResponseCapture {

    /** Capture lifecycle. */
    public enum State {
        IDLE,
        HEADERS_RECEIVED,
        BUFFERING,
        COMPLETE,
        RELEASED
    }

    private State state = State.IDLE;
    private int status;
    private HttpHeaders headers = HttpHeaders.empty();
    private List<byte[]> chunks = new ArrayList<>();
    private long size;

    /**
     * Records the response start.
     *
     * @throws ProtocolViolationException if a start was already captured
     */
    public void start(ResponseStart start) {
        if (state != State.IDLE) {
            throw new ProtocolViolationException("response start received in state " + state);
        }
        this.status = start.status();
        this.headers = start.headers();
        this.state = State.HEADERS_RECEIVED;
    }

    /**
     * Appends a body chunk; the final chunk moves the capture to {@link State#COMPLETE}.
     *
     * @throws ProtocolViolationException if no start was captured or the body is already complete
     */
    public void append(ResponseBody chunk) {
        switch (state) {
            case IDLE -> throw new ProtocolViolationException("body chunk received before response start");
            case COMPLETE -> throw new ProtocolViolationException("body chunk received after the final chunk");
            case RELEASED -> throw new IllegalStateException("capture already released");
            default -> {
                // HEADERS_RECEIVED or BUFFERING
            }
        }
        if (chunk.size() > 0) {
            chunks.add(chunk.body());
            size += chunk.size();
        }
        state = chunk.moreBody() ? State.BUFFERING : State.COMPLETE;
    }

    /** Concatenation of every captured chunk. */
    public byte[] body() {
        if (chunks.size() == 1) {
            return chunks.get(0);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(size, Integer.MAX_VALUE));
        for (byte[] chunk : chunks) {
            out.write(chunk, 0, chunk.length);
        }
        return out.toByteArray();
    }

    /** Captured chunks in arrival order. */
    public List<byte[]> chunks() {
        return Collections.unmodifiableList(chunks);
    }

    /**
     * Drops every buffered chunk. Status and headers stay readable; further appends are rejected.
     */
    public void release() {
        chunks = new ArrayList<>(0);
        size = 0;
        state = State.RELEASED;
    }

    /** The captured start, or {@code null} before one was received. */
    public ResponseStart startEvent() {
        return hasStarted() ? new ResponseStart(status, headers) : null;
    }

    public State state() {
        return state;
    }

    public boolean hasStarted() {
        return status != 0;
    }

    public boolean isComplete() {
        return state == State.COMPLETE;
    }

    public int status() {
        return status;
    }

    public HttpHeaders headers() {
        return headers;
    }

    /** Bytes buffered so far. */
    public long size() {
        return size;
    }
}
