package io.debugtoolbar.javalin;

import io.debugtoolbar.core.engine.ResponseInterceptor;
import io.debugtoolbar.core.model.ResponseBody;
import io.debugtoolbar.core.model.ResponseStart;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Response wrapper that turns the application's body writes into response events.
 *
 * <p>
 * Status and header setters go straight to the real response; only the body is diverted. Like a
 * container's own response buffer, the first bytes are held until the response commits: the buffer
 * fills, the application flushes, or {@link #finish()} runs. Only then are status and headers
 * snapshotted into a {@link ResponseStart}, so headers set after the first write (Javalin's own
 * {@code Content-Encoding} among them) are part of it. Later writes become body chunks and
 * {@link #finish()} sends the final empty chunk. While the interceptor buffers, the response must
 * look uncommitted, so flushing is a no-op until then.
 */
final class CapturingResponseWrapper extends HttpServletResponseWrapper {

    private static final int DEFAULT_COMMIT_SIZE = 8192;

    private final ResponseInterceptor interceptor;
    private final ServletResponseSink sink;
    private final CapturingOutputStream stream = new CapturingOutputStream();
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private PrintWriter writer;
    private boolean started;
    private boolean finished;
    private boolean bypassed;

    CapturingResponseWrapper(HttpServletResponse response, ResponseInterceptor interceptor, ServletResponseSink sink) {
        super(response);
        this.interceptor = interceptor;
        this.sink = sink;
    }

    @Override
    public ServletOutputStream getOutputStream() throws IOException {
        if (bypassed) {
            return super.getOutputStream();
        }
        if (writer != null) {
            throw new IllegalStateException("getWriter() has already been called on this response");
        }
        return stream;
    }

    @Override
    public PrintWriter getWriter() throws IOException {
        if (bypassed) {
            return super.getWriter();
        }
        if (writer == null) {
            writer = new PrintWriter(new OutputStreamWriter(stream, charset()));
        }
        return writer;
    }

    private Charset charset() {
        String encoding = getCharacterEncoding();
        try {
            return encoding == null ? StandardCharsets.ISO_8859_1 : Charset.forName(encoding);
        } catch (IllegalArgumentException e) {
            return StandardCharsets.ISO_8859_1;
        }
    }

    @Override
    public void flushBuffer() throws IOException {
        if (writer != null) {
            writer.flush();
        }
        if (!bypassed && !finished) {
            ensureStarted();
        }
        if (bypassed || (started && !interceptor.isBuffering())) {
            super.flushBuffer();
        }
    }

    @Override
    public boolean isCommitted() {
        return started || super.isCommitted();
    }

    @Override
    public void reset() {
        if (started) {
            throw new IllegalStateException("response already started");
        }
        pending.reset();
        super.reset();
    }

    @Override
    public void resetBuffer() {
        if (started) {
            throw new IllegalStateException("response already started");
        }
        pending.reset();
        super.resetBuffer();
    }

    @Override
    public void sendError(int sc, String msg) throws IOException {
        bypass();
        super.sendError(sc, msg);
    }

    @Override
    public void sendError(int sc) throws IOException {
        bypass();
        super.sendError(sc);
    }

    @Override
    public void sendRedirect(String location) throws IOException {
        bypass();
        super.sendRedirect(location);
    }

    /** The container writes this response itself; the interceptor steps aside. */
    private void bypass() {
        if (!started) {
            bypassed = true;
            pending.reset();
            interceptor.cancel();
        }
    }

    /**
     * Sends the response start if the application never wrote, then the final chunk. Idempotent.
     *
     * @throws IOException if writing to the client fails
     */
    synchronized void finish() throws IOException {
        if (finished || bypassed) {
            return;
        }
        if (writer != null) {
            writer.flush();
        }
        ensureStarted();
        finished = true;
        interceptor.send(ResponseBody.end());
    }

    /**
     * Switches the response to streaming for good; anything already written goes out now.
     *
     * @throws IOException if writing to the client fails
     */
    synchronized void detach() throws IOException {
        interceptor.detach();
        if (!bypassed && !finished && pending.size() > 0) {
            ensureStarted();
        }
    }

    /** Commits: snapshots status and headers, then sends whatever the application wrote so far. */
    private synchronized void ensureStarted() throws IOException {
        if (started) {
            return;
        }
        started = true;
        interceptor.send(new ResponseStart(getStatus(), sink.snapshot()));
        if (pending.size() > 0) {
            byte[] held = pending.toByteArray();
            pending.reset();
            interceptor.send(ResponseBody.chunk(held));
        }
    }

    private synchronized void write(byte[] bytes) throws IOException {
        if (finished) {
            throw new IOException("response already finished");
        }
        if (started) {
            interceptor.send(ResponseBody.chunk(bytes));
            return;
        }
        pending.write(bytes, 0, bytes.length);
        // a detached response streams as it is written
        if (pending.size() >= commitSize() || interceptor.mode() != ResponseInterceptor.Mode.AWAITING_START) {
            ensureStarted();
        }
    }

    private int commitSize() {
        int size = getBufferSize();
        return size > 0 ? size : DEFAULT_COMMIT_SIZE;
    }

    private final class CapturingOutputStream extends ServletOutputStream {

        @Override
        public void write(int b) throws IOException {
            CapturingResponseWrapper.this.write(new byte[] {(byte) b});
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            if (len == 0) {
                return;
            }
            CapturingResponseWrapper.this.write(Arrays.copyOfRange(b, off, off + len));
        }

        @Override
        public void flush() throws IOException {
            if (finished) {
                return;
            }
            ensureStarted();
            if (!interceptor.isBuffering()) {
                getResponse().flushBuffer();
            }
        }

        @Override
        public void close() throws IOException {
            finish();
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setWriteListener(WriteListener writeListener) {
            throw new UnsupportedOperationException("non-blocking writes are not supported while capturing");
        }
    }
}
