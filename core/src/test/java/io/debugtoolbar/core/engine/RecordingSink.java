package io.debugtoolbar.core.engine;

import io.debugtoolbar.core.model.ResponseBody;
import io.debugtoolbar.core.model.ResponseEvent;
import io.debugtoolbar.core.model.ResponseStart;
import io.debugtoolbar.core.spi.ResponseSink;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Downstream sink that records every event, optionally failing after a number of writes. */
final class RecordingSink implements ResponseSink {

    final List<ResponseEvent> events = new ArrayList<>();
    private int failAfter = Integer.MAX_VALUE;

    RecordingSink failAfter(int writes) {
        this.failAfter = writes;
        return this;
    }

    @Override
    public void send(ResponseEvent event) throws IOException {
        if (events.size() >= failAfter) {
            throw new IOException("connection reset by peer");
        }
        events.add(event);
    }

    List<ResponseStart> starts() {
        return events.stream()
                .filter(ResponseStart.class::isInstance)
                .map(ResponseStart.class::cast)
                .toList();
    }

    ResponseStart start() {
        List<ResponseStart> starts = starts();
        if (starts.size() != 1) {
            throw new AssertionError("expected exactly one start, got " + starts);
        }
        return starts.get(0);
    }

    byte[] body() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (ResponseEvent event : events) {
            if (event instanceof ResponseBody chunk) {
                out.write(chunk.body(), 0, chunk.size());
            }
        }
        return out.toByteArray();
    }

    boolean finished() {
        return !events.isEmpty()
                && events.get(events.size() - 1) instanceof ResponseBody last
                && !last.moreBody();
    }
}
