package io.debugtoolbar.core.encoding;

import io.debugtoolbar.core.error.DecodeException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/** Bounded stream draining shared by the stream-based codecs. */
final class Streams {

    private static final int BUFFER_SIZE = 8192;

    private Streams() {
        // utility class
    }

    /**
     * Reads {@code in} to the end, failing once more than {@code limit} bytes have been produced.
     * The stream is closed on every path.
     */
    static byte[] drain(String token, InputStream in, long limit, long sizeHint) throws IOException {
        try (in) {
            ByteArrayOutputStream out = new ByteArrayOutputStream(initialCapacity(sizeHint, limit));
            byte[] buffer = new byte[BUFFER_SIZE];
            long total = 0;
            int n;
            while ((n = in.read(buffer)) != -1) {
                total += n;
                if (total > limit) {
                    throw DecodeException.limitExceeded(token, limit);
                }
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        }
    }

    /** Output buffer size for an expected decoded size, never above what {@code limit} allows. */
    static int initialCapacity(long sizeHint, long limit) {
        long capped = Math.min(sizeHint, Math.min(limit, Integer.MAX_VALUE - 8L));
        return (int) Math.max(BUFFER_SIZE, capped);
    }
}
