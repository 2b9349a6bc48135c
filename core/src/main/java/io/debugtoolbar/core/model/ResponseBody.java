package io.debugtoolbar.core.model;

import java.util.Arrays;

/**
 * A body chunk. {@code moreBody == false} marks the final chunk of the response.
 *
 * <p>
 * The record compares chunk content with {@link Arrays#equals(byte[], byte[])}; records use
 * reference equality for arrays by default.
 */
public record ResponseBody(byte[] body, boolean moreBody) implements ResponseEvent {

    private static final byte[] NO_BYTES = new byte[0];

    /** Normalizes null content to an empty array. */
    public ResponseBody {
        if (body == null) {
            body = NO_BYTES;
        }
    }

    /** A non-final chunk. */
    public static ResponseBody chunk(byte[] body) {
        return new ResponseBody(body, true);
    }

    /** The final chunk. */
    public static ResponseBody last(byte[] body) {
        return new ResponseBody(body, false);
    }

    /** An empty final chunk, closing a response whose bytes were already sent. */
    public static ResponseBody end() {
        return new ResponseBody(NO_BYTES, false);
    }

    public int size() {
        return body.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResponseBody that)) return false;
        return moreBody == that.moreBody && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(body) + Boolean.hashCode(moreBody);
    }

    @Override
    public String toString() {
        return "ResponseBody[" + body.length + " bytes, moreBody=" + moreBody + "]";
    }
}
