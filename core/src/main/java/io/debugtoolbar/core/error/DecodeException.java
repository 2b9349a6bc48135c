package io.debugtoolbar.core.error;

/**
 * Thrown by a {@link io.debugtoolbar.core.encoding.Codec} when the input is not a valid stream in
 * its encoding (truncated gzip member, bad zlib header, corrupt brotli window). Always recovered by
 * the decompression cascade, which falls back to the original bytes.
 */
public final class DecodeException extends ToolbarException {

    private static final long serialVersionUID = 1L;

    private final String encoding;
    private final boolean limitExceeded;

    public DecodeException(String encoding, String message) {
        this(encoding, message, null, false);
    }

    public DecodeException(String encoding, String message, Throwable cause) {
        this(encoding, message, cause, false);
    }

    private DecodeException(String encoding, String message, Throwable cause, boolean limitExceeded) {
        super(message, cause, Stage.DECODE);
        this.encoding = encoding;
        this.limitExceeded = limitExceeded;
    }

    /** The decoded output grew past the allowed size; the input itself may be well-formed. */
    public static DecodeException limitExceeded(String encoding, long limit) {
        return new DecodeException(encoding, encoding + " output exceeds " + limit + " bytes", null, true);
    }

    /** The content-coding token whose codec rejected the input. */
    public String encoding() {
        return encoding;
    }

    /** True when decoding stopped at the output bound rather than on malformed input. */
    public boolean isLimitExceeded() {
        return limitExceeded;
    }
}
