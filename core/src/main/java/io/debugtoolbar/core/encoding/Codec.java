package io.debugtoolbar.core.encoding;

import io.debugtoolbar.core.error.DecodeException;

/**
 * Reversible transformation for one HTTP content-coding token.
 *
 * <p>
 * Implementations are stateless and thread-safe; one instance serves every response.
 */
public interface Codec {

    /** Canonical lowercase content-coding token, e.g. {@code "gzip"}. */
    String token();

    /**
     * Decodes a complete encoded body.
     *
     * @param input the encoded bytes
     * @param maxOutputBytes decoded size above which decoding is abandoned
     * @return the decoded bytes
     * @throws DecodeException if the input is malformed or expands beyond {@code maxOutputBytes}
     */
    byte[] decode(byte[] input, long maxOutputBytes);

    /** Decodes without an output bound. */
    default byte[] decode(byte[] input) {
        return decode(input, Long.MAX_VALUE);
    }

    /** Whether {@link #encode} is supported. Decode-only codecs return {@code false}. */
    default boolean canEncode() {
        return true;
    }

    /**
     * Encodes a body.
     *
     * @throws UnsupportedOperationException if {@link #canEncode()} is {@code false}
     */
    byte[] encode(byte[] input);
}
