package io.debugtoolbar.core.encoding;

import io.debugtoolbar.core.error.DecodeException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import org.brotli.dec.BrotliInputStream;

/**
 * {@code br} content-coding (RFC 7932) on top of the optional {@code org.brotli:dec} decoder.
 * Decode-only: the library ships no encoder.
 *
 * <p>
 * Instances must only be created after {@link #isSupported()} returned {@code true}.
 */
public final class BrotliCodec implements Codec {

    public static final String TOKEN = "br";

    private static final String PROBE_CLASS = "org.brotli.dec.BrotliInputStream";

    /** True if the brotli decoder classes can be loaded. */
    public static boolean isSupported() {
        return OptionalLibraries.isLoadable(PROBE_CLASS);
    }

    @Override
    public String token() {
        return TOKEN;
    }

    @Override
    public byte[] decode(byte[] input, long maxOutputBytes) {
        try {
            return Streams.drain(
                    TOKEN, new BrotliInputStream(new ByteArrayInputStream(input)), maxOutputBytes, input.length * 6L);
        } catch (DecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new DecodeException(TOKEN, "invalid brotli data: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean canEncode() {
        return false;
    }

    @Override
    public byte[] encode(byte[] input) {
        throw new UnsupportedOperationException("brotli encoding is not available");
    }
}
