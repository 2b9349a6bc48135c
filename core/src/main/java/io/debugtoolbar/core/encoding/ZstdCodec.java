package io.debugtoolbar.core.encoding;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdInputStream;
import io.debugtoolbar.core.error.DecodeException;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * {@code zstd} content-coding (RFC 8878) through the optional {@code zstd-jni} binding.
 *
 * <p>
 * Instances must only be created after {@link #isSupported()} returned {@code true}; the binding
 * needs its native library as well as its classes.
 */
public final class ZstdCodec implements Codec {

    public static final String TOKEN = "zstd";

    // Zstd's static initializer loads the native library
    private static final String PROBE_CLASS = "com.github.luben.zstd.Zstd";

    /** True if zstd-jni and its native library load on this platform. */
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
                    TOKEN, new ZstdInputStream(new ByteArrayInputStream(input)), maxOutputBytes, input.length * 4L);
        } catch (DecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new DecodeException(TOKEN, "invalid zstd data: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] encode(byte[] input) {
        return Zstd.compress(input);
    }
}
