package io.debugtoolbar.core.encoding;

import io.debugtoolbar.core.error.DecodeException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/** {@code gzip} content-coding (RFC 1952), concatenated members included. */
public final class GzipCodec implements Codec {

    public static final String TOKEN = "gzip";

    @Override
    public String token() {
        return TOKEN;
    }

    @Override
    public byte[] decode(byte[] input, long maxOutputBytes) {
        try {
            return Streams.drain(
                    TOKEN, new GZIPInputStream(new ByteArrayInputStream(input)), maxOutputBytes, input.length * 4L);
        } catch (DecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new DecodeException(TOKEN, "invalid gzip data: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] encode(byte[] input) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(input);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }
}
