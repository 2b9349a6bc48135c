package io.debugtoolbar.core.encoding;

import io.debugtoolbar.core.error.DecodeException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.DataFormatException;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.Inflater;

/**
 * {@code deflate} content-coding. HTTP defines it as zlib-wrapped (RFC 1950) but some servers send
 * raw deflate (RFC 1951), so decoding tries the wrapped form first and falls back to raw.
 */
public final class DeflateCodec implements Codec {

    public static final String TOKEN = "deflate";

    private static final int BUFFER_SIZE = 8192;

    @Override
    public String token() {
        return TOKEN;
    }

    @Override
    public byte[] decode(byte[] input, long maxOutputBytes) {
        try {
            return inflate(input, false, maxOutputBytes);
        } catch (DataFormatException wrapped) {
            try {
                return inflate(input, true, maxOutputBytes);
            } catch (DataFormatException raw) {
                DecodeException e = new DecodeException(TOKEN, "invalid deflate data: " + raw.getMessage(), raw);
                e.addSuppressed(wrapped);
                throw e;
            }
        }
    }

    private static byte[] inflate(byte[] input, boolean nowrap, long maxOutputBytes) throws DataFormatException {
        Inflater inflater = new Inflater(nowrap);
        try {
            inflater.setInput(input);
            ByteArrayOutputStream out =
                    new ByteArrayOutputStream(Streams.initialCapacity(input.length * 4L, maxOutputBytes));
            byte[] buffer = new byte[BUFFER_SIZE];
            long total = 0;
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && !inflater.finished()) {
                    // needsInput or needsDictionary: the stream ended early
                    throw new DataFormatException("truncated deflate stream");
                }
                total += n;
                if (total > maxOutputBytes) {
                    throw DecodeException.limitExceeded(TOKEN, maxOutputBytes);
                }
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } finally {
            inflater.end();
        }
    }

    @Override
    public byte[] encode(byte[] input) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length / 2));
        try (DeflaterOutputStream deflater = new DeflaterOutputStream(out)) {
            deflater.write(input);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }
}
