package io.debugtoolbar.core.encoding;

import io.debugtoolbar.core.error.DecodeException;
import io.debugtoolbar.core.model.PassThroughReason;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes an {@link EncodingStack} from a captured body.
 *
 * <p>
 * All-or-nothing: every token is resolved against the {@link CodecRegistry} before any bytes are
 * touched, and any unknown token, unavailable codec or decode failure abandons the whole cascade.
 * The caller then gets the original bytes back, never a partially decoded buffer. A fully decoded
 * body must also be valid UTF-8, otherwise it is treated as binary and the original bytes are
 * returned as well.
 */
public final class DecompressionCascade {

    private static final Logger LOG = LoggerFactory.getLogger(DecompressionCascade.class);

    private final CodecRegistry registry;
    private final long maxDecodedBytes;

    /**
     * @param registry codec lookup
     * @param maxDecodedBytes decoded size above which the cascade gives up
     */
    public DecompressionCascade(CodecRegistry registry, long maxDecodedBytes) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        if (maxDecodedBytes <= 0) {
            throw new IllegalArgumentException("maxDecodedBytes must be positive, got " + maxDecodedBytes);
        }
        this.maxDecodedBytes = maxDecodedBytes;
    }

    /**
     * Decodes {@code original} and resolves the result: the outcome is DECODED or PASS_THROUGH,
     * never FAILED.
     *
     * @param stack codings declared by the response
     * @param original concatenated captured body
     * @return the resolved outcome
     */
    public DecodeOutcome decode(EncodingStack stack, byte[] original) {
        return reverse(stack, original).resolve();
    }

    /** Unresolved variant; FAILED outcomes are returned as such. */
    DecodeOutcome reverse(EncodingStack stack, byte[] original) {
        Objects.requireNonNull(stack, "stack must not be null");
        Objects.requireNonNull(original, "original must not be null");

        List<Codec> chain = new ArrayList<>(stack.size());
        for (String token : stack.decodeOrder()) {
            CodecRegistry.Lookup lookup = registry.lookup(token);
            switch (lookup.availability()) {
                case AVAILABLE -> chain.add(lookup.codec());
                case UNAVAILABLE -> {
                    LOG.debug("Codec '{}' unavailable, passing response through unchanged", token);
                    return DecodeOutcome.failed(original, PassThroughReason.CODEC_UNAVAILABLE, token);
                }
                case UNKNOWN -> {
                    LOG.debug("Unknown content-coding '{}' in {}, passing response through", token, stack);
                    return DecodeOutcome.failed(original, PassThroughReason.UNKNOWN_ENCODING, token);
                }
            }
        }

        byte[] current = original;
        for (Codec codec : chain) {
            try {
                current = codec.decode(current, maxDecodedBytes);
            } catch (DecodeException e) {
                PassThroughReason reason =
                        e.isLimitExceeded() ? PassThroughReason.BODY_TOO_LARGE : PassThroughReason.MALFORMED_ENCODING;
                LOG.debug("Decoding '{}' failed ({}), passing response through", codec.token(), e.getMessage());
                return DecodeOutcome.failed(original, reason, e.getMessage());
            }
        }

        if (!isUtf8(current)) {
            LOG.debug("Body is not valid UTF-8 after removing {}, passing response through", stack);
            return DecodeOutcome.failed(original, PassThroughReason.NOT_UTF8, "invalid UTF-8");
        }
        return DecodeOutcome.decoded(current, !chain.isEmpty());
    }

    /** Strict UTF-8 check: malformed and unmappable input are both rejected. */
    static boolean isUtf8(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            decoder.decode(ByteBuffer.wrap(bytes));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }
}
