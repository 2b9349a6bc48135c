package io.debugtoolbar.core.encoding;

import io.debugtoolbar.core.model.PassThroughReason;
import java.util.Objects;

/**
 * Result of reversing an encoding stack. Exactly one of three states:
 *
 * <ul>
 * <li>{@link Type#DECODED}: every coding was removed and the result is UTF-8 text; {@code body}
 * holds the plaintext.
 * <li>{@link Type#PASS_THROUGH}: decoding was not attempted or not possible; {@code body} holds
 * the original bytes and the response must not be rewritten.
 * <li>{@link Type#FAILED}: internal state used while deciding the fallback. {@link #resolve()}
 * turns it into {@link Type#PASS_THROUGH} so it never reaches the transport.
 * </ul>
 */
public final class DecodeOutcome {

    /** The type of decode outcome. */
    public enum Type {
        DECODED,
        PASS_THROUGH,
        FAILED
    }

    private final Type type;
    private final byte[] body;
    private final boolean encodingRemoved;
    private final PassThroughReason reason;
    private final String detail;

    private DecodeOutcome(Type type, byte[] body, boolean encodingRemoved, PassThroughReason reason, String detail) {
        this.type = type;
        this.body = body;
        this.encodingRemoved = encodingRemoved;
        this.reason = reason;
        this.detail = detail;
    }

    /**
     * Creates a DECODED outcome.
     *
     * @param plaintext the fully decoded body
     * @param encodingRemoved whether at least one coding was reversed
     */
    public static DecodeOutcome decoded(byte[] plaintext, boolean encodingRemoved) {
        Objects.requireNonNull(plaintext, "plaintext must not be null for DECODED");
        return new DecodeOutcome(Type.DECODED, plaintext, encodingRemoved, null, null);
    }

    /** Creates a PASS_THROUGH outcome carrying the original bytes. */
    public static DecodeOutcome passThrough(byte[] original, PassThroughReason reason) {
        Objects.requireNonNull(original, "original must not be null for PASS_THROUGH");
        Objects.requireNonNull(reason, "reason must not be null for PASS_THROUGH");
        return new DecodeOutcome(Type.PASS_THROUGH, original, false, reason, null);
    }

    /** Creates a FAILED outcome; {@code original} is what {@link #resolve()} passes through. */
    public static DecodeOutcome failed(byte[] original, PassThroughReason reason, String detail) {
        Objects.requireNonNull(original, "original must not be null for FAILED");
        Objects.requireNonNull(reason, "reason must not be null for FAILED");
        return new DecodeOutcome(Type.FAILED, original, false, reason, detail);
    }

    /** Converts FAILED into PASS_THROUGH with the same bytes and reason; other states unchanged. */
    public DecodeOutcome resolve() {
        return type == Type.FAILED ? passThrough(body, reason) : this;
    }

    public Type type() {
        return type;
    }

    /** Plaintext when DECODED, original bytes otherwise. */
    public byte[] body() {
        return body;
    }

    /** True only for DECODED outcomes that reversed at least one coding. */
    public boolean encodingRemoved() {
        return encodingRemoved;
    }

    /** Why decoding did not produce plaintext, or {@code null} when DECODED. */
    public PassThroughReason reason() {
        return reason;
    }

    /** Failure detail for logs, or {@code null}. */
    public String detail() {
        return detail;
    }

    public boolean isDecoded() {
        return type == Type.DECODED;
    }

    public boolean isPassThrough() {
        return type == Type.PASS_THROUGH;
    }

    public boolean isFailed() {
        return type == Type.FAILED;
    }

    @Override
    public String toString() {
        return switch (type) {
            case DECODED -> "DecodeOutcome[DECODED, " + body.length + " bytes, encodingRemoved=" + encodingRemoved + "]";
            case PASS_THROUGH -> "DecodeOutcome[PASS_THROUGH, reason=" + reason + "]";
            case FAILED -> "DecodeOutcome[FAILED, reason=" + reason + ", detail=" + detail + "]";
        };
    }
}
