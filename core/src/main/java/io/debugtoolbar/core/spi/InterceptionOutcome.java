package io.debugtoolbar.core.spi;

import io.debugtoolbar.core.model.PassThroughReason;
import java.util.Objects;

/**
 * How a response left the pipeline, reported to {@link ResponseHook#onComplete}.
 *
 * @param type injected, passed through, or cancelled
 * @param reason why no injection happened; {@code null} for {@link Type#INJECTED}
 * @param status response status, or {@code 0} if no start was seen
 * @param bodyBytes bytes emitted downstream (0 for cancelled responses)
 */
public record InterceptionOutcome(Type type, PassThroughReason reason, int status, long bodyBytes) {

    /** The type of interception outcome. */
    public enum Type {
        INJECTED,
        PASSED_THROUGH,
        CANCELLED
    }

    public InterceptionOutcome {
        Objects.requireNonNull(type, "type must not be null");
        if (type == Type.INJECTED && reason != null) {
            throw new IllegalArgumentException("INJECTED outcome cannot carry a pass-through reason");
        }
        if (type != Type.INJECTED && reason == null) {
            throw new IllegalArgumentException(type + " outcome requires a reason");
        }
    }

    public static InterceptionOutcome injected(int status, long bodyBytes) {
        return new InterceptionOutcome(Type.INJECTED, null, status, bodyBytes);
    }

    public static InterceptionOutcome passedThrough(PassThroughReason reason, int status, long bodyBytes) {
        return new InterceptionOutcome(Type.PASSED_THROUGH, reason, status, bodyBytes);
    }

    public static InterceptionOutcome cancelled(int status) {
        return new InterceptionOutcome(Type.CANCELLED, PassThroughReason.CANCELLED, status, 0);
    }

    public boolean isInjected() {
        return type == Type.INJECTED;
    }
}
