package io.debugtoolbar.core.model;

/** Why a response left the pipeline without the toolbar injected. */
public enum PassThroughReason {
    /** Interception switched off in configuration. */
    DISABLED,
    /** Content-Type is not an HTML type. */
    NOT_HTML,
    /** Request path is under an excluded prefix or the toolbar's own routes. */
    EXCLUDED_PATH,
    /** HEAD request, or a status that carries no body (1xx, 204, 304). */
    NO_CONTENT,
    /** 3xx response while redirect interception is off. */
    REDIRECT,
    /** Declared or observed body size above the configured limit. */
    BODY_TOO_LARGE,
    /** Content-Encoding names a token no codec is registered for. */
    UNKNOWN_ENCODING,
    /** Content-Encoding names a known codec whose library is not present. */
    CODEC_UNAVAILABLE,
    /** Compressed data could not be decoded. */
    MALFORMED_ENCODING,
    /** Decoded body is not valid UTF-8 text. */
    NOT_UTF8,
    /** The application broke the start/body event contract. */
    PROTOCOL_VIOLATION,
    /** Rendering or splicing the fragment failed. */
    INJECTION_FAILED,
    /** The application failed after it had started responding. */
    APPLICATION_ERROR,
    /** The host switched the response to a mode the pipeline cannot buffer (async servlet). */
    DETACHED,
    /** Client disconnected or the request was cancelled; nothing was written. */
    CANCELLED
}
