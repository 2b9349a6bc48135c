package io.debugtoolbar.core.model;

import java.util.Locale;

/**
 * Media type families the toolbar distinguishes when deciding whether a response can carry the
 * overlay. Only {@link #HTML} responses are ever rewritten; the others are measured and streamed.
 */
public enum MediaType {
    /** {@code text/html}. */
    HTML("text/html"),

    /** {@code application/xhtml+xml}. */
    XHTML("application/xhtml+xml"),

    /** {@code application/json} and structured suffixes ({@code +json}). */
    JSON("application/json"),

    /** {@code application/xml} and structured suffixes ({@code +xml}). */
    XML("application/xml"),

    /** Any other {@code text/*} type (css, javascript, plain, csv). */
    TEXT("text/plain"),

    /**
     * {@code application/octet-stream}, also used as fallback for unrecognized
     * types.
     */
    BINARY("application/octet-stream"),

    /** No content type (body absent or not specified). */
    NONE(null);

    private final String value;

    MediaType(String value) {
        this.value = value;
    }

    /** Returns the MIME type string, or {@code null} for {@link #NONE}. */
    public String value() {
        return value;
    }

    /** True for the types the injection step accepts. */
    public boolean isHtml() {
        return this == HTML || this == XHTML;
    }

    /**
     * Resolves a Content-Type header value to a {@link MediaType}.
     *
     * <ul>
     * <li>Parameters ({@code charset}, {@code boundary}) are ignored.
     * <li>{@code +json} and {@code +xml} suffixes map to {@link #JSON} and {@link #XML}, except
     * {@code application/xhtml+xml} which is {@link #XHTML}.
     * <li>Unlisted {@code text/*} types map to {@link #TEXT}.
     * <li>{@code null} or blank input gives {@link #NONE}; anything else {@link #BINARY}.
     * </ul>
     *
     * @param contentType the Content-Type header value (e.g. {@code "text/html; charset=utf-8"})
     * @return the resolved {@code MediaType}
     */
    public static MediaType fromContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return NONE;
        }

        String mime = contentType;
        int semicolon = mime.indexOf(';');
        if (semicolon >= 0) {
            mime = mime.substring(0, semicolon);
        }
        mime = mime.strip().toLowerCase(Locale.ROOT);

        for (MediaType type : values()) {
            if (type.value != null && type.value.equals(mime)) {
                return type;
            }
        }

        if (mime.endsWith("+json")) {
            return JSON;
        }
        if (mime.endsWith("+xml")) {
            return XML;
        }
        if (mime.startsWith("text/")) {
            return TEXT;
        }
        return BINARY;
    }
}
