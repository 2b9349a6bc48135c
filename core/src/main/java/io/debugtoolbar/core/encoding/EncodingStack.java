package io.debugtoolbar.core.encoding;

import io.debugtoolbar.core.model.HttpHeaders;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Content-codings applied to a body, in the order the origin applied them.
 *
 * <p>
 * {@code Content-Encoding: gzip, br} means gzip was applied first and brotli last, so decoding
 * runs right to left: {@link #decodeOrder()} yields {@code [br, gzip]}. {@code identity} tokens are
 * no-ops and are dropped during parsing.
 */
public final class EncodingStack {

    private static final EncodingStack EMPTY = new EncodingStack(List.of());
    private static final String IDENTITY = "identity";

    private final List<String> tokens;

    private EncodingStack(List<String> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a Content-Encoding header value. Absent or blank values give an empty stack; tokens
     * are trimmed and lowercased, empty tokens from doubled commas are skipped.
     *
     * @param headerValue raw header value, may be {@code null}
     * @return the parsed stack
     */
    public static EncodingStack parse(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return EMPTY;
        }
        List<String> parsed = new ArrayList<>();
        for (String raw : headerValue.split(",")) {
            String token = raw.strip().toLowerCase(Locale.ROOT);
            if (token.isEmpty() || IDENTITY.equals(token)) {
                continue;
            }
            parsed.add(token);
        }
        return parsed.isEmpty() ? EMPTY : new EncodingStack(Collections.unmodifiableList(parsed));
    }

    /**
     * Parses every Content-Encoding line of a header list. Repeated lines form one list, in
     * declaration order.
     */
    public static EncodingStack from(HttpHeaders headers) {
        List<String> lines = headers.all("Content-Encoding");
        if (lines.isEmpty()) {
            return EMPTY;
        }
        return parse(String.join(",", lines));
    }

    public static EncodingStack empty() {
        return EMPTY;
    }

    /** Tokens in declaration (application) order. */
    public List<String> tokens() {
        return tokens;
    }

    /** Tokens in the order they must be removed. */
    public List<String> decodeOrder() {
        List<String> reversed = new ArrayList<>(tokens);
        Collections.reverse(reversed);
        return Collections.unmodifiableList(reversed);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public int size() {
        return tokens.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncodingStack that)) return false;
        return tokens.equals(that.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return "EncodingStack" + tokens;
    }
}
