package io.debugtoolbar.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered HTTP header list as declared by the wrapped application.
 *
 * <p>
 * Unlike a map, the list keeps duplicates and their relative order, so a response that is passed
 * through unmodified is re-emitted with exactly the header sequence it was captured with. Name
 * lookups are case-insensitive; names and values are stored verbatim.
 *
 * <p>
 * The class is immutable. {@link #with}, {@link #without} and {@link #replace} return new
 * instances.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(List.of());

    /** A single header line. */
    public record Header(String name, String value) {

        public Header {
            Objects.requireNonNull(name, "header name must not be null");
            Objects.requireNonNull(value, "header value must not be null");
        }

        /** True if this header has the given name, ignoring case. */
        public boolean is(String other) {
            return name.equalsIgnoreCase(other);
        }
    }

    private final List<Header> entries;

    private HttpHeaders(List<Header> entries) {
        this.entries = entries;
    }

    /**
     * First value for a header name (case-insensitive).
     *
     * @return the first value, or {@code null} if the header is absent
     */
    public String first(String name) {
        for (Header header : entries) {
            if (header.is(name)) {
                return header.value();
            }
        }
        return null;
    }

    /**
     * All values for a header name (case-insensitive), in declaration order.
     *
     * @return an unmodifiable list of values, or an empty list if absent
     */
    public List<String> all(String name) {
        List<String> values = new ArrayList<>();
        for (Header header : entries) {
            if (header.is(name)) {
                values.add(header.value());
            }
        }
        return Collections.unmodifiableList(values);
    }

    /** True if the header exists (case-insensitive). */
    public boolean contains(String name) {
        return first(name) != null;
    }

    /** Returns {@code true} if no headers are present. */
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Number of header lines, counting duplicates. */
    public int size() {
        return entries.size();
    }

    /** Header lines in declaration order. */
    public List<Header> entries() {
        return entries;
    }

    /** Distinct header names in first-seen order, with the casing of their first occurrence. */
    public Set<String> names() {
        Map<String, String> seen = new LinkedHashMap<>();
        for (Header header : entries) {
            seen.putIfAbsent(header.name().toLowerCase(Locale.ROOT), header.name());
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(seen.values()));
    }

    /**
     * First-value-per-name view with lowercase keys, for diagnostics.
     *
     * @return an unmodifiable map in first-seen order
     */
    public Map<String, String> toSingleValueMap() {
        Map<String, String> result = new LinkedHashMap<>();
        for (Header header : entries) {
            result.putIfAbsent(header.name().toLowerCase(Locale.ROOT), header.value());
        }
        return Collections.unmodifiableMap(result);
    }

    // ── Copy-on-write edits ──

    /** Returns a copy with one more header appended at the end. */
    public HttpHeaders with(String name, String value) {
        List<Header> copy = new ArrayList<>(entries);
        copy.add(new Header(name, value));
        return new HttpHeaders(Collections.unmodifiableList(copy));
    }

    /** Returns a copy with every header of the given name removed; other lines keep their order. */
    public HttpHeaders without(String name) {
        List<Header> copy = new ArrayList<>(entries.size());
        for (Header header : entries) {
            if (!header.is(name)) {
                copy.add(header);
            }
        }
        return copy.size() == entries.size() ? this : new HttpHeaders(Collections.unmodifiableList(copy));
    }

    /** Removes every header of the given name, then appends a single fresh one. */
    public HttpHeaders replace(String name, String value) {
        return without(name).with(name, value);
    }

    // ── Factory methods ──

    /**
     * Creates headers from an ordered list of lines.
     *
     * @param headers header lines, duplicates allowed
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders of(List<Header> headers) {
        if (headers == null || headers.isEmpty()) {
            return EMPTY;
        }
        return new HttpHeaders(List.copyOf(headers));
    }

    /**
     * Creates headers from alternating name/value arguments.
     *
     * @param namesAndValues {@code name1, value1, name2, value2, ...}
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("names and values must come in pairs");
        }
        List<Header> list = new ArrayList<>(namesAndValues.length / 2);
        for (int i = 0; i < namesAndValues.length; i += 2) {
            list.add(new Header(namesAndValues[i], namesAndValues[i + 1]));
        }
        return of(list);
    }

    /** Returns an empty headers instance. */
    public static HttpHeaders empty() {
        return EMPTY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpHeaders that)) return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "HttpHeaders" + names();
    }
}
