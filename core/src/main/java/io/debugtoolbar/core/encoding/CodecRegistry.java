package io.debugtoolbar.core.encoding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps content-coding tokens to codecs and reports availability.
 *
 * <p>
 * A token is in one of three states:
 * <ul>
 * <li>{@link Availability#AVAILABLE}: a codec is registered and usable.
 * <li>{@link Availability#UNAVAILABLE}: the token is known but its library is missing (or an
 * operator disabled it). Responses using it pass through; this is not a protocol error.
 * <li>{@link Availability#UNKNOWN}: nothing is known about the token.
 * </ul>
 *
 * <p>
 * Built once at startup and never mutated afterwards, so lookups need no locking.
 */
public final class CodecRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(CodecRegistry.class);

    /** Availability of a content-coding token. */
    public enum Availability {
        AVAILABLE,
        UNAVAILABLE,
        UNKNOWN
    }

    /** Result of {@link #lookup(String)}; {@code codec} is non-null only when available. */
    public record Lookup(String token, Availability availability, Codec codec) {}

    private final Map<String, Codec> codecs;
    private final Set<String> unavailable;

    private CodecRegistry(Map<String, Codec> codecs, Set<String> unavailable) {
        this.codecs = Collections.unmodifiableMap(codecs);
        this.unavailable = Collections.unmodifiableSet(unavailable);
    }

    /**
     * Registry with {@code gzip} (alias {@code x-gzip}) and {@code deflate}, plus {@code br} and
     * {@code zstd} when their libraries load. The probe runs on every call; keep the result.
     */
    public static CodecRegistry standard() {
        return builder().withStandardCodecs().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a token, case-insensitively.
     *
     * @param token content-coding token as it appears in the header
     * @return the lookup result, never {@code null}
     */
    public Lookup lookup(String token) {
        String normalized = normalize(token);
        Codec codec = codecs.get(normalized);
        if (codec != null) {
            return new Lookup(normalized, Availability.AVAILABLE, codec);
        }
        if (unavailable.contains(normalized)) {
            return new Lookup(normalized, Availability.UNAVAILABLE, null);
        }
        return new Lookup(normalized, Availability.UNKNOWN, null);
    }

    /** Availability of a token. */
    public Availability availability(String token) {
        return lookup(token).availability();
    }

    /** The codec for a token, or empty unless available. */
    public Optional<Codec> codec(String token) {
        return Optional.ofNullable(codecs.get(normalize(token)));
    }

    /** Tokens that can be decoded right now. */
    public Set<String> availableTokens() {
        return codecs.keySet();
    }

    /** Tokens that are known but cannot be decoded. */
    public Set<String> unavailableTokens() {
        return unavailable;
    }

    private static String normalize(String token) {
        return token == null ? "" : token.strip().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "CodecRegistry[available=" + codecs.keySet() + ", unavailable=" + unavailable + "]";
    }

    /** Builder for {@link CodecRegistry}. */
    public static final class Builder {

        private final Map<String, Codec> codecs = new LinkedHashMap<>();
        private final Set<String> unavailable = new LinkedHashSet<>();
        private final Set<String> disabled = new LinkedHashSet<>();

        private Builder() {}

        /** Registers the mandatory codecs and probes the optional ones. */
        public Builder withStandardCodecs() {
            GzipCodec gzip = new GzipCodec();
            register(gzip);
            alias("x-gzip", gzip);
            register(new DeflateCodec());

            if (BrotliCodec.isSupported()) {
                register(new BrotliCodec());
            } else {
                markUnavailable(BrotliCodec.TOKEN);
            }
            if (ZstdCodec.isSupported()) {
                register(new ZstdCodec());
            } else {
                markUnavailable(ZstdCodec.TOKEN);
            }
            return this;
        }

        /**
         * Registers a codec under its own token, replacing any earlier registration.
         *
         * @throws IllegalArgumentException if the codec's token is blank
         */
        public Builder register(Codec codec) {
            Objects.requireNonNull(codec, "codec must not be null");
            return alias(codec.token(), codec);
        }

        /** Registers a codec under an additional token. */
        public Builder alias(String token, Codec codec) {
            Objects.requireNonNull(codec, "codec must not be null");
            String normalized = normalize(token);
            if (normalized.isEmpty()) {
                throw new IllegalArgumentException("codec token must not be null or empty");
            }
            codecs.put(normalized, codec);
            unavailable.remove(normalized);
            return this;
        }

        /** Declares a token as known but not decodable. */
        public Builder markUnavailable(String token) {
            String normalized = normalize(token);
            if (!codecs.containsKey(normalized)) {
                unavailable.add(normalized);
            }
            return this;
        }

        /**
         * Forces a token to {@link Availability#UNAVAILABLE} even if its codec was registered,
         * e.g. to switch off a codec that misbehaves on some platform.
         */
        public Builder disable(String token) {
            disabled.add(normalize(token));
            return this;
        }

        public CodecRegistry build() {
            Map<String, Codec> finalCodecs = new LinkedHashMap<>(codecs);
            Set<String> finalUnavailable = new LinkedHashSet<>(unavailable);
            for (String token : disabled) {
                finalCodecs.remove(token);
                finalUnavailable.add(token);
            }
            CodecRegistry registry = new CodecRegistry(finalCodecs, finalUnavailable);
            LOG.debug("Codec registry ready: {}", registry);
            return registry;
        }
    }
}
