package io.debugtoolbar.core.encoding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.debugtoolbar.core.model.PassThroughReason;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DecompressionCascadeTest {

    private static final String PAGE = "<html><body>Hello, wörld</body></html>";
    private static final byte[] PLAIN = PAGE.getBytes(StandardCharsets.UTF_8);

    private final GzipCodec gzip = new GzipCodec();
    private final DeflateCodec deflate = new DeflateCodec();
    private final DecompressionCascade cascade = new DecompressionCascade(CodecRegistry.standard(), 1024 * 1024);

    @Nested
    class Decoded {

        @Test
        void emptyStackReturnsBodyAsIs() {
            DecodeOutcome outcome = cascade.decode(EncodingStack.empty(), PLAIN);

            assertThat(outcome.isDecoded()).isTrue();
            assertThat(outcome.encodingRemoved()).isFalse();
            assertThat(outcome.body()).isEqualTo(PLAIN);
        }

        @Test
        void singleGzip() {
            DecodeOutcome outcome = cascade.decode(EncodingStack.parse("gzip"), gzip.encode(PLAIN));

            assertThat(outcome.isDecoded()).isTrue();
            assertThat(outcome.encodingRemoved()).isTrue();
            assertThat(new String(outcome.body(), StandardCharsets.UTF_8)).isEqualTo(PAGE);
        }

        @Test
        @DisplayName("'deflate, gzip' is removed gzip first, then deflate")
        void stackedCodingsInReverseOrder() {
            byte[] encoded = gzip.encode(deflate.encode(PLAIN));

            DecodeOutcome outcome = cascade.decode(EncodingStack.parse("deflate, gzip"), encoded);

            assertThat(outcome.isDecoded()).isTrue();
            assertThat(outcome.body()).isEqualTo(PLAIN);
        }
    }

    @Nested
    class PassThrough {

        @Test
        void unknownTokenKeepsOriginalBytes() {
            byte[] body = "opaque".getBytes(StandardCharsets.UTF_8);

            DecodeOutcome outcome = cascade.decode(EncodingStack.parse("compress"), body);

            assertThat(outcome.isPassThrough()).isTrue();
            assertThat(outcome.reason()).isEqualTo(PassThroughReason.UNKNOWN_ENCODING);
            assertThat(outcome.body()).isSameAs(body);
        }

        @Test
        void corruptGzipKeepsOriginalBytes() {
            byte[] body = "this is not gzip".getBytes(StandardCharsets.UTF_8);

            DecodeOutcome outcome = cascade.decode(EncodingStack.parse("gzip"), body);

            assertThat(outcome.isPassThrough()).isTrue();
            assertThat(outcome.reason()).isEqualTo(PassThroughReason.MALFORMED_ENCODING);
            assertThat(outcome.body()).isSameAs(body);
        }

        @Test
        @DisplayName("A failure in the second coding discards the first decode")
        void noPartialDecode() {
            // outer gzip is valid, inner "deflate" payload is garbage
            byte[] garbage = {(byte) 0xFF, 0x00, 0x13, 0x37};
            byte[] body = gzip.encode(garbage);

            DecodeOutcome outcome = cascade.decode(EncodingStack.parse("deflate, gzip"), body);

            assertThat(outcome.isPassThrough()).isTrue();
            assertThat(outcome.body()).isSameAs(body);
        }

        @Test
        void nonUtf8PlaintextIsTreatedAsBinary() {
            byte[] latin1 = "café".getBytes(StandardCharsets.ISO_8859_1);
            byte[] body = gzip.encode(latin1);

            DecodeOutcome outcome = cascade.decode(EncodingStack.parse("gzip"), body);

            assertThat(outcome.reason()).isEqualTo(PassThroughReason.NOT_UTF8);
            assertThat(outcome.body()).isSameAs(body);
        }

        @Test
        void decodedSizeAboveBoundIsTooLarge() {
            DecompressionCascade small = new DecompressionCascade(CodecRegistry.standard(), 16);

            DecodeOutcome outcome = small.decode(EncodingStack.parse("gzip"), gzip.encode(PLAIN));

            assertThat(outcome.reason()).isEqualTo(PassThroughReason.BODY_TOO_LARGE);
        }

        @Test
        void unresolvedOutcomeIsFailedWithDetail() {
            DecodeOutcome outcome = cascade.reverse(EncodingStack.parse("gzip"), new byte[] {1, 2, 3});

            assertThat(outcome.isFailed()).isTrue();
            assertThat(outcome.detail()).contains("gzip");
            assertThat(outcome.resolve().isPassThrough()).isTrue();
        }
    }

    @Nested
    class UnavailableCodec {

        private Logger cascadeLogger;
        private Level previousLevel;
        private ListAppender<ILoggingEvent> appender;

        @BeforeEach
        void attachAppender() {
            cascadeLogger = (Logger) LoggerFactory.getLogger(DecompressionCascade.class);
            previousLevel = cascadeLogger.getLevel();
            cascadeLogger.setLevel(Level.DEBUG);
            appender = new ListAppender<>();
            appender.start();
            cascadeLogger.addAppender(appender);
        }

        @AfterEach
        void detachAppender() {
            cascadeLogger.detachAppender(appender);
            cascadeLogger.setLevel(previousLevel);
        }

        @Test
        @DisplayName("Disabled zstd passes the body through and logs at DEBUG")
        void zstdDisabled() {
            CodecRegistry registry =
                    CodecRegistry.builder().withStandardCodecs().disable("zstd").build();
            DecompressionCascade withoutZstd = new DecompressionCascade(registry, 1024 * 1024);
            byte[] body = {0x28, (byte) 0xB5, 0x2F, (byte) 0xFD, 0x00};

            DecodeOutcome outcome = withoutZstd.decode(EncodingStack.parse("zstd"), body);

            assertThat(outcome.isPassThrough()).isTrue();
            assertThat(outcome.reason()).isEqualTo(PassThroughReason.CODEC_UNAVAILABLE);
            assertThat(outcome.body()).isSameAs(body);
            assertThat(appender.list)
                    .anySatisfy(event -> {
                        assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
                        assertThat(event.getFormattedMessage())
                                .isEqualTo("Codec 'zstd' unavailable, passing response through unchanged");
                    });
        }
    }

    @Test
    void rejectsNonPositiveBound() {
        assertThatThrownBy(() -> new DecompressionCascade(CodecRegistry.standard(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void utf8Check() {
        assertThat(DecompressionCascade.isUtf8("ünïcödé ✓".getBytes(StandardCharsets.UTF_8)))
                .isTrue();
        assertThat(DecompressionCascade.isUtf8(new byte[] {(byte) 0xC3})).isFalse();
        assertThat(DecompressionCascade.isUtf8(new byte[0])).isTrue();
    }
}
