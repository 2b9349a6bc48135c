package io.debugtoolbar.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.debugtoolbar.core.model.HttpHeaders;
import io.debugtoolbar.core.model.InjectionResult;
import org.junit.jupiter.api.Test;

class HeaderRewriterTest {

    private final HeaderRewriter rewriter = new HeaderRewriter();
    private final InjectionResult tenBytes = InjectionResult.of(new byte[10], false);

    @Test
    void replacesContentLengthAndDropsTransferEncoding() {
        HttpHeaders original = HttpHeaders.of(
                "Content-Type", "text/html",
                "Transfer-Encoding", "chunked",
                "content-length", "3",
                "Set-Cookie", "a=1",
                "Set-Cookie", "b=2");

        HttpHeaders rewritten = rewriter.rewrite(original, tenBytes, HttpHeaders.empty());

        assertThat(rewritten.all("Content-Length")).containsExactly("10");
        assertThat(rewritten.contains("Transfer-Encoding")).isFalse();
        assertThat(rewritten.all("Set-Cookie")).containsExactly("a=1", "b=2");
        assertThat(rewritten.names()).containsExactly("Content-Type", "Set-Cookie", "Content-Length");
    }

    @Test
    void keepsContentEncodingWhenNothingWasDecoded() {
        HttpHeaders original = HttpHeaders.of("Content-Encoding", "identity");

        assertThat(rewriter.rewrite(original, tenBytes, HttpHeaders.empty()).first("Content-Encoding"))
                .isEqualTo("identity");
    }

    @Test
    void dropsEveryContentEncodingLineWhenDecoded() {
        HttpHeaders original = HttpHeaders.of("Content-Encoding", "deflate", "Content-Encoding", "gzip", "Vary", "Accept-Encoding");

        HttpHeaders rewritten = rewriter.rewrite(original, InjectionResult.of(new byte[4], true), HttpHeaders.empty());

        assertThat(rewritten.contains("Content-Encoding")).isFalse();
        assertThat(rewritten.first("Vary")).isEqualTo("Accept-Encoding");
    }

    @Test
    void appendsExtraHeadersBeforeContentLength() {
        HttpHeaders rewritten = rewriter.rewrite(
                HttpHeaders.of("Content-Type", "text/html"), tenBytes, HttpHeaders.of("Server-Timing", "total;dur=1.00"));

        assertThat(rewritten.names()).containsExactly("Content-Type", "Server-Timing", "Content-Length");
    }
}
