package io.debugtoolbar.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HttpHeadersTest {

    @Test
    void lookupIsCaseInsensitive() {
        HttpHeaders headers = HttpHeaders.of("Content-Type", "text/html");

        assertThat(headers.first("content-type")).isEqualTo("text/html");
        assertThat(headers.contains("CONTENT-TYPE")).isTrue();
        assertThat(headers.first("Content-Length")).isNull();
    }

    @Test
    void duplicatesAreKeptInOrder() {
        HttpHeaders headers = HttpHeaders.of("Set-Cookie", "a=1", "X-Other", "x", "set-cookie", "b=2");

        assertThat(headers.all("Set-Cookie")).containsExactly("a=1", "b=2");
        assertThat(headers.size()).isEqualTo(3);
        assertThat(headers.names()).containsExactly("Set-Cookie", "X-Other");
    }

    @Test
    void withoutRemovesEveryLineOfThatNameAndKeepsTheRest() {
        HttpHeaders headers = HttpHeaders.of("A", "1", "Content-Length", "10", "B", "2", "content-length", "11");

        HttpHeaders stripped = headers.without("Content-Length");

        assertThat(stripped.entries())
                .containsExactly(new HttpHeaders.Header("A", "1"), new HttpHeaders.Header("B", "2"));
        assertThat(headers.size()).as("original untouched").isEqualTo(4);
    }

    @Test
    void withoutAbsentNameReturnsSameInstance() {
        HttpHeaders headers = HttpHeaders.of("A", "1");

        assertThat(headers.without("B")).isSameAs(headers);
    }

    @Test
    void replaceAppendsSingleFreshLineAtTheEnd() {
        HttpHeaders headers = HttpHeaders.of("Content-Length", "10", "A", "1");

        HttpHeaders replaced = headers.replace("Content-Length", "42");

        assertThat(replaced.entries())
                .containsExactly(new HttpHeaders.Header("A", "1"), new HttpHeaders.Header("Content-Length", "42"));
    }

    @Test
    void singleValueMapUsesLowercaseKeysAndFirstValue() {
        HttpHeaders headers = HttpHeaders.of("X-A", "1", "x-a", "2");

        assertThat(headers.toSingleValueMap()).containsExactly(Map.entry("x-a", "1"));
    }

    @Test
    void oddArgumentCountIsRejected() {
        assertThatThrownBy(() -> HttpHeaders.of("A")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equalityFollowsLinesAndOrder() {
        assertThat(HttpHeaders.of("A", "1", "B", "2")).isEqualTo(HttpHeaders.of(List.of(
                new HttpHeaders.Header("A", "1"), new HttpHeaders.Header("B", "2"))));
        assertThat(HttpHeaders.of("A", "1", "B", "2")).isNotEqualTo(HttpHeaders.of("B", "2", "A", "1"));
        assertThat(HttpHeaders.of(List.of())).isSameAs(HttpHeaders.empty());
    }
}
