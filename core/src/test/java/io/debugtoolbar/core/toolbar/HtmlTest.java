package io.debugtoolbar.core.toolbar;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HtmlTest {

    @Test
    void escapesMarkupCharacters() {
        assertThat(Html.escape("<a href=\"x\">Tom & Jerry's</a>"))
                .isEqualTo("&lt;a href=&quot;x&quot;&gt;Tom &amp; Jerry&#x27;s&lt;/a&gt;");
    }

    @Test
    void plainTextIsReturnedAsIs() {
        String text = "nothing to escape";

        assertThat(Html.escape(text)).isSameAs(text);
        assertThat(Html.escape(null)).isEmpty();
        assertThat(Html.escape(42)).isEqualTo("42");
    }

    @Test
    void identifierKeepsWordCharacters() {
        assertThat(Html.identifier("Request Panel-1_x\"><")).isEqualTo("RequestPanel1_x");
        assertThat(Html.identifier(null)).isEmpty();
    }
}
