package io.debugtoolbar.javalin;

import static org.assertj.core.api.Assertions.assertThat;

import io.debugtoolbar.core.toolbar.ToolbarConfig;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DebugToolbarFilter: responses left untouched")
class PassThroughTest extends ToolbarTestHarness {

    private static final String JSON = "{\"items\":[\"a\",\"b\"],\"html\":\"</body>\"}";
    private static final String MARKER = "<div id=\"debug-toolbar\"";
    private static final PassThroughTest INSTANCE = new PassThroughTest();

    @BeforeAll
    static void startServer() {
        ToolbarConfig config = ToolbarConfig.builder().excludePaths(List.of("/health")).build();
        INSTANCE.start(config, app -> {
            app.get("/page", ctx -> ctx.html(PAGE));
            app.get("/api/items", ctx -> ctx.contentType("application/json").result(JSON));
            app.get("/health", ctx -> ctx.html(PAGE));
            app.get("/health/deep", ctx -> ctx.html(PAGE));
            app.get("/healthcheck", ctx -> ctx.html(PAGE));
            app.get("/no-content", ctx -> ctx.status(204).contentType("text/html"));
            app.get("/moved", ctx -> ctx.redirect("/page"));
            app.get("/unavailable", ctx -> ctx.res().sendError(503));
            app.get("/async", ctx -> ctx.future(() -> CompletableFuture.supplyAsync(() -> PAGE).thenAccept(ctx::html)));
            app.get("/boom", ctx -> {
                throw new IllegalStateException("boom");
            });
            app.exception(IllegalStateException.class, (e, ctx) ->
                    ctx.status(500).html("<html><body>Error: " + e.getMessage() + "</body></html>"));
        });
    }

    @AfterAll
    static void stopServer() {
        INSTANCE.stopInfrastructure();
    }

    @Test
    void json_isByteIdentical() throws Exception {
        HttpResponse<byte[]> response = INSTANCE.getBytes("/api/items");

        assertThat(response.body()).isEqualTo(JSON.getBytes(StandardCharsets.UTF_8));
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(type ->
                assertThat(type).startsWith("application/json"));
    }

    @Test
    void excludedPath_andItsChildren_areNotInjected() throws Exception {
        assertThat(INSTANCE.get("/health").body()).isEqualTo(PAGE);
        assertThat(INSTANCE.get("/health/deep").body()).isEqualTo(PAGE);
    }

    @Test
    void excludedPrefix_onlyMatchesWholeSegments() throws Exception {
        assertThat(INSTANCE.get("/healthcheck").body()).contains(MARKER);
    }

    @Test
    void toolbarPages_areNotInjected() throws Exception {
        HttpResponse<String> response = INSTANCE.get("/_debug_toolbar/");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("Request history").doesNotContain(MARKER);
    }

    @Test
    void noContentStatus_passesThrough() throws Exception {
        HttpResponse<String> response = INSTANCE.get("/no-content");

        assertThat(response.statusCode()).isEqualTo(204);
        assertThat(response.body()).isEmpty();
    }

    @Test
    void redirect_passesThrough() throws Exception {
        HttpResponse<String> response = INSTANCE.get("/moved");

        assertThat(response.statusCode()).isEqualTo(302);
        assertThat(response.headers().firstValue("Location")).hasValue("/page");
        assertThat(response.body()).doesNotContain(MARKER);
    }

    @Test
    void headRequest_hasNoBody() throws Exception {
        HttpResponse<String> response = INSTANCE.send("HEAD", "/page");

        assertThat(response.body()).isEmpty();
    }

    @Test
    void sendError_isLeftToTheContainer() throws Exception {
        HttpResponse<String> response = INSTANCE.get("/unavailable");

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(response.body()).doesNotContain(MARKER);
    }

    @Test
    void asyncResponse_isStreamedWithoutToolbar() throws Exception {
        HttpResponse<String> response = INSTANCE.get("/async");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo(PAGE);
    }

    @Test
    void exceptionMapperPage_isStillInjected() throws Exception {
        HttpResponse<String> response = INSTANCE.get("/boom");

        assertThat(response.statusCode()).isEqualTo(500);
        assertThat(response.body()).contains("Error: boom").contains(MARKER);
    }

    @Nested
    @DisplayName("toolbar configuration")
    class Configuration {

        private final ToolbarTestHarness server = new ToolbarTestHarness() {};

        @AfterEach
        void stop() {
            server.stopInfrastructure();
        }

        @Test
        void disabledToolbar_leavesHtmlAndMountsNoRoutes() throws Exception {
            server.start(ToolbarConfig.builder().enabled(false).build(), app -> app.get("/page", ctx -> ctx.html(PAGE)));

            assertThat(server.get("/page").body()).isEqualTo(PAGE);
            assertThat(server.get("/_debug_toolbar/api/requests").statusCode()).isEqualTo(404);
        }

        @Test
        void hostNotAllowed_leavesHtml() throws Exception {
            ToolbarConfig config = ToolbarConfig.builder().allowedHosts(List.of("toolbar.example")).build();
            server.start(config, app -> app.get("/page", ctx -> ctx.html(PAGE)));

            assertThat(server.get("/page").body()).isEqualTo(PAGE);
            assertThat(server.toolbar.toolbar().storage().size()).isZero();
        }

        @Test
        void allowedHost_isInjected() throws Exception {
            ToolbarConfig config = ToolbarConfig.builder().allowedHosts(List.of("127.0.0.1")).build();
            server.start(config, app -> app.get("/page", ctx -> ctx.html(PAGE)));

            assertThat(server.get("/page").body()).contains(MARKER);
        }

        @Test
        void showToolbarPredicate_vetoesRequests() throws Exception {
            ToolbarConfig config = ToolbarConfig.builder()
                    .showToolbar(request -> !request.path().startsWith("/quiet"))
                    .build();
            server.start(config, app -> {
                app.get("/quiet", ctx -> ctx.html(PAGE));
                app.get("/loud", ctx -> ctx.html(PAGE));
            });

            assertThat(server.get("/quiet").body()).isEqualTo(PAGE);
            assertThat(server.get("/loud").body()).contains(MARKER);
        }

        @Test
        void bodyOverLimit_isStreamedUnchanged() throws Exception {
            ToolbarConfig config = ToolbarConfig.builder().maxBodyBytes(32).build();
            server.start(config, app -> app.get("/page", ctx -> ctx.html(PAGE)));

            HttpResponse<String> response = server.get("/page");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEqualTo(PAGE);
        }

        @Test
        void customMarker_isUsed() throws Exception {
            ToolbarConfig config = ToolbarConfig.builder().insertBefore("</head>").build();
            server.start(config, app -> app.get("/page", ctx -> ctx.html(PAGE)));

            String body = server.get("/page").body();

            assertThat(body.indexOf(MARKER)).isLessThan(body.indexOf("</head>"));
        }
    }
}
