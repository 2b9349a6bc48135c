package io.debugtoolbar.javalin;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.debugtoolbar.core.toolbar.StoredRequest;
import io.debugtoolbar.core.toolbar.ToolbarConfig;
import java.net.http.HttpResponse;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ToolbarRoutes")
class ToolbarRoutesTest extends ToolbarTestHarness {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ToolbarRoutesTest INSTANCE = new ToolbarRoutesTest();

    @BeforeAll
    static void startServer() {
        ToolbarConfig config = ToolbarConfig.builder()
                .apiPath("/__debug")
                .staticPath("/__debug/assets")
                .build();
        INSTANCE.start(config, app -> app.get("/page", ctx -> ctx.html(PAGE)));
    }

    @AfterAll
    static void stopServer() {
        INSTANCE.stopInfrastructure();
    }

    /** Requests a page and returns the id of the stored request. */
    private static String recordPage() throws Exception {
        String body = INSTANCE.get("/page?tab=orders").body();
        return INSTANCE.toolbar.toolbar().storage().all().stream()
                .map(StoredRequest::requestId)
                .map(UUID::toString)
                .filter(body::contains)
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("JSON API")
    class JsonApi {

        @Test
        void listsRecordedRequests() throws Exception {
            String first = recordPage();
            String second = recordPage();

            HttpResponse<String> response = INSTANCE.get("/__debug/api/requests");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(type ->
                    assertThat(type).startsWith("application/json"));
            JsonNode requests = MAPPER.readTree(response.body()).get("requests");
            assertThat(requests.isArray()).isTrue();
            assertThat(requests.findValuesAsText("request_id")).contains(first, second);
            JsonNode latest = requests.get(0);
            assertThat(latest.get("method").asText()).isEqualTo("GET");
            assertThat(latest.get("path").asText()).isEqualTo("/page");
            assertThat(latest.get("status_code").asInt()).isEqualTo(200);
            assertThat(latest.has("stored_at")).isTrue();
        }

        @Test
        void returnsOneRequestWithPanels() throws Exception {
            String id = recordPage();

            HttpResponse<String> response = INSTANCE.get("/__debug/api/requests/" + id);

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode detail = MAPPER.readTree(response.body());
            assertThat(detail.get("request_id").asText()).isEqualTo(id);
            assertThat(detail.get("metadata").get("query_string").asText()).isEqualTo("tab=orders");
            assertThat(detail.get("metadata").get("query_params").get("tab").get(0).asText()).isEqualTo("orders");
            assertThat(detail.get("panels").has("TimerPanel")).isTrue();
            assertThat(detail.get("timing").has("total_time")).isTrue();
        }

        @Test
        void unknownId_is404() throws Exception {
            HttpResponse<String> response = INSTANCE.get("/__debug/api/requests/" + UUID.randomUUID());

            assertThat(response.statusCode()).isEqualTo(404);
            assertThat(MAPPER.readTree(response.body()).get("error").asText()).isEqualTo("Request not found");
        }

        @Test
        void malformedId_is404() throws Exception {
            assertThat(INSTANCE.get("/__debug/api/requests/not-a-uuid").statusCode()).isEqualTo(404);
        }
    }

    @Nested
    @DisplayName("HTML pages")
    class Pages {

        @Test
        void historyPage_linksToDetail() throws Exception {
            String id = recordPage();

            HttpResponse<String> response = INSTANCE.get("/__debug/");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body())
                    .contains("Request history")
                    .contains("href=\"/__debug/" + id + "\"")
                    .contains("/__debug/assets/toolbar.css");
        }

        @Test
        void detailPage_showsPanelSections() throws Exception {
            String id = recordPage();

            HttpResponse<String> response = INSTANCE.get("/__debug/" + id);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body())
                    .contains("id=\"panel-TimerPanel\"")
                    .contains("id=\"panel-RequestPanel\"")
                    .contains("GET /page");
        }

        @Test
        void detailPage_unknownId_is404() throws Exception {
            assertThat(INSTANCE.get("/__debug/" + UUID.randomUUID()).statusCode()).isEqualTo(404);
            assertThat(INSTANCE.get("/__debug/nope").statusCode()).isEqualTo(404);
        }
    }

    @Nested
    @DisplayName("static assets")
    class Assets {

        @Test
        void servesStylesheet() throws Exception {
            HttpResponse<String> response = INSTANCE.get("/__debug/assets/toolbar.css");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(type ->
                    assertThat(type).startsWith("text/css"));
            assertThat(response.body()).contains("#debug-toolbar");
        }

        @Test
        void servesScript() throws Exception {
            HttpResponse<String> response = INSTANCE.get("/__debug/assets/toolbar.js");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(type ->
                    assertThat(type).startsWith("application/javascript"));
            assertThat(response.body()).contains("debug-toolbar-data");
        }
    }
}
