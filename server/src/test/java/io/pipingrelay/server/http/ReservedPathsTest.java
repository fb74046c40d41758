package io.pipingrelay.server.http;

import static org.assertj.core.api.Assertions.assertThat;

import io.pipingrelay.core.registry.SlotState;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Fixed pages, CORS preflight and method filtering on a running relay. */
@DisplayName("Reserved paths and methods")
class ReservedPathsTest extends RelayTestHarness {

    private static final ReservedPathsTest INSTANCE = new ReservedPathsTest();

    @BeforeAll
    static void start() {
        INSTANCE.startRelay();
    }

    @AfterAll
    static void stop() {
        INSTANCE.stopRelay();
    }

    private static HttpResponse<String> send(String method, String path) throws Exception {
        HttpRequest.BodyPublisher body = "POST".equals(method) || "PUT".equals(method)
                ? HttpRequest.BodyPublishers.ofString("data")
                : HttpRequest.BodyPublishers.noBody();
        return INSTANCE.testClient.send(
                HttpRequest.newBuilder(INSTANCE.uri(path)).timeout(TIMEOUT).method(method, body).build(),
                HttpResponse.BodyHandlers.ofString());
    }

    @Nested
    @DisplayName("Pages")
    class Pages {

        @Test
        @DisplayName("GET /version returns the version and a newline")
        void version() throws Exception {
            HttpResponse<String> response = INSTANCE.get("/version");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValue("text/plain; charset=utf-8");
            assertThat(response.body()).isEqualTo(StaticPages.version() + "\n");
        }

        @Test
        @DisplayName("GET / serves the upload page")
        void index() throws Exception {
            HttpResponse<String> response = INSTANCE.get("/");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValue("text/html; charset=utf-8");
            assertThat(response.body()).contains("<html").doesNotContain("{{version}}");
        }

        @Test
        @DisplayName("GET /noscript fills in the escaped path")
        void noScript() throws Exception {
            HttpResponse<String> response = INSTANCE.get("/noscript?path=my%22%3E%3Cscript%3E%27x%27");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body())
                    .contains("action=\"/my&quot;&gt;&lt;script&gt;&apos;x&apos;\"")
                    .doesNotContain("<script>'x'")
                    .doesNotContain("{{path}}");
        }

        @Test
        @DisplayName("GET /help uses the Host the client connected to")
        void help() throws Exception {
            HttpResponse<String> response = INSTANCE.get("/help");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("curl -T myfile http://127.0.0.1:" + INSTANCE.relay.httpPort());
        }

        @Test
        void robotsTxtIsNotFound() throws Exception {
            HttpResponse<String> response = INSTANCE.get("/robots.txt");

            assertThat(response.statusCode()).isEqualTo(404);
            assertThat(response.body()).isEmpty();
        }

        @Test
        void faviconIsNoContent() throws Exception {
            assertThat(INSTANCE.get("/favicon.ico").statusCode()).isEqualTo(204);
        }
    }

    @ParameterizedTest(name = "{0} /version")
    @ValueSource(strings = {"POST", "PUT"})
    @DisplayName("sending to a reserved path is rejected")
    void sendToReservedPath(String method) throws Exception {
        HttpResponse<String> response = send(method, "/version");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.body()).isEqualTo("[ERROR] Cannot send to the reserved path.\n");
        assertThat(INSTANCE.registry().stateOf("/version")).isEqualTo(SlotState.EMPTY);
    }

    @Test
    @DisplayName("OPTIONS on any path answers the CORS preflight")
    void preflight() throws Exception {
        HttpResponse<String> response = send("OPTIONS", "/anything");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).hasValue("*");
        assertThat(response.headers().firstValue("Access-Control-Allow-Methods"))
                .hasValue("GET, HEAD, POST, PUT, OPTIONS");
        assertThat(response.headers().firstValue("Access-Control-Allow-Headers"))
                .hasValue("Content-Type, Content-Disposition");
        assertThat(response.headers().firstValue("Access-Control-Max-Age")).hasValue("86400");
        assertThat(response.body()).isEmpty();
        assertThat(INSTANCE.registry().stateOf("/anything")).isEqualTo(SlotState.EMPTY);
    }

    @ParameterizedTest(name = "{0} → 405")
    @ValueSource(strings = {"PROPFIND", "DELETE", "PATCH"})
    @DisplayName("methods outside the relay's set are rejected with 405")
    void unsupportedMethod(String method) throws Exception {
        HttpResponse<String> response = send(method, "/p");

        assertThat(response.statusCode()).isEqualTo(405);
        assertThat(response.headers().firstValue("Allow")).hasValue("GET, HEAD, POST, PUT, OPTIONS");
        assertThat(response.body()).isEqualTo("[ERROR] Unsupported method: " + method + ".\n");
    }
}
