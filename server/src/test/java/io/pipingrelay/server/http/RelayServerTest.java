package io.pipingrelay.server.http;

import static org.assertj.core.api.Assertions.assertThat;

import io.pipingrelay.core.registry.SlotState;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** End-to-end transfers through a running relay. */
@DisplayName("Relay over HTTP")
class RelayServerTest extends RelayTestHarness {

    private static final RelayServerTest INSTANCE = new RelayServerTest();

    @BeforeAll
    static void start() {
        INSTANCE.startRelay();
    }

    @AfterAll
    static void stop() {
        INSTANCE.stopRelay();
    }

    @Test
    @DisplayName("receiver first: the receiver gets the body, the sender the progress lines")
    void receiverFirst() throws Exception {
        CompletableFuture<HttpResponse<String>> receiver = INSTANCE.getAsync("/a");
        INSTANCE.awaitState("/a", SlotState.RECEIVER_WAITING);

        HttpResponse<String> sender = INSTANCE.post("/a", "hello");
        HttpResponse<String> received = await(receiver);

        assertThat(sender.statusCode()).isEqualTo(200);
        assertThat(sender.headers().firstValue("Content-Type")).hasValue("text/plain; charset=utf-8");
        assertThat(sender.body())
                .isEqualTo("[INFO] Waiting for 1 receiver(s)...\n"
                        + "[INFO] 1 receiver(s) has/have been connected.\n"
                        + "[INFO] A receiver was connected.\n"
                        + "[INFO] Sent successfully!\n");
        assertThat(received.statusCode()).isEqualTo(200);
        assertThat(received.body()).isEqualTo("hello");
        assertThat(received.headers().firstValue("Content-Length")).hasValue("5");
        assertThat(received.headers().firstValue("Access-Control-Allow-Origin")).hasValue("*");
        assertThat(received.headers().firstValue("X-Robots-Tag")).hasValue("none");
        assertThat(INSTANCE.registry().stateOf("/a")).isEqualTo(SlotState.EMPTY);
    }

    @Test
    @DisplayName("sender first: the waiting line is streamed before any receiver arrives")
    void senderFirstStreamsWaitingLine() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(INSTANCE.uri("/early"))
                .timeout(TIMEOUT)
                .PUT(HttpRequest.BodyPublishers.ofString("early bird"))
                .build();
        HttpResponse<InputStream> sender =
                await(INSTANCE.testClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream()));

        try (var lines = new BufferedReader(new InputStreamReader(sender.body(), StandardCharsets.UTF_8))) {
            assertThat(lines.readLine()).isEqualTo("[INFO] Waiting for 1 receiver(s)...");
            assertThat(INSTANCE.registry().stateOf("/early")).isEqualTo(SlotState.SENDER_WAITING);

            HttpResponse<String> received = INSTANCE.get("/early");

            assertThat(received.body()).isEqualTo("early bird");
            assertThat(lines.readLine()).isEqualTo("[INFO] A receiver was connected.");
            assertThat(lines.readLine()).isEqualTo("[INFO] Sent successfully!");
            assertThat(lines.readLine()).isNull();
        }
    }

    @Test
    @DisplayName("POST /b?n=2 then GET /b twice: both receivers get the body")
    void twoReceiversWithoutCount() throws Exception {
        CompletableFuture<HttpResponse<String>> sender = INSTANCE.postAsync("/b?n=2", "xyz");
        INSTANCE.awaitState("/b", SlotState.SENDER_WAITING);

        CompletableFuture<HttpResponse<String>> first = INSTANCE.getAsync("/b");
        CompletableFuture<HttpResponse<String>> second = INSTANCE.getAsync("/b");

        assertThat(await(first).body()).isEqualTo("xyz");
        assertThat(await(second).body()).isEqualTo("xyz");
        assertThat(await(sender).body()).contains("[INFO] 2 receivers were connected.\n");
    }

    @ParameterizedTest(name = "n={0}")
    @ValueSource(ints = {1, 3, 8})
    @DisplayName("a binary body larger than one chunk reaches every receiver intact")
    void binaryFanOut(int n) throws Exception {
        String path = "/bin-" + n;
        byte[] payload = new byte[200_000];
        new Random(n).nextBytes(payload);

        List<CompletableFuture<HttpResponse<byte[]>>> receivers = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            receivers.add(INSTANCE.testClient.sendAsync(
                    HttpRequest.newBuilder(INSTANCE.uri(path + "?n=" + n)).timeout(TIMEOUT).build(),
                    HttpResponse.BodyHandlers.ofByteArray()));
        }
        INSTANCE.awaitReceivers(path, n);
        HttpResponse<String> sender = await(INSTANCE.testClient.sendAsync(
                HttpRequest.newBuilder(INSTANCE.uri(path + "?n=" + n))
                        .timeout(TIMEOUT)
                        .header("Content-Type", "application/octet-stream")
                        .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
                        .build(),
                HttpResponse.BodyHandlers.ofString()));

        assertThat(sender.body()).endsWith("[INFO] Sent successfully!\n");
        for (CompletableFuture<HttpResponse<byte[]>> receiver : receivers) {
            HttpResponse<byte[]> response = await(receiver);
            assertThat(response.body()).isEqualTo(payload);
            assertThat(response.headers().firstValue("Content-Type")).hasValue("application/octet-stream");
        }
    }

    @Test
    @DisplayName("POST /c?n=2, GET /c?n=3 is rejected, two plain GETs still complete")
    void mismatchedReceiverRejected() throws Exception {
        CompletableFuture<HttpResponse<String>> sender = INSTANCE.postAsync("/c?n=2", "ccc");
        INSTANCE.awaitState("/c", SlotState.SENDER_WAITING);

        HttpResponse<String> rejected = INSTANCE.get("/c?n=3");

        assertThat(rejected.statusCode()).isEqualTo(400);
        assertThat(rejected.body()).isEqualTo("[ERROR] The number of receivers has been mismatched.\n");

        CompletableFuture<HttpResponse<String>> first = INSTANCE.getAsync("/c");
        CompletableFuture<HttpResponse<String>> second = INSTANCE.getAsync("/c");
        assertThat(await(first).body()).isEqualTo("ccc");
        assertThat(await(second).body()).isEqualTo("ccc");
        assertThat(await(sender).statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("GET /m?n=2 twice, POST /m?n=3 is rejected, the receivers stay for POST /m?n=2")
    void mismatchedSenderRejected() throws Exception {
        CompletableFuture<HttpResponse<String>> first = INSTANCE.getAsync("/m?n=2");
        CompletableFuture<HttpResponse<String>> second = INSTANCE.getAsync("/m?n=2");
        INSTANCE.awaitReceivers("/m", 2);

        HttpResponse<String> rejected = INSTANCE.post("/m?n=3", "nope");

        assertThat(rejected.statusCode()).isEqualTo(400);
        assertThat(rejected.body()).isEqualTo("[ERROR] The number of receivers has been mismatched.\n");
        assertThat(INSTANCE.registry().stateOf("/m")).isEqualTo(SlotState.RECEIVER_WAITING);
        assertThat(INSTANCE.registry().receiverCount("/m")).isEqualTo(2);

        HttpResponse<String> sender = INSTANCE.post("/m?n=2", "mmm");

        assertThat(await(first).body()).isEqualTo("mmm");
        assertThat(await(second).body()).isEqualTo("mmm");
        assertThat(sender.body()).endsWith("[INFO] Sent successfully!\n");
    }

    @Test
    @DisplayName("a second sender on a waiting path gets the duplicate-sender error")
    void duplicateSender() throws Exception {
        CompletableFuture<HttpResponse<String>> first = INSTANCE.postAsync("/d", "one");
        INSTANCE.awaitState("/d", SlotState.SENDER_WAITING);

        HttpResponse<String> second = INSTANCE.post("/d", "two");

        assertThat(second.statusCode()).isEqualTo(400);
        assertThat(second.body()).isEqualTo("[ERROR] The path has been used by another sender.\n");

        assertThat(INSTANCE.get("/d").body()).isEqualTo("one");
        assertThat(await(first).statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("invalid n is a 400 before registration")
    void invalidCount() throws Exception {
        HttpResponse<String> response = INSTANCE.post("/e?n=0", "x");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.body()).isEqualTo("[ERROR] Invalid n query parameter.\n");
        assertThat(INSTANCE.registry().stateOf("/e")).isEqualTo(SlotState.EMPTY);
    }

    @Test
    @DisplayName("HEAD receiver gets the forwarded headers and no body")
    void headReceiver() throws Exception {
        CompletableFuture<HttpResponse<String>> head = INSTANCE.testClient.sendAsync(
                HttpRequest.newBuilder(INSTANCE.uri("/h"))
                        .timeout(TIMEOUT)
                        .method("HEAD", HttpRequest.BodyPublishers.noBody())
                        .build(),
                HttpResponse.BodyHandlers.ofString());
        INSTANCE.awaitState("/h", SlotState.RECEIVER_WAITING);

        HttpResponse<String> sender = await(INSTANCE.testClient.sendAsync(
                HttpRequest.newBuilder(INSTANCE.uri("/h"))
                        .timeout(TIMEOUT)
                        .header("Content-Type", "text/csv")
                        .POST(HttpRequest.BodyPublishers.ofString("a,b\n1,2\n"))
                        .build(),
                HttpResponse.BodyHandlers.ofString()));

        HttpResponse<String> response = await(head);
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValue("text/csv");
        assertThat(response.body()).isEmpty();
        assertThat(sender.body()).endsWith("[INFO] Sent successfully!\n");
    }

    @Test
    @DisplayName("multipart sender: receivers get only the first part with its headers")
    void multipartSender() throws Exception {
        String body = "--XyZ\r\n"
                + "Content-Disposition: form-data; name=\"input_file\"; filename=\"notes.txt\"\r\n"
                + "Content-Type: text/plain\r\n"
                + "\r\n"
                + "file contents\r\n"
                + "--XyZ--\r\n";
        CompletableFuture<HttpResponse<String>> receiver = INSTANCE.getAsync("/form");
        INSTANCE.awaitState("/form", SlotState.RECEIVER_WAITING);

        HttpResponse<String> sender = await(INSTANCE.testClient.sendAsync(
                HttpRequest.newBuilder(INSTANCE.uri("/form"))
                        .timeout(TIMEOUT)
                        .header("Content-Type", "multipart/form-data; boundary=XyZ")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString()));

        HttpResponse<String> received = await(receiver);
        assertThat(received.body()).isEqualTo("file contents");
        assertThat(received.headers().firstValue("Content-Type")).hasValue("text/plain");
        assertThat(received.headers().firstValue("Content-Disposition"))
                .hasValueSatisfying(value -> assertThat(value).contains("notes.txt"));
        assertThat(sender.body()).endsWith("[INFO] Sent successfully!\n");
    }

    @Test
    @DisplayName("a multipart upload without any delimiter aborts and frees the path")
    void malformedMultipartSender() throws Exception {
        CompletableFuture<HttpResponse<String>> receiver = INSTANCE.getAsync("/bad-form");
        INSTANCE.awaitState("/bad-form", SlotState.RECEIVER_WAITING);

        HttpResponse<String> sender = await(INSTANCE.testClient.sendAsync(
                HttpRequest.newBuilder(INSTANCE.uri("/bad-form"))
                        .timeout(TIMEOUT)
                        .header("Content-Type", "multipart/form-data; boundary=XyZ")
                        .POST(HttpRequest.BodyPublishers.ofString("not a form at all"))
                        .build(),
                HttpResponse.BodyHandlers.ofString()));

        assertThat(sender.body()).endsWith("[INFO] Sending aborted.\n");
        assertThat(receiver).failsWithin(TIMEOUT);
        assertThat(INSTANCE.registry().stateOf("/bad-form")).isEqualTo(SlotState.EMPTY);
    }

    @Test
    @DisplayName("a path can be reused after its transfer")
    void pathReuse() throws Exception {
        for (String text : List.of("first", "second")) {
            CompletableFuture<HttpResponse<String>> receiver = INSTANCE.getAsync("/reuse");
            INSTANCE.awaitState("/reuse", SlotState.RECEIVER_WAITING);
            INSTANCE.post("/reuse", text);
            assertThat(await(receiver).body()).isEqualTo(text);
        }
    }
}
