package com.socdash.reconciler.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.socdash.reconciler.backend.dto.WorkflowStatusResponse;
import com.socdash.reconciler.model.WorkflowAction;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests WorkflowBackendClient against a local stub of the response service
 * (JDK HttpServer on an ephemeral port).
 */
class WorkflowBackendClientTest {

    HttpServer server;
    String     baseUrl;

    // What the stub answers next, and what it last received.
    volatile int    nextStatus = 200;
    volatile String nextBody   = "{}";
    final AtomicReference<String> lastPath   = new AtomicReference<>();
    final AtomicReference<String> lastRawPath = new AtomicReference<>();
    final AtomicReference<String> lastMethod = new AtomicReference<>();
    final AtomicReference<String> lastAuth   = new AtomicReference<>();
    final AtomicReference<String> lastBody   = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    // ------------------------------------------------------------------
    // fetchStatus
    // ------------------------------------------------------------------

    @Test
    void fetchStatus_parsesStateAndRawInfo() throws Exception {
        nextBody = """
                {"state": "PROGRESS", "info": {"completed_steps": ["lookup_ip"], "current_step": "block_ip"}}
                """;

        WorkflowStatusResponse resp = client("secret-token").fetchStatus("inc-1").get(5, TimeUnit.SECONDS);

        assertThat(resp.effectiveState()).isEqualTo("PROGRESS");
        assertThat(resp.info().get("current_step").asText()).isEqualTo("block_ip");
        assertThat(lastMethod.get()).isEqualTo("GET");
        assertThat(lastPath.get()).isEqualTo("/response/workflows/inc-1/status");
        assertThat(lastAuth.get()).isEqualTo("Bearer secret-token");
    }

    @Test
    void fetchStatus_notStartedPayload_usesStatusAsState() throws Exception {
        nextBody = "{\"status\": \"not_started\"}";

        WorkflowStatusResponse resp = client("").fetchStatus("inc-1").get(5, TimeUnit.SECONDS);

        assertThat(resp.effectiveState()).isEqualTo("not_started");
        assertThat(resp.info() == null || resp.info().isNull()).isTrue();
        assertThat(lastAuth.get()).isNull();
    }

    @Test
    void fetchStatus_non2xx_failsWithStatusCode() {
        nextStatus = 503;
        nextBody   = "{\"detail\": \"broker down\"}";

        CompletableFuture<WorkflowStatusResponse> future = client("t").fetchStatus("inc-1");

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(BackendException.class)
                .satisfies(e -> assertThat(((BackendException) e.getCause()).getStatusCode()).isEqualTo(503));
    }

    @Test
    void fetchStatus_unparseableBody_fails() {
        nextBody = "<html>gateway error</html>";

        CompletableFuture<WorkflowStatusResponse> future = client("t").fetchStatus("inc-1");

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(BackendException.class);
    }

    @Test
    void fetchStatus_jsonNullBody_failsInsteadOfYieldingNull() {
        nextBody = "null";

        CompletableFuture<WorkflowStatusResponse> future = client("t").fetchStatus("inc-1");

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(BackendException.class)
                .hasMessageContaining("empty status body");
    }

    @Test
    void fetchStatus_incidentIdWithSpace_isPercentEncodedAsPathSegment() throws Exception {
        nextBody = "{\"state\": \"PENDING\"}";

        client("t").fetchStatus("inc 1/a").get(5, TimeUnit.SECONDS);

        assertThat(lastRawPath.get()).isEqualTo("/response/workflows/inc%201%2Fa/status");
    }

    // ------------------------------------------------------------------
    // sendAction
    // ------------------------------------------------------------------

    @Test
    void sendAction_postsWireValue() {
        client("t").sendAction("inc-9", WorkflowAction.SKIP);

        assertThat(lastMethod.get()).isEqualTo("POST");
        assertThat(lastPath.get()).isEqualTo("/response/workflows/inc-9/action");
        assertThat(lastBody.get()).isEqualTo("{\"action\":\"skip_step\"}");
    }

    @Test
    void sendAction_404_isReportedAsNotFound() {
        nextStatus = 404;

        assertThatThrownBy(() -> client("t").sendAction("inc-9", WorkflowAction.ADVANCE))
                .isInstanceOf(BackendException.class)
                .satisfies(e -> assertThat(((BackendException) e).isNotFound()).isTrue());
    }

    @Test
    void sendAction_unreachableBackend_hasNoStatusCode() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        WorkflowBackendClient unreachable = new WorkflowBackendClient(
                "http://127.0.0.1:" + closedPort, "t", 2000, new ObjectMapper());

        assertThatThrownBy(() -> unreachable.sendAction("inc-9", WorkflowAction.CANCEL))
                .isInstanceOf(BackendException.class)
                .satisfies(e -> assertThat(((BackendException) e).getStatusCode())
                        .isEqualTo(BackendException.NO_RESPONSE));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private WorkflowBackendClient client(String token) {
        return new WorkflowBackendClient(baseUrl, token, 5000, new ObjectMapper());
    }

    private void handle(HttpExchange exchange) throws IOException {
        lastPath.set(exchange.getRequestURI().getPath());
        lastRawPath.set(exchange.getRequestURI().getRawPath());
        lastMethod.set(exchange.getRequestMethod());
        lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
        lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));

        byte[] body = nextBody.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(nextStatus, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }
}
