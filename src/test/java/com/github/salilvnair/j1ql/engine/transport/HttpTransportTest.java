package com.github.salilvnair.j1ql.engine.transport;

import com.github.salilvnair.j1ql.config.J1qlClientConfig;
import com.github.salilvnair.j1ql.engine.exception.J1qlEngineException;
import com.github.salilvnair.j1ql.engine.exception.J1qlErrorCode;
import com.github.salilvnair.j1ql.support.J1qlFixtures;
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
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.salilvnair.j1ql.support.TestConstants.ACCOUNT_ID;
import static com.github.salilvnair.j1ql.support.TestConstants.API_KEY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpTransportTest {

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicInteger hits = new AtomicInteger();
    private final List<String> authorizationHeaders = new CopyOnWriteArrayList<>();
    private final List<String> accountHeaders = new CopyOnWriteArrayList<>();
    private final List<String> bodies = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        executor.shutdownNow();
    }

    @Test
    void retriesTransientStatusUntilSuccess() {
        respondWith(503, 503, 200);

        RawResponse response = transport(5).post(url("/graphql"), Map.of(), "{}", CancellationToken.create());

        assertEquals(200, response.status());
        assertEquals(3, response.attempts());
        assertEquals(3, hits.get());
    }

    @Test
    void returnsLastResponseWhenRetriesAreExhausted() {
        respondWith(429, 429, 429, 429);

        RawResponse response = transport(3).get(url("/download"), Map.of(), CancellationToken.create());

        assertEquals(429, response.status());
        assertEquals(3, response.attempts());
        assertEquals(3, hits.get());
    }

    @Test
    void nonRetryableStatusIsReturnedAfterOneAttempt() {
        respondWith(401, 200);

        RawResponse response = transport(5).post(url("/graphql"), Map.of(), "{}", CancellationToken.create());

        assertEquals(401, response.status());
        assertEquals(1, hits.get());
    }

    @Test
    void postSendsHeadersAndBody() {
        respondWith(200);
        Map<String, String> headers = Map.of(
                "Authorization", "Bearer " + API_KEY,
                "JupiterOne-Account", ACCOUNT_ID,
                "Content-Type", "application/json");

        RawResponse response = transport(1).post(url("/graphql"), headers, "{\"query\":\"FIND Host\"}", CancellationToken.create());

        assertTrue(response.isSuccess());
        assertEquals(List.of("Bearer " + API_KEY), authorizationHeaders);
        assertEquals(List.of(ACCOUNT_ID), accountHeaders);
        assertEquals(List.of("{\"query\":\"FIND Host\"}"), bodies);
        assertEquals("ok-1", response.body());
    }

    @Test
    void connectionFailureRaisesTransportError() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        J1qlEngineException e = assertThrows(J1qlEngineException.class, () -> transport(2)
                .get("http://127.0.0.1:" + closedPort + "/download", Map.of(), CancellationToken.create()));

        assertEquals(J1qlErrorCode.TRANSPORT_IO_FAILED.name(), e.getErrorCode());
    }

    @Test
    void deadlineAbortsInFlightRequestPromptly() {
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(3000);
                write(exchange, 200, "late");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        long started = System.nanoTime();
        J1qlEngineException e = assertThrows(J1qlEngineException.class, () -> transport(1)
                .get(url("/slow"), Map.of(), CancellationToken.withTimeout(Duration.ofMillis(200))));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertEquals(J1qlErrorCode.EXECUTION_CANCELLED.name(), e.getErrorCode());
        assertTrue(elapsedMs < 2000, "cancellation took " + elapsedMs + "ms");
    }

    @Test
    void relativeUrlIsRejected() {
        J1qlEngineException e = assertThrows(J1qlEngineException.class,
                () -> transport(1).get("/relative", Map.of(), CancellationToken.create()));

        assertEquals(J1qlErrorCode.INVALID_REQUEST_URL.name(), e.getErrorCode());
    }

    @Test
    void redactDropsPresignedQueryString() {
        assertEquals("https://bucket/r.json", HttpTransport.redact("https://bucket/r.json?X-Amz-Signature=secret"));
    }

    private void respondWith(int... statuses) {
        server.createContext("/", exchange -> {
            int hit = hits.incrementAndGet();
            authorizationHeaders.addAll(headerValues(exchange, "Authorization"));
            accountHeaders.addAll(headerValues(exchange, "JupiterOne-Account"));
            bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            int status = statuses[Math.min(hit, statuses.length) - 1];
            write(exchange, status, "ok-" + hit);
        });
    }

    private static List<String> headerValues(HttpExchange exchange, String name) {
        List<String> values = exchange.getRequestHeaders().get(name);
        return values == null ? List.of() : values;
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private HttpTransport transport(int maxAttempts) {
        J1qlClientConfig config = J1qlFixtures.config();
        config.getRetry().setMaxAttempts(maxAttempts);
        config.getRetry().setInitialBackoffMs(1L);
        config.getRetry().setMaxBackoffMs(5L);
        config.setRequestTimeoutMs(5000);
        return new HttpTransport(config);
    }

    private String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }
}
