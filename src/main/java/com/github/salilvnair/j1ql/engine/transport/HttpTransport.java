package com.github.salilvnair.j1ql.engine.transport;

import com.github.salilvnair.j1ql.config.J1qlClientConfig;
import com.github.salilvnair.j1ql.engine.exception.J1qlEngineException;
import com.github.salilvnair.j1ql.engine.exception.J1qlErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Component
public class HttpTransport implements GraphQueryTransport {

    private static final long CANCELLATION_CHECK_MS = 50L;
    private static final String METHOD_GET = "GET";
    private static final String METHOD_POST = "POST";

    private final HttpClient client;
    private final RetryPolicy policy;
    private final Duration requestTimeout;

    public HttpTransport(J1qlClientConfig config) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(config.getConnectTimeoutMs(), 100)))
                .build();
        this.policy = RetryPolicy.fromConfig(config.getRetry());
        this.requestTimeout = Duration.ofMillis(Math.max(config.getRequestTimeoutMs(), 100));
    }

    @Override
    public RawResponse post(String url, Map<String, String> headers, String body, CancellationToken token) {
        return execute(METHOD_POST, url, headers, body, token);
    }

    @Override
    public RawResponse get(String url, Map<String, String> headers, CancellationToken token) {
        return execute(METHOD_GET, url, headers, null, token);
    }

    private RawResponse execute(
            String method,
            String url,
            Map<String, String> headers,
            String body,
            CancellationToken token
    ) {
        HttpRequest request = buildRequest(method, url, headers, body);

        int attempt = 1;
        long backoffMs = policy.initialBackoffMs();

        while (true) {
            token.throwIfCancelled();
            try {
                HttpResponse<String> response = sendOnce(request, token);
                int status = response.statusCode();
                if (!policy.isRetryable(status) || attempt >= policy.maxAttempts()) {
                    return new RawResponse(status, response.body(), attempt);
                }
                log.warn("J1QL {} {} returned status {} on attempt {}/{}, retrying in {}ms",
                        method, redact(url), status, attempt, policy.maxAttempts(), backoffMs);
            } catch (IOException io) {
                if (!policy.retryOnIOException() || attempt >= policy.maxAttempts()) {
                    throw new J1qlEngineException(
                            J1qlErrorCode.TRANSPORT_IO_FAILED,
                            "J1QL " + method + " " + redact(url) + " failed due to IO error after "
                                    + attempt + " attempt(s): " + io.getMessage(),
                            io);
                }
                log.warn("J1QL {} {} failed on attempt {}/{} msg={}, retrying in {}ms",
                        method, redact(url), attempt, policy.maxAttempts(), io.getMessage(), backoffMs);
            }

            token.sleep(backoffMs);
            backoffMs = policy.nextBackoffMs(backoffMs);
            attempt++;
        }
    }

    private HttpRequest buildRequest(String method, String url, Map<String, String> headers, String body) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new J1qlEngineException(J1qlErrorCode.INVALID_REQUEST_URL,
                    J1qlErrorCode.INVALID_REQUEST_URL.defaultMessage() + ": " + redact(url), e);
        }
        if (!uri.isAbsolute()) {
            throw new J1qlEngineException(J1qlErrorCode.INVALID_REQUEST_URL,
                    J1qlErrorCode.INVALID_REQUEST_URL.defaultMessage() + ": " + redact(url));
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout);
        if (headers != null) {
            headers.forEach(builder::header);
        }
        if (METHOD_GET.equals(method)) {
            builder.GET();
        } else {
            builder.method(method, HttpRequest.BodyPublishers.ofString(body == null ? "" : body));
        }
        return builder.build();
    }

    private HttpResponse<String> sendOnce(HttpRequest request, CancellationToken token) throws IOException {
        CompletableFuture<HttpResponse<String>> future =
                client.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        while (true) {
            if (token.isCancelled()) {
                future.cancel(true);
                token.throwIfCancelled();
            }
            try {
                return future.get(CANCELLATION_CHECK_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException pending) {
                log.trace("J1QL {} {} still in flight", request.method(), redact(request.uri().toString()));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof IOException io) {
                    throw io;
                }
                throw new J1qlEngineException(J1qlErrorCode.TRANSPORT_IO_FAILED,
                        "J1QL " + request.method() + " " + redact(request.uri().toString()) + " failed: "
                                + (cause == null ? e.getMessage() : cause.getMessage()),
                        cause == null ? e : cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                throw new J1qlEngineException(J1qlErrorCode.EXECUTION_CANCELLED, "J1QL execution was interrupted", e);
            }
        }
    }

    /**
     * Deferred result urls are pre-signed; keep their query string out of logs and messages.
     */
    static String redact(String url) {
        if (url == null) {
            return "null";
        }
        int query = url.indexOf('?');
        return query < 0 ? url : url.substring(0, query);
    }
}
