package com.openforge.dbxmcp.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.dbxmcp.normalize.SchemaException;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Authenticated, retrying HTTP client for the Databricks REST API.
 *
 * One call = one {@link RemoteRequestContext}:
 *
 *   call(method, path, query, body)
 *     └─ wait (rate-limit hint | exponential backoff)
 *     └─ attempt  → 2xx          → parsed JSON
 *                 → 4xx (≠429)   → RemoteApiException, no retry
 *                 → 429/5xx/I-O  → retry, up to maxRetries
 *     └─ deadline crossed        → RemoteTimeoutException
 *     └─ thread interrupted      → in-flight exchange cancelled, CancellationException
 *
 * Stateless apart from the shared {@link HttpClient} pool and {@link RateLimitState};
 * safe to share between concurrent tool calls.
 */
@Slf4j
@Component
public class DatabricksApiClient {

    private static final String USER_AGENT        = "databricks-mcp-java/0.1";
    private static final String RETRY_AFTER       = "Retry-After";
    private static final int    ERROR_SNIPPET_MAX = 512;

    private final HttpClient                        httpClient;
    private final ObjectMapper                      objectMapper;
    private final DatabricksProperties              properties;
    private final DatabricksProperties.ClientConfig config;
    private final CredentialProvider                credentials;
    private final IntervalFunction                  backoff;
    private final RateLimitState                    rateLimitState;
    private final Sleeper                           sleeper;
    private final Clock                             clock;

    public DatabricksApiClient(HttpClient httpClient,
                               ObjectMapper objectMapper,
                               DatabricksProperties properties,
                               CredentialProvider credentials,
                               IntervalFunction remoteBackoff,
                               RateLimitState rateLimitState,
                               Sleeper sleeper,
                               Clock clock) {
        this.httpClient     = httpClient;
        this.objectMapper   = objectMapper;
        this.properties     = properties;
        this.config         = properties.client();
        this.credentials    = credentials;
        this.backoff        = remoteBackoff;
        this.rateLimitState = rateLimitState;
        this.sleeper        = sleeper;
        this.clock          = clock;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public JsonNode get(String path, Map<String, ?> query) {
        return call(HttpMethod.GET, path, query, null, null);
    }

    public JsonNode post(String path, Object body) {
        return call(HttpMethod.POST, path, null, body, null);
    }

    public JsonNode call(HttpMethod method, String path, Map<String, ?> query, Object body) {
        return call(method, path, query, body, null);
    }

    /**
     * Performs one logical remote call with the configured retry policy.
     *
     * @param timeout overall budget from the first attempt, retries included;
     *                null selects {@code databricks.client.call-timeout}
     * @return parsed JSON body; an empty object for empty 2xx bodies
     * @throws RemoteApiException     non-transient failure, or transient failures exhausted the retries
     * @throws RemoteTimeoutException the budget ran out
     * @throws SchemaException        a 2xx body that is not JSON
     * @throws CancellationException  the calling thread was interrupted
     */
    public JsonNode call(HttpMethod method, String path, Map<String, ?> query, Object body, Duration timeout) {
        Objects.requireNonNull(method, "method");
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("API path must start with '/': " + path);
        }

        Duration budget = timeout != null ? timeout : config.callTimeout();
        RemoteRequestContext ctx = new RemoteRequestContext(
                method, path, copyQuery(query), toJson(body), clock.instant(), budget);
        String endpointClass = RateLimitState.endpointClass(path);

        Duration wait = rateLimitState.remainingDelay(endpointClass);
        while (true) {
            pause(ctx, wait);
            ctx.beginAttempt();
            try {
                return attempt(ctx, endpointClass);
            } catch (TransientFailure failure) {
                if (ctx.attemptCount() > config.maxRetries()) {
                    log.warn("[DatabricksApi] {} failed after {} attempts: {}",
                            ctx.describe(), ctx.attemptCount(), failure.getMessage());
                    throw failure.exhausted(ctx.attemptCount());
                }
                wait = failure.retryAfter.orElseGet(() ->
                        max(backoffFor(ctx.attemptCount()), rateLimitState.remainingDelay(endpointClass)));
                log.warn("[DatabricksApi] {} attempt {}/{} failed ({}), retrying in {} ms",
                        ctx.describe(), ctx.attemptCount(), config.maxRetries() + 1,
                        failure.status == 0 ? "network" : "HTTP " + failure.status, wait.toMillis());
            }
        }
    }

    // ── Retry loop internals ─────────────────────────────────────────────────

    private JsonNode attempt(RemoteRequestContext ctx, String endpointClass) {
        log.debug("[DatabricksApi] → {} attempt {}", ctx.describe(), ctx.attemptCount());

        HttpResponse<String> response = send(ctx, buildHttpRequest(ctx));
        int    status = response.statusCode();
        String body   = response.body();
        ctx.recordStatus(status);
        log.debug("[DatabricksApi] ← {} HTTP {} body-length={}", ctx.describe(), status,
                body == null ? 0 : body.length());

        if (status >= 200 && status < 300) {
            return parseBody(ctx, body);
        }

        RemoteError error = parseError(body);
        String message = describeFailure(ctx, status, error);

        if (status == 429 || status >= 500) {
            Optional<Duration> hint = response.headers().firstValue(RETRY_AFTER)
                    .flatMap(v -> RateLimitState.parseRetryAfter(v, clock));
            hint.ifPresent(h -> rateLimitState.recordHint(endpointClass, h));
            throw new TransientFailure(status, error.code(), message, hint, null);
        }
        throw new RemoteApiException(status, error.code(), message, ctx.attemptCount());
    }

    private HttpResponse<String> send(RemoteRequestContext ctx, HttpRequest request) {
        Duration remaining = ctx.remaining(clock);
        if (remaining.isNegative() || remaining.isZero()) {
            throw timeout(ctx);
        }

        CompletableFuture<HttpResponse<String>> inFlight =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        try {
            return inFlight.get(Math.max(1, remaining.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            inFlight.cancel(true);
            Thread.currentThread().interrupt();
            throw cancelled(ctx);
        } catch (TimeoutException e) {
            inFlight.cancel(true);
            throw timeout(ctx);
        } catch (CancellationException e) {
            throw cancelled(ctx);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw timeout(ctx);
            }
            if (cause instanceof IOException) {
                throw new TransientFailure(0, null,
                        "Network error calling Databricks API %s: %s"
                                .formatted(ctx.describe(), cause.getClass().getSimpleName()),
                        Optional.empty(), cause);
            }
            throw new RemoteApiException(0, null,
                    "Unexpected failure calling Databricks API %s".formatted(ctx.describe()),
                    ctx.attemptCount(), cause);
        }
    }

    /** Waits {@code wait} unless that would cross the deadline; honours interrupts. */
    private void pause(RemoteRequestContext ctx, Duration wait) {
        if (Thread.currentThread().isInterrupted()) {
            throw cancelled(ctx);
        }
        if (wait.isNegative() || wait.isZero()) {
            return;
        }
        if (ctx.wouldExceedDeadline(clock, wait)) {
            throw new RemoteTimeoutException(
                    "Databricks API %s: next attempt in %d ms would exceed the %d ms call budget"
                            .formatted(ctx.describe(), wait.toMillis(), ctx.budget().toMillis()),
                    ctx.budget(), ctx.attemptCount());
        }
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(ctx);
        }
    }

    /** Backoff before the retry that follows attempt number {@code attempt} (1-based). */
    private Duration backoffFor(int attempt) {
        return Duration.ofMillis(backoff.apply(attempt));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(RemoteRequestContext ctx) {
        Duration remaining = ctx.remaining(clock);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(properties.baseUrl() + ctx.path() + encodeQuery(ctx.query())))
                .header("Authorization", "Bearer " + credentials.bearerToken())
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT)
                .timeout(remaining.isNegative() || remaining.isZero() ? Duration.ofMillis(1) : remaining);

        if (ctx.body() != null) {
            builder.header("Content-Type", "application/json")
                   .method(ctx.method().name(), HttpRequest.BodyPublishers.ofString(serialize(ctx.body())));
        } else {
            builder.method(ctx.method().name(), HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    private String encodeQuery(Map<String, Object> query) {
        if (query.isEmpty()) return "";
        StringJoiner joiner = new StringJoiner("&", "?", "");
        query.forEach((key, value) -> {
            if (value == null) return;
            if (value instanceof Collection<?> values) {
                values.forEach(v -> joiner.add(encode(key) + "=" + encode(queryValue(v))));
            } else {
                joiner.add(encode(key) + "=" + encode(queryValue(value)));
            }
        });
        return joiner.length() == 1 ? "" : joiner.toString();
    }

    private String queryValue(Object value) {
        if (value instanceof JsonNode node) {
            return node.isValueNode() ? node.asText() : node.toString();
        }
        if (value instanceof Map<?, ?>) {
            return serialize(value);
        }
        return String.valueOf(value);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private JsonNode parseBody(RemoteRequestContext ctx, String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SchemaException("$", "response of %s is not valid JSON".formatted(ctx.describe()));
        }
    }

    /** Databricks error bodies: {"error_code": "...", "message": "..."}; SCIM uses "detail". */
    private RemoteError parseError(String body) {
        if (body == null || body.isBlank()) {
            return new RemoteError(null, null);
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node != null && node.isObject()) {
                String code = textOrNull(node, "error_code");
                String message = textOrNull(node, "message");
                if (message == null) message = textOrNull(node, "error");
                if (message == null) message = textOrNull(node, "detail");
                return new RemoteError(code, message);
            }
        } catch (JsonProcessingException e) {
            log.trace("[DatabricksApi] Non-JSON error body: {}", e.getOriginalMessage());
        }
        String snippet = body.length() > ERROR_SNIPPET_MAX ? body.substring(0, ERROR_SNIPPET_MAX) + "..." : body;
        return new RemoteError(null, snippet.strip());
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static String describeFailure(RemoteRequestContext ctx, int status, RemoteError error) {
        StringBuilder sb = new StringBuilder("Databricks API returned HTTP ").append(status);
        if (error.code() != null) sb.append(" (").append(error.code()).append(')');
        sb.append(" for ").append(ctx.describe());
        if (error.message() != null && !error.message().isBlank()) sb.append(": ").append(error.message());
        return sb.toString();
    }

    private RemoteTimeoutException timeout(RemoteRequestContext ctx) {
        return new RemoteTimeoutException(
                "Databricks API %s timed out after %d ms (%d attempt(s))"
                        .formatted(ctx.describe(), ctx.budget().toMillis(), ctx.attemptCount()),
                ctx.budget(), ctx.attemptCount());
    }

    private static CancellationException cancelled(RemoteRequestContext ctx) {
        return new CancellationException("Databricks API %s was cancelled".formatted(ctx.describe()));
    }

    private JsonNode toJson(Object body) {
        if (body == null) return null;
        if (body instanceof JsonNode node) return node;
        return objectMapper.valueToTree(body);
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize request payload", e);
        }
    }

    private static Map<String, Object> copyQuery(Map<String, ?> query) {
        return query == null ? Map.of() : new LinkedHashMap<>(query);
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    // ── Internal types ───────────────────────────────────────────────────────

    private record RemoteError(String code, String message) {}

    /** A failed attempt that is eligible for retry. Never escapes {@link #call}. */
    private static final class TransientFailure extends RuntimeException {

        final int                status;
        final String             errorCode;
        final Optional<Duration> retryAfter;

        TransientFailure(int status, String errorCode, String message, Optional<Duration> retryAfter, Throwable cause) {
            super(message, cause, false, false);
            this.status     = status;
            this.errorCode  = errorCode;
            this.retryAfter = retryAfter;
        }

        RemoteApiException exhausted(int attempts) {
            return new RemoteApiException(status, errorCode,
                    "%s (gave up after %d attempts)".formatted(getMessage(), attempts),
                    attempts, getCause());
        }
    }
}
