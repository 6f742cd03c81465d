package com.openforge.dbxmcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * State of one outbound remote call across its retry iterations.
 *
 * Created by {@link DatabricksApiClient#call}, mutated only by that call's retry
 * loop, discarded once the call resolves. Not shared between threads.
 */
public final class RemoteRequestContext {

    private final HttpMethod          method;
    private final String              path;
    private final Map<String, Object> query;
    private final JsonNode            body;
    private final Instant             startedAt;
    private final Duration            budget;
    private final Instant             deadline;

    private int attemptCount;
    private int lastStatus;

    RemoteRequestContext(HttpMethod method,
                         String path,
                         Map<String, Object> query,
                         JsonNode body,
                         Instant startedAt,
                         Duration budget) {
        this.method    = method;
        this.path      = path;
        this.query     = query == null ? Map.of() : query;
        this.body      = body;
        this.startedAt = startedAt;
        this.budget    = budget;
        this.deadline  = startedAt.plus(budget);
    }

    void beginAttempt() {
        attemptCount++;
    }

    void recordStatus(int status) {
        this.lastStatus = status;
    }

    /** Budget left at {@code clock.instant()}; negative once the deadline has passed. */
    Duration remaining(Clock clock) {
        return Duration.between(clock.instant(), deadline);
    }

    boolean wouldExceedDeadline(Clock clock, Duration wait) {
        return wait.compareTo(remaining(clock)) > 0;
    }

    public HttpMethod method()              { return method; }
    public String path()                    { return path; }
    public Map<String, Object> query()      { return query; }
    public JsonNode body()                  { return body; }
    public Instant startedAt()              { return startedAt; }
    public Duration budget()                { return budget; }
    public int attemptCount()               { return attemptCount; }
    public int lastStatus()                 { return lastStatus; }

    /** "GET /api/2.0/clusters/list", safe to log: no query values, no body. */
    public String describe() {
        return method.name() + " " + path;
    }
}
