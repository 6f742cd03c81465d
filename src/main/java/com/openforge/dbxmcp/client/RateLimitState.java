package com.openforge.dbxmcp.client;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide memory of the last "Retry-After" hint seen per endpoint class.
 *
 * Endpoint class = the resource segment of an API path:
 *   /api/2.0/clusters/list             → clusters
 *   /api/2.1/unity-catalog/tables/x.y  → unity-catalog
 *
 * Best-effort cache: updates are atomic per key (ConcurrentMap.merge), a racing
 * reader may see a slightly stale hint, and losing the whole map is harmless.
 */
@Slf4j
public class RateLimitState {

    private static final String DEFAULT_CLASS = "default";

    /** Upper bound for any hint; larger values are clamped to it. */
    static final Duration MAX_HINT = Duration.ofHours(1);

    private final ConcurrentMap<String, Instant> notBefore = new ConcurrentHashMap<>();
    private final Clock clock;

    public RateLimitState(Clock clock) {
        this.clock = clock;
    }

    /** Remember that {@code endpointClass} asked us to hold off for {@code retryAfter}. */
    public void recordHint(String endpointClass, Duration retryAfter) {
        Instant until = clock.instant().plus(clamp(retryAfter));
        notBefore.merge(endpointClass, until, (current, proposed) -> current.isAfter(proposed) ? current : proposed);
        log.debug("[RateLimit] {} throttled until {}", endpointClass, until);
    }

    /** Time still to wait before calling {@code endpointClass}; zero when no hint is pending. */
    public Duration remainingDelay(String endpointClass) {
        Instant until = notBefore.get(endpointClass);
        if (until == null) return Duration.ZERO;

        Duration remaining = Duration.between(clock.instant(), until);
        if (remaining.isNegative() || remaining.isZero()) {
            notBefore.remove(endpointClass, until);
            return Duration.ZERO;
        }
        return remaining;
    }

    // ── Static helpers ───────────────────────────────────────────────────────

    static Duration clamp(Duration hint) {
        return hint.compareTo(MAX_HINT) > 0 ? MAX_HINT : hint;
    }

    public static String endpointClass(String path) {
        if (path == null) return DEFAULT_CLASS;
        String[] segments = path.split("/");
        // ["", "api", "2.0", "clusters", "list"]
        int i = 0;
        while (i < segments.length && segments[i].isEmpty()) i++;
        if (i < segments.length && "api".equals(segments[i])) i++;
        if (i < segments.length && segments[i].matches("\\d+(\\.\\d+)*")) i++;
        return i < segments.length && !segments[i].isEmpty() ? segments[i] : DEFAULT_CLASS;
    }

    /**
     * Parses an RFC 9110 Retry-After value: either delta-seconds ("120") or an
     * HTTP-date ("Wed, 21 Oct 2015 07:28:00 GMT"). Dates in the past yield zero;
     * values beyond {@link #MAX_HINT} are clamped to it.
     */
    public static Optional<Duration> parseRetryAfter(String value, Clock clock) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.strip();
        if (v.matches("\\d+")) {
            return Optional.of(v.length() > 9 ? MAX_HINT : clamp(Duration.ofSeconds(Long.parseLong(v))));
        }
        if (v.startsWith("-") && v.substring(1).matches("\\d+")) {
            return Optional.empty();
        }
        try {
            Instant at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration d = Duration.between(clock.instant(), at);
            return Optional.of(d.isNegative() ? Duration.ZERO : clamp(d));
        } catch (DateTimeParseException notDate) {
            log.debug("[RateLimit] Ignoring unparseable Retry-After '{}'", v);
            return Optional.empty();
        }
    }
}
