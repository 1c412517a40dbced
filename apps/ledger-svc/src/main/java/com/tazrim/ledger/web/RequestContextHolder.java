package com.tazrim.ledger.web;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-thread view of the HTTP request being served. Filled by {@link TraceIdFilter}; empty outside
 * a request (scheduled work, tests calling services directly).
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> traceId() {
        return get().map(RequestContext::traceId);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    public record RequestContext(String traceId, String method, String path, Instant receivedAt) {

        public Duration elapsed(Instant now) {
            return Duration.between(receivedAt, now);
        }
    }
}
