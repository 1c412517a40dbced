package com.tazrim.ledger.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every request with a trace id, echoed in {@value #TRACE_HEADER} and in each response body,
 * and logs one completion line with the status and the time spent.
 * A caller-supplied id is kept only when it is a short token; anything else is replaced so that
 * it cannot forge log lines.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TraceIdFilter.class);

    public static final String TRACE_HEADER = "X-Request-Trace";
    public static final String MDC_KEY = "trace_id";

    private static final Pattern ACCEPTED_TRACE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    private final Clock clock;

    public TraceIdFilter() {
        this(Clock.systemUTC());
    }

    TraceIdFilter(Clock clock) {
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        RequestContextHolder.RequestContext context = new RequestContextHolder.RequestContext(
                traceIdFor(request),
                request.getMethod(),
                request.getRequestURI(),
                clock.instant()
        );
        RequestContextHolder.set(context);
        MDC.put(MDC_KEY, context.traceId());
        response.setHeader(TRACE_HEADER, context.traceId());
        try {
            filterChain.doFilter(request, response);
        } finally {
            log.debug("{} {} -> {} in {} ms", context.method(), context.path(), response.getStatus(),
                    context.elapsed(clock.instant()).toMillis());
            MDC.remove(MDC_KEY);
            RequestContextHolder.clear();
        }
    }

    static String traceIdFor(HttpServletRequest request) {
        String supplied = request.getHeader(TRACE_HEADER);
        if (supplied != null && ACCEPTED_TRACE_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }
}
