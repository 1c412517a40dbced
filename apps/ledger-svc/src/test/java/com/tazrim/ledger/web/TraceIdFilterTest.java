package com.tazrim.ledger.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class TraceIdFilterTest {

    private static final Instant RECEIVED = Instant.parse("2024-03-01T10:15:30Z");

    private final TraceIdFilter filter = new TraceIdFilter(Clock.fixed(RECEIVED, ZoneOffset.UTC));

    @Test
    void exposesRequestContextWhileTheChainRuns() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/imports");
        request.addHeader(TraceIdFilter.TRACE_HEADER, "trace-abc.1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        List<RequestContextHolder.RequestContext> seen = new ArrayList<>();
        List<String> mdc = new ArrayList<>();

        filter.doFilter(request, response, (req, res) -> {
            seen.add(RequestContextHolder.get().orElseThrow());
            mdc.add(MDC.get(TraceIdFilter.MDC_KEY));
        });

        assertThat(seen).singleElement().satisfies(context -> {
            assertThat(context.traceId()).isEqualTo("trace-abc.1");
            assertThat(context.method()).isEqualTo("POST");
            assertThat(context.path()).isEqualTo("/imports");
            assertThat(context.receivedAt()).isEqualTo(RECEIVED);
            assertThat(context.elapsed(RECEIVED.plusMillis(250))).isEqualTo(Duration.ofMillis(250));
        });
        assertThat(mdc).containsExactly("trace-abc.1");
        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isEqualTo("trace-abc.1");
        assertThat(RequestContextHolder.get()).isEmpty();
        assertThat(MDC.get(TraceIdFilter.MDC_KEY)).isNull();
    }

    @Test
    void replacesMissingOrUnsafeTraceIds() throws Exception {
        MockHttpServletResponse plain = new MockHttpServletResponse();
        filter.doFilter(new MockHttpServletRequest("GET", "/imports"), plain, (req, res) -> { });
        assertThat(UUID.fromString(plain.getHeader(TraceIdFilter.TRACE_HEADER))).isNotNull();

        MockHttpServletRequest forged = new MockHttpServletRequest("GET", "/imports");
        forged.addHeader(TraceIdFilter.TRACE_HEADER, "abc\n ERROR fake entry");
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(forged, response, (req, res) -> { });
        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).doesNotContain("fake");

        MockHttpServletRequest oversized = new MockHttpServletRequest("GET", "/imports");
        oversized.addHeader(TraceIdFilter.TRACE_HEADER, "x".repeat(65));
        assertThat(TraceIdFilter.traceIdFor(oversized)).hasSize(36);
    }

    @Test
    void clearsContextWhenTheChainFails() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/imports");

        assertThatThrownBy(() -> filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> {
            throw new IllegalStateException("boom");
        }))
                .isInstanceOf(IllegalStateException.class);

        assertThat(RequestContextHolder.get()).isEmpty();
        assertThat(MDC.get(TraceIdFilter.MDC_KEY)).isNull();
    }
}
