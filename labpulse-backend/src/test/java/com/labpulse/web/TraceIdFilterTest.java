package com.labpulse.web;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    @DisplayName("Caller supplied id is echoed and visible in MDC during the request")
    void reusesCallerId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/status");
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seen.set(MDC.get(TraceIdFilter.MDC_TRACE_ID));
            }
        });

        assertThat(seen.get()).isEqualTo("abc-123");
        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isEqualTo("abc-123");
        assertThat(MDC.get(TraceIdFilter.MDC_TRACE_ID)).isNull();
    }

    @Test
    void generatesIdWhenHeaderMissingOrMalformed() {
        assertThat(TraceIdFilter.resolveTraceId(null)).hasSize(36);
        assertThat(TraceIdFilter.resolveTraceId("   ")).hasSize(36);
        assertThat(TraceIdFilter.resolveTraceId("bad id\nwith newline")).doesNotContain("\n").hasSize(36);
        assertThat(TraceIdFilter.resolveTraceId("x".repeat(65))).hasSize(36);
        assertThat(TraceIdFilter.resolveTraceId(" ok.id_1 ")).isEqualTo("ok.id_1");
    }
}
