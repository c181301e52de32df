package com.inventorytracker.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    @DisplayName("a safe caller id is reused, anything else is replaced by a UUID")
    void resolveRequestId() {
        assertThat(RequestIdFilter.resolveRequestId(" abc-123 ")).isEqualTo("abc-123");
        assertThat(UUID.fromString(RequestIdFilter.resolveRequestId(null))).isNotNull();
        assertThat(UUID.fromString(RequestIdFilter.resolveRequestId("bad id\r\nx"))).isNotNull();
        assertThat(UUID.fromString(RequestIdFilter.resolveRequestId("x".repeat(65)))).isNotNull();
    }

    @Test
    @DisplayName("the id is in the MDC during the request and removed afterwards")
    void populatesMdcForTheRequestOnly() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/items");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "req-1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                seen.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
            }
        });

        assertThat(seen.get()).isEqualTo("req-1");
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("req-1");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }
}
