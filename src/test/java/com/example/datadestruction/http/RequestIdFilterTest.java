package com.example.datadestruction.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void keepsWellFormedCallerId() {
        assertEquals("caller-123", RequestIdFilter.resolveRequestId("caller-123"));
    }

    @Test
    void replacesMissingOrUnsafeIds() {
        String generated = RequestIdFilter.resolveRequestId(null);
        UUID.fromString(generated);

        assertNotEquals("bad id\nINFO forged", RequestIdFilter.resolveRequestId("bad id\nINFO forged"));
        assertNotEquals("", RequestIdFilter.resolveRequestId(""));
        assertNotEquals("x".repeat(129), RequestIdFilter.resolveRequestId("x".repeat(129)));
    }

    @Test
    void exposesIdToChainAndClearsMdcAfterwards() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/run_bq_data_destruction");
        request.addHeader(RequestIdFilter.HEADER, "job-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        String[] seen = new String[1];

        filter.doFilter(request, response, (req, res) -> seen[0] = MDC.get(RequestIdFilter.MDC_KEY));

        assertEquals("job-42", seen[0]);
        assertEquals("job-42", response.getHeader(RequestIdFilter.HEADER));
        assertNull(MDC.get(RequestIdFilter.MDC_KEY));
    }
}
