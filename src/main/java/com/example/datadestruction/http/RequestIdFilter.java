package com.example.datadestruction.http;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every request with an id: the caller's {@code X-Request-Id} when it is usable, otherwise a
 * fresh UUID. The id is echoed in the response and kept in the MDC so destruction log lines can
 * be traced back to the call that caused them.
 */
@Component
@Slf4j
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_KEY = "requestId";

    // Ids end up in log lines; anything else is replaced.
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        String requestId = resolveRequestId(req.getHeader(HEADER));
        MDC.put(MDC_KEY, requestId);
        res.setHeader(HEADER, requestId);
        try {
            log.debug("{} {}", req.getMethod(), req.getRequestURI());
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    static String resolveRequestId(String supplied) {
        if (supplied != null && ACCEPTED_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }
}
