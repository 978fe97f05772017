package com.brados.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with an id: taken from {@code X-Request-Id} when the client
 * sent a usable one, generated otherwise. The id is echoed back, put on the
 * request for the exception advice and into the MDC for log lines.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    private static final int MAX_LEN = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = sanitize(req.getHeader(HEADER));
        req.setAttribute(ATTR, rid);
        res.setHeader(HEADER, rid);
        MDC.put(MDC_KEY, rid);
        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    /** Id of the current request; a fresh one when the filter did not run (slice tests). */
    public static String current(HttpServletRequest req) {
        Object v = (req == null) ? null : req.getAttribute(ATTR);
        return (v == null) ? UUID.randomUUID().toString() : String.valueOf(v);
    }

    static String sanitize(String raw) {
        if (raw == null) return UUID.randomUUID().toString();
        String s = raw.trim();
        if (s.isEmpty()) return UUID.randomUUID().toString();
        return s.length() > MAX_LEN ? s.substring(0, MAX_LEN) : s;
    }
}
