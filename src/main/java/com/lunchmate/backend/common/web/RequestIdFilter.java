package com.lunchmate.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Runs before the security chain, so 401/403 bodies written by the filters carry the id too.
 * A client X-Request-Id is kept only when it is a short token of [A-Za-z0-9._-]; anything else
 * (log injection, oversized values) is replaced by a UUID.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = accept(req.getHeader(HEADER));
        req.setAttribute(ATTR, rid);
        MDC.put(MDC_KEY, rid);
        res.setHeader(HEADER, rid);

        long started = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            if (log.isDebugEnabled()) {
                log.debug("{} {} -> {} ({} ms)", req.getMethod(), req.getRequestURI(), res.getStatus(),
                        (System.nanoTime() - started) / 1_000_000);
            }
            MDC.remove(MDC_KEY);
        }
    }

    static String accept(String clientId) {
        if (clientId != null) {
            String trimmed = clientId.trim();
            if (SAFE_ID.matcher(trimmed).matches()) return trimmed;
        }
        return UUID.randomUUID().toString();
    }

    /** Id of the current request; falls back to the MDC for code running outside a servlet request. */
    public static String current(HttpServletRequest req) {
        if (req == null) return MDC.get(MDC_KEY);
        Object v = req.getAttribute(ATTR);
        return (v == null) ? MDC.get(MDC_KEY) : String.valueOf(v);
    }
}
