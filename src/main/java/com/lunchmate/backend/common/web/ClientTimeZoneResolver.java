package com.lunchmate.backend.common.web;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Picks the client's time zone id from the request headers, falling back to app.order.default-time-zone.
 * Only the raw id is returned; validation happens in TimeZoneResolver.
 */
@Component
public class ClientTimeZoneResolver {

    private static final String[] HEADERS = {"X-Client-Timezone", "X-Client-TZ", "Time-Zone"};

    private final String defaultTimeZone;

    public ClientTimeZoneResolver(@Value("${app.order.default-time-zone:UTC}") String defaultTimeZone) {
        this.defaultTimeZone = defaultTimeZone;
    }

    public String resolve(HttpServletRequest req, String explicit) {
        if (explicit != null && !explicit.isBlank()) return explicit.trim();
        if (req != null) {
            for (String h : HEADERS) {
                String v = req.getHeader(h);
                if (v != null && !v.isBlank()) return v.trim();
            }
        }
        return defaultTimeZone;
    }
}
