package com.lunchmate.backend.common.time;

import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * IANA id (or a JDK short id such as "EST") to {@link ZoneId}. Anything unknown resolves to UTC;
 * callers decide whether the fallback is worth a WARN. Windows ids ("Central America Standard Time")
 * are not mapped and take the UTC fallback as well.
 */
@Component
public class TimeZoneResolver {

    public record Resolution(ZoneId zone, boolean fellBack, String requested) {}

    public Resolution resolve(String timeZoneId) {
        if (timeZoneId == null || timeZoneId.isBlank()) {
            return new Resolution(ZoneOffset.UTC, true, timeZoneId);
        }
        try {
            return new Resolution(ZoneId.of(timeZoneId.trim(), ZoneId.SHORT_IDS), false, timeZoneId);
        } catch (DateTimeException ex) {
            return new Resolution(ZoneOffset.UTC, true, timeZoneId);
        }
    }

    public ZoneId resolveZone(String timeZoneId) {
        return resolve(timeZoneId).zone();
    }
}
