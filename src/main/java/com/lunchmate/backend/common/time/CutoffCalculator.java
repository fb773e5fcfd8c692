package com.lunchmate.backend.common.time;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Last instant at which a customer may still change or cancel the order for a day:
 * the configured hour (08:00 by default) on that local date, in the given zone.
 */
@Component
public class CutoffCalculator {

    private final TimeZoneResolver timeZones;
    private final LocalTime cutoffTime;

    public CutoffCalculator(TimeZoneResolver timeZones,
                            @Value("${app.order.cutoff-hour:8}") int cutoffHour) {
        if (cutoffHour < 0 || cutoffHour > 23) {
            throw new IllegalArgumentException("app.order.cutoff-hour must be 0..23, got " + cutoffHour);
        }
        this.timeZones = timeZones;
        this.cutoffTime = LocalTime.of(cutoffHour, 0);
    }

    public Instant cancelUntil(LocalDate localDay, String timeZoneId) {
        return cancelUntil(localDay, timeZones.resolveZone(timeZoneId));
    }

    /** DST gaps shift forward, overlaps take the earlier offset (ZonedDateTime rules). */
    public Instant cancelUntil(LocalDate localDay, ZoneId zone) {
        return LocalDateTime.of(DayKey.normalizeLocalDate(localDay), cutoffTime)
                .atZone(zone)
                .toInstant();
    }

    public boolean isOpen(Instant cancelUntilUtc, Instant now) {
        return !now.isAfter(cancelUntilUtc);
    }
}
