package com.lunchmate.backend.common.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Day identities used by the store.
 * <ul>
 *   <li>menu days are keyed by the cook's local calendar date</li>
 *   <li>orders are keyed by 00:00 UTC of that same calendar date</li>
 * </ul>
 * The UTC key is a label, not the instant the meal is delivered.
 */
public final class DayKey {

    private DayKey() {}

    public static LocalDate normalizeLocalDate(LocalDateTime value) {
        if (value == null) throw new IllegalArgumentException("date is required");
        return value.toLocalDate();
    }

    public static LocalDate normalizeLocalDate(LocalDate value) {
        if (value == null) throw new IllegalArgumentException("date is required");
        return value;
    }

    public static Instant utcKey(LocalDate localDay) {
        return normalizeLocalDate(localDay).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public static LocalDate fromUtcKey(Instant utcKey) {
        return LocalDate.ofInstant(utcKey, ZoneOffset.UTC);
    }
}
