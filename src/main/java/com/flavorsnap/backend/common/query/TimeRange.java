package com.flavorsnap.backend.common.query;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Inclusive timestamp window built from raw ISO-8601 strings.
 * A bound that cannot be parsed is treated as absent.
 */
public record TimeRange(String from, String to) {

    public boolean contains(Instant value) {
        if (value == null) return false;
        Instant lo = parseOrNull(from);
        Instant hi = parseOrNull(to);
        if (lo != null && value.isBefore(lo)) return false;
        return hi == null || !value.isAfter(hi);
    }

    /**
     * Accepts {@code 2026-01-15T12:00:00Z}, {@code 2026-01-15T12:00:00+08:00},
     * {@code 2026-01-15T12:00:00} (UTC) and {@code 2026-01-15} (start of day UTC).
     */
    public static Instant parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim();
        try {
            return Instant.parse(v);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return OffsetDateTime.parse(v).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDateTime.parse(v).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDate.parse(v).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
