package com.renewalsync.common;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;

/**
 * Encodes a billing date as an 8-digit {@code YYYYMMDD} integer (e.g. 20260315).
 * Always evaluated in UTC so the same instant yields the same cycle id on every host.
 */
public final class CycleIdCodec {

    private CycleIdCodec() {
    }

    public static long generateCycleId(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("Invalid date: null");
        }
        return date.getYear() * 10_000L + date.getMonthValue() * 100L + date.getDayOfMonth();
    }

    public static long generateCycleId(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("Invalid date: null");
        }
        return generateCycleId(instant.atOffset(ZoneOffset.UTC).toLocalDate());
    }

    /**
     * Accepts an ISO-8601 instant or offset date-time (converted to UTC), a local date-time
     * (taken as UTC) or a plain date.
     *
     * @throws IllegalArgumentException "Invalid date: ..." when the text cannot be parsed
     */
    public static long generateCycleId(String text) {
        return generateCycleId(parseUtcDate(text));
    }

    static LocalDate parseUtcDate(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Invalid date: " + text);
        }
        String value = text.trim();
        if (value.length() > 10 && value.charAt(10) == ' ') {
            value = value.substring(0, 10) + 'T' + value.substring(11);
        }
        try {
            if (value.indexOf('T') < 0) {
                return LocalDate.parse(value);
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) {
                return odt.atZoneSameInstant(ZoneOffset.UTC).toLocalDate();
            }
            return ((LocalDateTime) parsed).toLocalDate();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid date: " + text, e);
        }
    }
}
