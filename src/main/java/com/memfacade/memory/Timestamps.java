package com.memfacade.memory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * Lenient timestamp parsing for store-reported values. Anything unparseable maps to
 * {@link #EARLIEST}, which sorts before every real cutoff.
 */
public final class Timestamps {

    public static final Instant EARLIEST = Instant.MIN;

    private Timestamps() {}

    public static Instant parse(Object value) {
        if (value == null) return EARLIEST;
        if (value instanceof Instant) return (Instant) value;
        if (value instanceof OffsetDateTime) return ((OffsetDateTime) value).toInstant();
        if (value instanceof ZonedDateTime) return ((ZonedDateTime) value).toInstant();
        if (value instanceof LocalDateTime) return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        if (value instanceof Date) return ((Date) value).toInstant();
        return parseText(value.toString().trim());
    }

    public static boolean isKnown(Instant instant) {
        return instant != null && !EARLIEST.equals(instant);
    }

    public static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    private static Instant parseText(String text) {
        if (text.isEmpty()) return EARLIEST;
        // "2024-05-01 10:00:00" is common in SQL-backed stores
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to the zone-less forms
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return EARLIEST;
        }
    }
}
