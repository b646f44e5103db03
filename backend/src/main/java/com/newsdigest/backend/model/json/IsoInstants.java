package com.newsdigest.backend.model.json;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Formats instants the way partition files store them: {@code 2024-05-01T01:30:00+00:00},
 * with a six digit fraction only when the instant has sub-second precision.
 */
public final class IsoInstants {

    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");
    private static final DateTimeFormatter MICROS = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS");
    private static final String UTC_SUFFIX = "+00:00";

    private IsoInstants() {
    }

    public static String format(Instant instant) {
        LocalDateTime utc = LocalDateTime.ofInstant(instant.truncatedTo(ChronoUnit.MICROS), ZoneOffset.UTC);
        DateTimeFormatter formatter = utc.getNano() == 0 ? SECONDS : MICROS;
        return formatter.format(utc) + UTC_SUFFIX;
    }

    /**
     * Parses an ISO-8601 date-time. Values without an offset are taken as UTC.
     */
    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeException ignored) {
            // fall through to the offset-less form
        }
        try {
            return Optional.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
