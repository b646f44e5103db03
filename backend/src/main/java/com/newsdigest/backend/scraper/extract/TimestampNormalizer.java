package com.newsdigest.backend.scraper.extract;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resolves the publication instant of an item from its candidates. Textual candidates win over
 * pre-parsed ones; when nothing parses the current time is used, so resolution never fails.
 */
@Slf4j
@Component
public class TimestampNormalizer {

    private static final List<DateTimeFormatter> ZONED_FORMATS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_ZONED_DATE_TIME,
            DateTimeFormatter.RFC_1123_DATE_TIME,
            DateTimeFormatter.ofPattern("[EEE, ]d MMM yyyy HH:mm[:ss] Z", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("[EEE, ]d MMM yyyy HH:mm[:ss] z", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm[:ss]Z"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]XXX")
    );

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm[:ss]")
    );

    // 01/05/2024 08:30, 19-10-2026 - 08:30 AM
    private static final Pattern DATE_THEN_TIME = Pattern.compile(
            "(\\d{1,2})[/-](\\d{1,2})[/-](\\d{4})\\D{0,6}?(\\d{1,2})[:h](\\d{2})(?::(\\d{2}))?(?:\\s*([AaPp][Mm])\\b)?");

    // 08:30 01/05/2024, 08:30, 01/05/2024
    private static final Pattern TIME_THEN_DATE = Pattern.compile(
            "(\\d{1,2}):(\\d{2})\\D{1,6}?(\\d{1,2})/(\\d{1,2})/(\\d{4})");

    private static final Pattern GMT_MARKER = Pattern.compile(
            "(?:GMT|UTC)\\s*([+-])\\s*(\\d{1,2})(?::?(\\d{2}))?", Pattern.CASE_INSENSITIVE);

    private final Clock clock;

    public TimestampNormalizer(Clock clock) {
        this.clock = clock;
    }

    public Instant resolve(DateCandidate... candidates) {
        return resolve(Arrays.asList(candidates));
    }

    /**
     * Resolve candidates in order: textual ones first, then structured ones, then now.
     */
    public Instant resolve(List<DateCandidate> candidates) {
        for (DateCandidate candidate : candidates) {
            if (candidate != null && candidate.isTextual()) {
                Optional<Instant> parsed = parseText(candidate.getText(), candidate.getAssumedZone());
                if (parsed.isPresent()) {
                    return parsed.get();
                }
                log.debug("Unparseable date text '{}'", candidate.getText());
            }
        }
        for (DateCandidate candidate : candidates) {
            if (candidate != null && candidate.getInstant() != null) {
                return candidate.getInstant();
            }
        }
        log.debug("No usable publication date, using current time");
        return clock.instant();
    }

    /**
     * Parse one textual date. {@code assumedZone} applies when the text carries no zone marker.
     */
    public Optional<Instant> parseText(String text, ZoneId assumedZone) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        ZoneId zone = assumedZone != null ? assumedZone : ZoneOffset.UTC;

        for (DateTimeFormatter format : ZONED_FORMATS) {
            try {
                return Optional.of(ZonedDateTime.parse(value, format).toInstant());
            } catch (DateTimeException ignored) {
                // try the next format
            }
        }
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(value, format).atZone(zone).toInstant());
            } catch (DateTimeException ignored) {
                // try the next format
            }
        }
        try {
            return Optional.of(LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(zone).toInstant());
        } catch (DateTimeException ignored) {
            // fall through to embedded forms
        }
        return parseEmbedded(value, markerZone(value).orElse(zone));
    }

    private Optional<Instant> parseEmbedded(String value, ZoneId zone) {
        try {
            Matcher dateFirst = DATE_THEN_TIME.matcher(value);
            if (dateFirst.find()) {
                int hour = Integer.parseInt(dateFirst.group(4));
                String meridiem = dateFirst.group(7);
                if (meridiem != null) {
                    hour = hour % 12 + (meridiem.equalsIgnoreCase("pm") ? 12 : 0);
                }
                int second = dateFirst.group(6) != null ? Integer.parseInt(dateFirst.group(6)) : 0;
                LocalDateTime local = LocalDateTime.of(
                        Integer.parseInt(dateFirst.group(3)),
                        Integer.parseInt(dateFirst.group(2)),
                        Integer.parseInt(dateFirst.group(1)),
                        hour,
                        Integer.parseInt(dateFirst.group(5)),
                        second);
                return Optional.of(local.atZone(zone).toInstant());
            }
            Matcher timeFirst = TIME_THEN_DATE.matcher(value);
            if (timeFirst.find()) {
                LocalDateTime local = LocalDateTime.of(
                        Integer.parseInt(timeFirst.group(5)),
                        Integer.parseInt(timeFirst.group(4)),
                        Integer.parseInt(timeFirst.group(3)),
                        Integer.parseInt(timeFirst.group(1)),
                        Integer.parseInt(timeFirst.group(2)));
                return Optional.of(local.atZone(zone).toInstant());
            }
        } catch (DateTimeException e) {
            log.debug("Out of range date in '{}': {}", value, e.getMessage());
        }
        return Optional.empty();
    }

    private static Optional<ZoneId> markerZone(String value) {
        Matcher marker = GMT_MARKER.matcher(value);
        if (!marker.find()) {
            return Optional.empty();
        }
        int hours = Integer.parseInt(marker.group(2));
        int minutes = marker.group(3) != null ? Integer.parseInt(marker.group(3)) : 0;
        int sign = "-".equals(marker.group(1)) ? -1 : 1;
        try {
            return Optional.of(ZoneOffset.ofHoursMinutes(sign * hours, sign * minutes));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
