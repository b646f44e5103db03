package com.newsdigest.backend.scraper.extract;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Date;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A publication time candidate: either raw text (with the zone to assume when the text has no
 * zone marker) or an instant some library already parsed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DateCandidate {

    String text;
    ZoneId assumedZone;
    Instant instant;

    public static DateCandidate ofText(String text) {
        return new DateCandidate(text, ZoneOffset.UTC, null);
    }

    public static DateCandidate ofText(String text, ZoneId assumedZone) {
        return new DateCandidate(text, assumedZone, null);
    }

    public static DateCandidate ofInstant(Instant instant) {
        return new DateCandidate(null, null, instant);
    }

    public static DateCandidate ofDate(Date date) {
        return ofInstant(date != null ? date.toInstant() : null);
    }

    public boolean isTextual() {
        return text != null && !text.isBlank();
    }
}
