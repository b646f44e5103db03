package com.newsdigest.backend.scraper.extract;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimestampNormalizerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T03:00:00Z");
    private static final ZoneOffset ICT = ZoneOffset.ofHours(7);

    private TimestampNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TimestampNormalizer(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void resolve_shouldParseRfc1123WithOffset() {
        Instant result = normalizer.resolve(DateCandidate.ofText("Wed, 01 May 2024 08:30:00 +0700"));

        assertThat(result).isEqualTo(Instant.parse("2024-05-01T01:30:00Z"));
    }

    @Test
    void resolve_shouldParseRfc822WithGmt() {
        assertThat(normalizer.resolve(DateCandidate.ofText("Wed, 1 May 2024 01:30:00 GMT")))
                .isEqualTo(Instant.parse("2024-05-01T01:30:00Z"));
    }

    @Test
    void resolve_shouldParseIsoOffsetDateTime() {
        assertThat(normalizer.resolve(DateCandidate.ofText("2024-05-01T08:30:00+07:00")))
                .isEqualTo(Instant.parse("2024-05-01T01:30:00Z"));
    }

    @Test
    void resolve_shouldApplyAssumedZone_whenTextHasNoZone() {
        assertThat(normalizer.resolve(DateCandidate.ofText("2024-05-01 08:30:00", ICT)))
                .isEqualTo(Instant.parse("2024-05-01T01:30:00Z"));
        assertThat(normalizer.resolve(DateCandidate.ofText("2024-05-01 08:30:00")))
                .isEqualTo(Instant.parse("2024-05-01T08:30:00Z"));
    }

    @Test
    void resolve_shouldParseVietnameseDateThenTime() {
        assertThat(normalizer.resolve(DateCandidate.ofText("01-05-2024 - 08:30", ICT)))
                .isEqualTo(Instant.parse("2024-05-01T01:30:00Z"));
        assertThat(normalizer.resolve(DateCandidate.ofText("Thứ tư, 01/05/2024 08:30", ICT)))
                .isEqualTo(Instant.parse("2024-05-01T01:30:00Z"));
        assertThat(normalizer.resolve(DateCandidate.ofText("01-05-2024 - 08:30 PM", ICT)))
                .isEqualTo(Instant.parse("2024-05-01T13:30:00Z"));
    }

    @Test
    void resolve_shouldParseVietnameseTimeThenDate() {
        assertThat(normalizer.resolve(DateCandidate.ofText("08:30 01/05/2024", ICT)))
                .isEqualTo(Instant.parse("2024-05-01T01:30:00Z"));
    }

    @Test
    void resolve_shouldPreferGmtMarkerOverAssumedZone() {
        assertThat(normalizer.resolve(DateCandidate.ofText("01/05/2024 08:30 GMT+9", ICT)))
                .isEqualTo(Instant.parse("2024-04-30T23:30:00Z"));
    }

    @Test
    void resolve_shouldPreferTextOverStructuredCandidate() {
        Date structured = Date.from(Instant.parse("2020-01-01T00:00:00Z"));

        Instant result = normalizer.resolve(List.of(
                DateCandidate.ofDate(structured),
                DateCandidate.ofText("2024-05-01T01:30:00Z")));

        assertThat(result).isEqualTo(Instant.parse("2024-05-01T01:30:00Z"));
    }

    @Test
    void resolve_shouldUseStructuredCandidate_whenTextUnparseable() {
        Instant structured = Instant.parse("2020-01-01T00:00:00Z");

        Instant result = normalizer.resolve(
                DateCandidate.ofText("not a date"),
                DateCandidate.ofInstant(structured));

        assertThat(result).isEqualTo(structured);
    }

    @Test
    void resolve_shouldFallBackToNow_whenNothingParses() {
        assertThat(normalizer.resolve(DateCandidate.ofText("soon"), DateCandidate.ofDate(null))).isEqualTo(NOW);
        assertThat(normalizer.resolve(List.of())).isEqualTo(NOW);
    }

    @Test
    void parseText_shouldRejectOutOfRangeDates() {
        assertThat(normalizer.parseText("45/13/2024 08:30", ICT)).isEmpty();
    }
}
