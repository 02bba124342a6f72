package com.daniel.podcast.podcasthub.media;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import org.springframework.util.StringUtils;

/*
 * Turns the raw publish-date text carried by an EpisodeEntry into an Instant.
 * Parsers are tried from most to least precise; the first one that accepts the text wins.
 * Text without a zone is read as UTC, and unparseable text falls back to "now".
 */
public final class PublishDateParser {

    private PublishDateParser() {
    }

    public static Instant parseOrNow(String rawValue, Clock clock) {
        return parse(rawValue).orElseGet(clock::instant);
    }

    public static Optional<Instant> parse(String rawValue) {
        if (!StringUtils.hasText(rawValue)) {
            return Optional.empty();
        }
        String value = rawValue.trim();

        Optional<Instant> offsetDateTime = parseOffsetDateTime(value);
        if (offsetDateTime.isPresent()) {
            return offsetDateTime;
        }

        Optional<Instant> localDateTime = parseLocalDateTime(value);
        if (localDateTime.isPresent()) {
            return localDateTime;
        }

        Optional<Instant> date = parseDate(value);
        if (date.isPresent()) {
            return date;
        }

        return parseRfc1123(value);
    }

    // 2024-03-01T08:00:00Z, 2024-03-01T08:00:00+08:00, 2024-03-01T08:00:00.000Z
    private static Optional<Instant> parseOffsetDateTime(String value) {
        try {
            return Optional.of(OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseLocalDateTime(String value) {
        try {
            return Optional.of(LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseDate(String value) {
        try {
            return Optional.of(LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    // RSS pubDate style: Mon, 04 Mar 2024 08:00:00 GMT
    private static Optional<Instant> parseRfc1123(String value) {
        try {
            return Optional.of(ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
