package com.daniel.podcast.podcasthub.media;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Duration strings arrive in three shapes depending on the source:
 * - ISO-8601 style tokens from page structured data (PT40M43S, PT1H2M3S)
 * - clock strings from feeds (40:43, 1:23:35)
 * - bare second counts (2443)
 * Everything else, including null/blank, becomes 0 seconds.
 */
public final class DurationNormalizer {

    private static final Pattern HOURS = Pattern.compile("(\\d+)H");
    private static final Pattern MINUTES = Pattern.compile("(\\d+)M");
    private static final Pattern SECONDS = Pattern.compile("(\\d+)S");

    private DurationNormalizer() {
    }

    public static int parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        String value = raw.trim();
        try {
            if (value.toUpperCase(Locale.ROOT).startsWith("PT")) {
                return parseIsoTokens(value.toUpperCase(Locale.ROOT));
            }
            return Math.max(parseClock(value), 0);
        } catch (NumberFormatException | ArithmeticException ex) {
            return 0;
        }
    }

    // Display form for episode listings: H:MM:SS past one hour, M:SS below, 00:00 when unknown.
    public static String format(int totalSeconds) {
        if (totalSeconds <= 0) {
            return "00:00";
        }
        int minutes = totalSeconds / 60;
        int seconds = totalSeconds % 60;
        if (minutes >= 60) {
            int hours = minutes / 60;
            return String.format(Locale.ROOT, "%d:%02d:%02d", hours, minutes % 60, seconds);
        }
        return String.format(Locale.ROOT, "%d:%02d", minutes, seconds);
    }

    // Designators are read in H, M, S order no matter where they sit in the token.
    private static int parseIsoTokens(String value) {
        long total = tokenValue(HOURS, value) * 3600
                + tokenValue(MINUTES, value) * 60
                + tokenValue(SECONDS, value);
        return Math.toIntExact(total);
    }

    private static long tokenValue(Pattern pattern, String value) {
        Matcher matcher = pattern.matcher(value);
        if (!matcher.find()) {
            return 0;
        }
        return Long.parseLong(matcher.group(1));
    }

    private static int parseClock(String value) {
        String[] parts = value.split(":");
        if (parts.length == 3) {
            return Math.toIntExact(Long.parseLong(parts[0].trim()) * 3600
                    + Long.parseLong(parts[1].trim()) * 60
                    + Long.parseLong(parts[2].trim()));
        }
        if (parts.length == 2) {
            return Math.toIntExact(Long.parseLong(parts[0].trim()) * 60
                    + Long.parseLong(parts[1].trim()));
        }
        return Integer.parseInt(value);
    }
}
