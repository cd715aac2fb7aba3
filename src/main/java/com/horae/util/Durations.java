package com.horae.util;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-friendly duration text used by the environment and the CLI.
 * 
 * Accepted forms:
 *   - plain milliseconds: "250"
 *   - number with unit: "250ms", "2s", "5m", "1h", "1d"
 *   - ISO-8601: "PT0.5S"
 */
public final class Durations {

    private static final Pattern WITH_UNIT = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d)");

    private Durations() {
    }

    /**
     * @param text duration text
     * @return the parsed duration
     * @throws IllegalArgumentException if the text is not a valid duration
     */
    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("duration cannot be empty");
        }
        String value = text.trim().toLowerCase(Locale.ROOT);

        if (value.chars().allMatch(Character::isDigit)) {
            return Duration.ofMillis(Long.parseLong(value));
        }

        Matcher matcher = WITH_UNIT.matcher(value);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            switch (matcher.group(2)) {
                case "ms":
                    return Duration.ofMillis(amount);
                case "s":
                    return Duration.ofSeconds(amount);
                case "m":
                    return Duration.ofMinutes(amount);
                case "h":
                    return Duration.ofHours(amount);
                default:
                    return Duration.ofDays(amount);
            }
        }

        try {
            return Duration.parse(text.trim().toUpperCase(Locale.ROOT));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid duration: " + text, e);
        }
    }

    /**
     * Short form used in logs, e.g. "1500ms" or "2m".
     */
    public static String format(Duration duration) {
        if (duration == null) {
            return "-";
        }
        long millis = duration.toMillis();
        if (millis % 3_600_000 == 0 && millis != 0) {
            return (millis / 3_600_000) + "h";
        }
        if (millis % 60_000 == 0 && millis != 0) {
            return (millis / 60_000) + "m";
        }
        return millis + "ms";
    }
}
