package com.mk.fx.qa.loadgen.utils;

import java.time.Duration;

public final class LoadUtils {

    private LoadUtils() {
        // Utility class, no instantiation
    }

    public static Duration toDuration(Duration duration) {
        return duration != null ? duration : Duration.ZERO;
    }

    /**
     * Parses a short duration such as {@code 250ms}, {@code 10s}, {@code 2m} or {@code 1h}. A bare
     * number is read as seconds.
     *
     * @throws IllegalArgumentException if the value cannot be parsed
     */
    public static Duration parseDuration(String value) {
        if (value == null || value.isBlank()) {
            return Duration.ZERO;
        }
        String trimmed = value.trim().toLowerCase();
        try {
            if (trimmed.endsWith("ms")) {
                long ms = Long.parseLong(trimmed.substring(0, trimmed.length() - 2));
                return Duration.ofMillis(ms);
            }
            char unit = trimmed.charAt(trimmed.length() - 1);
            if (Character.isDigit(unit)) {
                return Duration.ofSeconds(Long.parseLong(trimmed));
            }
            long amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1));
            return switch (unit) {
                case 's' -> Duration.ofSeconds(amount);
                case 'm' -> Duration.ofMinutes(amount);
                case 'h' -> Duration.ofHours(amount);
                default -> throw new IllegalArgumentException("Unrecognised duration unit in " + value);
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration: " + value, e);
        }
    }
}
