package com.accessgate.backend.modules.auth.application;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses token lifetimes written as plain seconds ({@code 900}), a unit suffix ({@code 15m}, {@code 7d})
 * or in words ({@code 15 minutes}). Anything else, including zero, yields the fallback.
 */
public final class TokenExpiryParser {

    private static final Pattern SECONDS = Pattern.compile("^\\d+$");
    private static final Pattern SHORT_FORM = Pattern.compile("^(\\d+)([smhd])$");
    private static final Pattern LONG_FORM =
            Pattern.compile("^(\\d+)\\s+(second|minute|hour|day|week|month|year)s?$", Pattern.CASE_INSENSITIVE);

    private TokenExpiryParser() {
    }

    public static Duration parse(String value, Duration fallback) {
        Duration parsed = tryParse(value);
        return parsed == null ? fallback : parsed;
    }

    public static boolean isValid(String value) {
        return tryParse(value) != null;
    }

    private static Duration tryParse(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        try {
            Duration duration = null;
            if (SECONDS.matcher(trimmed).matches()) {
                duration = Duration.ofSeconds(Long.parseLong(trimmed));
            } else {
                Matcher shortForm = SHORT_FORM.matcher(trimmed);
                Matcher longForm = LONG_FORM.matcher(trimmed);
                if (shortForm.matches()) {
                    duration = ofUnit(Long.parseLong(shortForm.group(1)), shortForm.group(2));
                } else if (longForm.matches()) {
                    duration = ofUnit(Long.parseLong(longForm.group(1)), longForm.group(2).toLowerCase(Locale.ROOT));
                }
            }
            return duration == null || duration.isZero() ? null : duration;
        } catch (NumberFormatException | ArithmeticException ex) {
            return null;
        }
    }

    private static Duration ofUnit(long amount, String unit) {
        return switch (unit) {
            case "s", "second" -> Duration.ofSeconds(amount);
            case "m", "minute" -> Duration.ofMinutes(amount);
            case "h", "hour" -> Duration.ofHours(amount);
            case "d", "day" -> Duration.ofDays(amount);
            case "week" -> Duration.ofDays(Math.multiplyExact(amount, 7L));
            case "month" -> Duration.ofDays(Math.multiplyExact(amount, 30L));
            case "year" -> Duration.ofDays(Math.multiplyExact(amount, 365L));
            default -> null;
        };
    }
}
