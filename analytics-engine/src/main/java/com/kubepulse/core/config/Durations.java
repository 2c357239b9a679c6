package com.kubepulse.core.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the duration strings accepted in configuration files.
 *
 * <p>
 * Two notations are accepted:
 * </p>
 * <ul>
 * <li>ISO-8601, e.g. {@code PT1H}, {@code P30D}</li>
 * <li>compact unit notation, e.g. {@code 90s}, {@code 720h},
 * {@code 1h30m}, {@code 500ms}, {@code 7d}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class Durations {

    private static final Pattern COMPACT = Pattern.compile("(\\d+)(ms|s|m|h|d)");

    private Durations() {
        // utility class
    }

    /**
     * @param text duration text; must not be {@code null}
     * @return the parsed duration
     * @throws NullPointerException     if {@code text} is {@code null}
     * @throws IllegalArgumentException if the text is not a valid duration
     */
    public static Duration parse(String text) {
        Objects.requireNonNull(text, "Duration text must not be null");
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Duration text must not be blank");
        }

        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (upper.startsWith("P") || upper.startsWith("-P")) {
            try {
                return Duration.parse(upper);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid ISO-8601 duration: '" + text + "'", e);
            }
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        Matcher m = COMPACT.matcher(lower);
        Duration total = Duration.ZERO;
        int end = 0;
        while (m.find()) {
            if (m.start() != end) {
                break;
            }
            long amount = Long.parseLong(m.group(1));
            total = total.plus(switch (m.group(2)) {
                case "ms" -> Duration.ofMillis(amount);
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                default -> Duration.ofDays(amount);
            });
            end = m.end();
        }
        if (end == 0 || end != lower.length()) {
            throw new IllegalArgumentException(
                    "Invalid duration: '" + text + "'. Use ISO-8601 (PT1H) or units ms, s, m, h, d (e.g. 1h30m)");
        }
        return total;
    }
}
