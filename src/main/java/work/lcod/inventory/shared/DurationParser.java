package work.lcod.inventory.shared;

import java.time.Duration;
import java.util.Locale;

/**
 * Parses user-friendly timeouts such as {@code 1500ms}, {@code 30s}, {@code 2m} or {@code 1h}.
 * A bare number is read as milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Duration parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("duration is empty");
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        long multiplier = 1L;
        String digits = trimmed;
        if (trimmed.endsWith("ms")) {
            digits = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        long value;
        try {
            value = Long.parseLong(digits.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration '" + raw + "' (expected e.g. 1500ms, 30s, 2m, 1h)", ex);
        }
        if (value <= 0) {
            throw new IllegalArgumentException("Duration must be positive: " + raw);
        }
        try {
            return Duration.ofMillis(Math.multiplyExact(value, multiplier));
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Duration is too large: " + raw, ex);
        }
    }
}
