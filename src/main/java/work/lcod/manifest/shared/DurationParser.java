package work.lcod.manifest.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses user-friendly durations used by the resolver configuration (e.g. {@code 500ms}, {@code 30s},
 * {@code 5m}, {@code 2h}, {@code 1d}). A bare number is read as milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        long multiplier = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        } else if (trimmed.endsWith("d")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 86_400_000L;
        }
        long value;
        try {
            value = Long.parseLong(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(value * multiplier));
    }

    public static Duration parseOrDefault(String raw, Duration fallback) {
        return parse(raw).orElse(fallback);
    }
}
