package com.pizzaindex.util;

import com.pizzaindex.domain.ParsedTimestamp;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient parser for the near-ISO-8601 timestamps found in the popular-times table.
 *
 * Handles {@code Z} and numeric offsets ({@code +00:00}, {@code +0000}, {@code +00}),
 * missing offsets (read as UTC), a space in place of {@code T}, missing seconds and
 * fractions of any width (right-padded or truncated to microseconds).
 * Anything else is retried from its {@code yyyy-MM-ddTHH:mm:ss} prefix as UTC; if that
 * fails too, the current time is returned with {@code usedFallback} set.
 *
 * Thread-safe and stateless apart from the clock. Never throws and never logs;
 * callers decide what to do with fallbacks.
 */
public class TimestampNormalizer {

    private static final Pattern NEAR_ISO = Pattern.compile(
        "^(\\d{4}-\\d{2}-\\d{2})[T ](\\d{2}:\\d{2})(:\\d{2})?(?:[.,](\\d+))?\\s*(Z|z|[+-]\\d{2}(?::?\\d{2})?)?$"
    );

    private static final Pattern DATE_TIME_PREFIX = Pattern.compile(
        "^(\\d{4}-\\d{2}-\\d{2})[T ](\\d{2}:\\d{2}:\\d{2})"
    );

    private static final int FRACTION_DIGITS = 6;

    private final Clock clock;

    public TimestampNormalizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Parses {@code raw} into a UTC instant.
     *
     * @param raw timestamp text, may be null
     * @return parsed value, or "now" flagged as fallback
     */
    public ParsedTimestamp normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParsedTimestamp.fallback(now());
        }
        String trimmed = raw.trim();

        OffsetDateTime strict = parseNearIso(trimmed);
        if (strict != null) {
            return ParsedTimestamp.parsed(strict);
        }

        OffsetDateTime stripped = parseStrippedPrefix(trimmed);
        if (stripped != null) {
            return ParsedTimestamp.parsed(stripped);
        }

        return ParsedTimestamp.fallback(now());
    }

    private OffsetDateTime parseNearIso(String text) {
        Matcher matcher = NEAR_ISO.matcher(text);
        if (!matcher.matches()) {
            return null;
        }
        String seconds = matcher.group(3) != null ? matcher.group(3) : ":00";
        String canonical = matcher.group(1) + "T" + matcher.group(2) + seconds
            + "." + normalizeFraction(matcher.group(4))
            + normalizeOffset(matcher.group(5));
        try {
            return OffsetDateTime.parse(canonical, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                .withOffsetSameInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private OffsetDateTime parseStrippedPrefix(String text) {
        Matcher matcher = DATE_TIME_PREFIX.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        try {
            return LocalDateTime.parse(matcher.group(1) + "T" + matcher.group(2))
                .atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Pads or truncates to exactly six digits. */
    static String normalizeFraction(String fraction) {
        if (fraction == null || fraction.isEmpty()) {
            return "000000";
        }
        if (fraction.length() >= FRACTION_DIGITS) {
            return fraction.substring(0, FRACTION_DIGITS);
        }
        StringBuilder padded = new StringBuilder(fraction);
        while (padded.length() < FRACTION_DIGITS) {
            padded.append('0');
        }
        return padded.toString();
    }

    /** Maps Z, +HH, +HHMM and +HH:MM to the ISO form; a missing offset means UTC. */
    static String normalizeOffset(String offset) {
        if (offset == null || offset.equalsIgnoreCase("Z")) {
            return "Z";
        }
        String digits = offset.substring(1).replace(":", "");
        String minutes = digits.length() > 2 ? digits.substring(2) : "00";
        return offset.charAt(0) + digits.substring(0, 2) + ":" + minutes;
    }

    /** Formats as ISO-8601 at UTC, always with seconds, e.g. {@code 2024-01-01T14:00:00Z}. */
    public static String format(OffsetDateTime timestamp) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(timestamp.withOffsetSameInstant(ZoneOffset.UTC));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }
}
