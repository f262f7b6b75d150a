package com.pizzaindex.domain;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Bucket widths for popularity aggregation.
 * A bucket start is the instant with every field finer than the granularity zeroed.
 */
public enum Granularity {

    MINUTE("minute", ChronoUnit.MINUTES),
    HOUR("hour", ChronoUnit.HOURS),
    DAY("day", ChronoUnit.DAYS);

    private final String tag;
    private final ChronoUnit unit;

    Granularity(String tag, ChronoUnit unit) {
        this.tag = tag;
        this.unit = unit;
    }

    /** Returns the wire tag: "minute", "hour" or "day". */
    public String tag() {
        return tag;
    }

    /**
     * Truncates to the bucket start. The offset of {@code timestamp} is kept,
     * so callers pass UTC values to get UTC-aligned day buckets.
     */
    public OffsetDateTime bucketStart(OffsetDateTime timestamp) {
        return timestamp.truncatedTo(unit);
    }

    /** Returns exclusive bucket end: bucketStart + one unit. */
    public OffsetDateTime bucketEnd(OffsetDateTime bucketStart) {
        return bucketStart.plus(1, unit);
    }

    /** Start of the bucket immediately preceding the one containing {@code timestamp}. */
    public OffsetDateTime previousBucketStart(OffsetDateTime timestamp) {
        return bucketStart(timestamp).minus(1, unit);
    }

    /**
     * Parses a wire tag, case-insensitively.
     *
     * @throws IllegalArgumentException for null or unknown tags
     */
    public static Granularity fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (Granularity granularity : values()) {
                if (granularity.tag.equals(normalized)) {
                    return granularity;
                }
            }
        }
        throw new IllegalArgumentException(
            String.format("Unsupported interval '%s'. Allowed: %s", tag, allowedTags())
        );
    }

    static String allowedTags() {
        return Arrays.stream(values()).map(Granularity::tag).collect(Collectors.joining(", "));
    }
}
