package com.pizzaindex.domain;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Result of lenient timestamp parsing.
 *
 * @param value parsed instant at UTC offset, or the substituted current time
 * @param usedFallback true if the raw value could not be read and {@code value} is "now"
 */
public record ParsedTimestamp(OffsetDateTime value, boolean usedFallback) {

    public ParsedTimestamp {
        Objects.requireNonNull(value, "Value cannot be null");
    }

    public static ParsedTimestamp parsed(OffsetDateTime value) {
        return new ParsedTimestamp(value, false);
    }

    public static ParsedTimestamp fallback(OffsetDateTime now) {
        return new ParsedTimestamp(now, true);
    }
}
