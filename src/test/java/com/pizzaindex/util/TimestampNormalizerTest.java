package com.pizzaindex.util;

import com.pizzaindex.domain.ParsedTimestamp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TimestampNormalizer Tests")
class TimestampNormalizerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private TimestampNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TimestampNormalizer(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should parse Z suffix without fallback")
    void testZuluSuffix() {
        ParsedTimestamp result = normalizer.normalize("2024-01-01T10:00:00Z");

        assertThat(result.usedFallback()).isFalse();
        assertThat(result.value()).isEqualTo(OffsetDateTime.of(2024, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Short fraction with Z equals padded fraction with explicit offset")
    void testShortFractionEqualsPadded() {
        ParsedTimestamp shortForm = normalizer.normalize("2024-01-01T10:00:00.12345Z");
        ParsedTimestamp padded = normalizer.normalize("2024-01-01T10:00:00.123450+00:00");

        assertThat(shortForm.usedFallback()).isFalse();
        assertThat(padded.usedFallback()).isFalse();
        assertThat(shortForm.value()).isEqualTo(padded.value());
        assertThat(shortForm.value().getNano()).isEqualTo(123_450_000);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("acceptedFormats")
    @DisplayName("Should accept near-ISO variants")
    void testAcceptedFormats(String raw, OffsetDateTime expected) {
        ParsedTimestamp result = normalizer.normalize(raw);

        assertThat(result.usedFallback()).isFalse();
        assertThat(result.value()).isEqualTo(expected);
        assertThat(result.value().getOffset()).isEqualTo(ZoneOffset.UTC);
    }

    static Stream<Arguments> acceptedFormats() {
        OffsetDateTime tenAm = OffsetDateTime.of(2024, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC);
        return Stream.of(
            Arguments.of("2024-01-01T10:00:00", tenAm),
            Arguments.of("2024-01-01 10:00:00", tenAm),
            Arguments.of("2024-01-01T10:00", tenAm),
            Arguments.of("2024-01-01T10:00:00+00:00", tenAm),
            Arguments.of("2024-01-01T12:00:00+02:00", tenAm),
            Arguments.of("2024-01-01T12:00:00+0200", tenAm),
            Arguments.of("2024-01-01T12:00:00+02", tenAm),
            Arguments.of("2024-01-01T05:30:00-04:30", tenAm),
            Arguments.of("2024-01-01T10:00:00.123456789Z", tenAm.withNano(123_456_000)),
            Arguments.of("2024-01-01T10:00:00.5", tenAm.withNano(500_000_000)),
            Arguments.of("  2024-01-01T10:00:00Z  ", tenAm)
        );
    }

    @Test
    @DisplayName("Should retry from the date-time prefix when the suffix is unreadable")
    void testStrippedPrefix() {
        ParsedTimestamp result = normalizer.normalize("2024-01-01T10:00:00.000 UTC garbage");

        assertThat(result.usedFallback()).isFalse();
        assertThat(result.value()).isEqualTo(OffsetDateTime.of(2024, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC));
    }

    @ParameterizedTest(name = "\"{0}\"")
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "not a date", "2024-13-45T10:00:00Z", "10:00:00"})
    @DisplayName("Should fall back to the current time for unreadable input")
    void testFallback(String raw) {
        ParsedTimestamp result = normalizer.normalize(raw);

        assertThat(result.usedFallback()).isTrue();
        assertThat(result.value().toInstant()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should pad or truncate fractions to six digits")
    void testNormalizeFraction() {
        assertThat(TimestampNormalizer.normalizeFraction(null)).isEqualTo("000000");
        assertThat(TimestampNormalizer.normalizeFraction("12345")).isEqualTo("123450");
        assertThat(TimestampNormalizer.normalizeFraction("123456789")).isEqualTo("123456");
    }

    @Test
    @DisplayName("Should format at UTC")
    void testFormat() {
        OffsetDateTime local = OffsetDateTime.of(2024, 1, 1, 16, 0, 0, 0, ZoneOffset.ofHours(2));

        assertThat(TimestampNormalizer.format(local)).isEqualTo("2024-01-01T14:00:00Z");
    }
}
