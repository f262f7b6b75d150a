package com.pizzaindex.aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IndexCalculator Tests")
class IndexCalculatorTest {

    @ParameterizedTest(name = "avg {0} -> {1}")
    @CsvSource({
        "0, 100.0",
        "100, 180.0",
        "30, 124.0",
        "33.3333, 126.7",
        "57.5, 146.0"
    })
    @DisplayName("Should map average popularity onto the index scale")
    void testIndexValue(double avg, double expected) {
        assertThat(IndexCalculator.indexValue(avg)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Index is monotonic in average popularity")
    void testMonotonic() {
        double previous = IndexCalculator.indexValue(0);
        for (int avg = 1; avg <= 100; avg++) {
            double current = IndexCalculator.indexValue(avg);
            assertThat(current).isGreaterThanOrEqualTo(previous);
            previous = current;
        }
    }

    @Test
    @DisplayName("Should compute absolute and percent change")
    void testChange() {
        IndexCalculator.Change change = IndexCalculator.change(124.0, 120.0);

        assertThat(change.change()).isEqualTo(4.0);
        assertThat(change.changePercent()).isEqualTo(3.33);
    }

    @Test
    @DisplayName("Negative change keeps its sign")
    void testNegativeChange() {
        IndexCalculator.Change change = IndexCalculator.change(116.0, 132.0);

        assertThat(change.change()).isEqualTo(-16.0);
        assertThat(change.changePercent()).isEqualTo(-12.12);
    }

    @Test
    @DisplayName("Change is zero when the previous bucket had no valid samples")
    void testEmptyPreviousBucket() {
        IndexCalculator.Change change = IndexCalculator.change(140.0, 5, 100.0, 0);

        assertThat(change).isEqualTo(IndexCalculator.Change.NONE);
        assertThat(change.change()).isZero();
        assertThat(change.changePercent()).isZero();
    }

    @Test
    @DisplayName("Change is zero when the current bucket had no valid samples")
    void testEmptyCurrentBucket() {
        assertThat(IndexCalculator.change(100.0, 0, 140.0, 4)).isEqualTo(IndexCalculator.Change.NONE);
    }

    @Test
    @DisplayName("Percent change is zero for a non-positive previous value")
    void testZeroPrevious() {
        IndexCalculator.Change change = IndexCalculator.change(10.0, 0.0);

        assertThat(change.change()).isEqualTo(10.0);
        assertThat(change.changePercent()).isZero();
    }
}
