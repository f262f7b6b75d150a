package com.pizzaindex.domain;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Index aggregate for one bucket.
 *
 * @param granularity bucket width
 * @param bucketStart inclusive bucket start (UTC)
 * @param indexValue derived index, 100.0 when no valid samples
 * @param avgPopularity unrounded mean popularity, 0 when {@code sampleCount == 0}
 * @param sampleCount rows with a present popularity
 * @param dataPoints all rows in the bucket
 */
public record AggregateRecord(
    Granularity granularity,
    OffsetDateTime bucketStart,
    double indexValue,
    double avgPopularity,
    int sampleCount,
    int dataPoints
) {

    public AggregateRecord {
        Objects.requireNonNull(granularity, "Granularity cannot be null");
        Objects.requireNonNull(bucketStart, "Bucket start cannot be null");
        if (sampleCount < 0 || dataPoints < sampleCount) {
            throw new IllegalArgumentException(
                "Invalid counts: sampleCount=" + sampleCount + ", dataPoints=" + dataPoints
            );
        }
    }

    /** Returns true if at least one sample carried a popularity value. */
    public boolean hasData() {
        return sampleCount > 0;
    }
}
