package com.pizzaindex.domain;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * A raw row paired with its normalized observation time.
 */
public record TimedSample(OffsetDateTime at, Sample sample) {

    public TimedSample {
        Objects.requireNonNull(at, "Timestamp cannot be null");
        Objects.requireNonNull(sample, "Sample cannot be null");
    }

    public Integer popularity() {
        return sample.getCurrentPopularity();
    }

    public boolean hasPopularity() {
        return sample.hasPopularity();
    }
}
