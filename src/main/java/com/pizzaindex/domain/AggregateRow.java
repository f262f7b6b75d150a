package com.pizzaindex.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Wire form of an aggregate upserted into the {@code pizza_index_aggregates} table.
 * The table is keyed on (interval, timestamp).
 */
public record AggregateRow(
    @JsonProperty("interval") String interval,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("value") double value,
    @JsonProperty("avg_popularity") double avgPopularity,
    @JsonProperty("data_points") int dataPoints
) {

    static final DateTimeFormatter BUCKET_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'");

    /** Builds the row for a record; {@code data_points} carries the valid-sample count. */
    public static AggregateRow from(AggregateRecord record) {
        return new AggregateRow(
            record.granularity().tag(),
            BUCKET_FORMAT.format(record.bucketStart().withOffsetSameInstant(ZoneOffset.UTC)),
            record.indexValue(),
            Math.round(record.avgPopularity() * 10.0) / 10.0,
            record.sampleCount()
        );
    }
}
