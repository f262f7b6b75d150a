package com.pizzaindex.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pizzaindex.aggregation.IndexCalculator;
import com.pizzaindex.domain.AggregateRecord;
import com.pizzaindex.util.TimestampNormalizer;

import java.util.List;

/**
 * Bucketed index series. Buckets without any popularity value are left out;
 * {@code total_data_points} counts the raw rows read for the window.
 */
public record ChartDataResponse(
    @JsonProperty("chart_data") List<ChartPoint> chartData,
    @JsonProperty("period_days") int periodDays,
    String interval,
    @JsonProperty("total_data_points") int totalDataPoints
) {

    public record ChartPoint(
        String timestamp,
        double value,
        @JsonProperty("avg_popularity") double avgPopularity,
        @JsonProperty("data_points") int dataPoints,
        @JsonProperty("sample_count") int sampleCount
    ) {
        public static ChartPoint from(AggregateRecord record) {
            return new ChartPoint(
                TimestampNormalizer.format(record.bucketStart()),
                record.indexValue(),
                IndexCalculator.round1(record.avgPopularity()),
                record.dataPoints(),
                record.sampleCount()
            );
        }
    }
}
