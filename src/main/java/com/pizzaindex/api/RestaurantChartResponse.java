package com.pizzaindex.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per-bucket summary of one restaurant. Buckets whose rows all lack a popularity
 * value are reported with {@code has_data=false} instead of being dropped.
 */
public record RestaurantChartResponse(
    @JsonProperty("restaurant_id") String restaurantId,
    @JsonProperty("restaurant_name") String restaurantName,
    @JsonProperty("period_days") int periodDays,
    String interval,
    @JsonProperty("chart_data") List<BucketSummary> chartData,
    @JsonProperty("total_data_points") int totalDataPoints
) {

    public static final String NO_DATA = "No data";

    /**
     * @param currentPopularity latest popularity in the bucket
     * @param value index of the bucket average, null without data
     */
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record BucketSummary(
        String timestamp,
        @JsonProperty("has_data") boolean hasData,
        @JsonProperty("current_popularity") Integer currentPopularity,
        @JsonProperty("avg_popularity") Double avgPopularity,
        Double value,
        Double rating,
        @JsonProperty("latest_timestamp") String latestTimestamp,
        @JsonProperty("data_points") int dataPoints,
        @JsonProperty("sample_count") int sampleCount,
        String message
    ) {}
}
