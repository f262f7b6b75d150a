package com.pizzaindex.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pizzaindex.domain.Restaurant;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

/**
 * Live index for the current bucket with change against the preceding bucket.
 */
@Schema(description = "Live pizza index with period-over-period change")
public record LiveIndexResponse(
    IndexInfo index,
    Metadata metadata,
    Map<String, RestaurantSnapshot> restaurants
) {

    public static final String INDEX_ID = "pizza";
    public static final String INDEX_NAME = "Pentagon Pizza Index";
    public static final String INDEX_SYMBOL = "PZZA";
    public static final String DESCRIPTION = "Real-time pizza demand index around the Pentagon";
    public static final String METHODOLOGY = "Aggregates current popularity data from major pizza establishments "
        + "around the Pentagon area. Higher values indicate increased demand and potential economic activity.";
    public static final List<String> DATA_SOURCES = List.of(
        "Google Maps Popular Times", "Real-time Restaurant Data", "Pentagon Area Establishments"
    );

    public record IndexInfo(
        String id,
        String name,
        String symbol,
        double value,
        double change,
        @JsonProperty("changePercent") double changePercent,
        String description,
        String methodology,
        @JsonProperty("dataSources") List<String> dataSources
    ) {
        public static IndexInfo of(double value, double change, double changePercent) {
            return new IndexInfo(INDEX_ID, INDEX_NAME, INDEX_SYMBOL, value, change, changePercent,
                DESCRIPTION, METHODOLOGY, DATA_SOURCES);
        }
    }

    /**
     * Context for the live value. {@code avg_popularity} and {@code sample_count} cover every row
     * with popularity in the current bucket, the same population the index is computed from.
     * {@code total_popularity} and {@code active_restaurants} cover only the latest such row of each
     * registered restaurant, matching the {@code restaurants} snapshot, so the total is not
     * {@code avg_popularity * sample_count} when a restaurant reported more than once.
     *
     * @param sampleCount rows with popularity in the current bucket; a zero change with a zero
     *                    count means "no data", not "unchanged"
     */
    public record Metadata(
        String timestamp,
        String interval,
        @JsonProperty("current_bucket") String currentBucket,
        @JsonProperty("previous_bucket") String previousBucket,
        @JsonProperty("total_popularity") int totalPopularity,
        @JsonProperty("avg_popularity") double avgPopularity,
        @JsonProperty("active_restaurants") int activeRestaurants,
        @JsonProperty("total_restaurants") int totalRestaurants,
        @JsonProperty("sample_count") int sampleCount,
        @JsonProperty("previous_sample_count") int previousSampleCount,
        @JsonProperty("previous_value") double previousValue
    ) {}

    /** Latest popularity reading of one restaurant inside the current bucket. */
    public record RestaurantSnapshot(
        Restaurant restaurant,
        int popularity,
        Double rating,
        String timestamp
    ) {}
}
