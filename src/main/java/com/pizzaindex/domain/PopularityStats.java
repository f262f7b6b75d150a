package com.pizzaindex.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Window statistics for one restaurant. Values are null when no sample carried them.
 */
public record PopularityStats(
    @JsonProperty("sample_count") int sampleCount,
    @JsonProperty("current_popularity") Popularity popularity,
    @JsonProperty("rating") Rating rating
) {

    public record Popularity(Integer latest, Double average, Integer min, Integer max) {}

    public record Rating(Double latest, Double average) {}

    public static PopularityStats empty() {
        return new PopularityStats(0, new Popularity(null, null, null, null), new Rating(null, null));
    }
}
