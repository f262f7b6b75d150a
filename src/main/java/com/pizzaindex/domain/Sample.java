package com.pizzaindex.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One raw popular-times row as stored in the {@code restaurant_popular_times} table.
 *
 * Columns the aggregation engine does not read (e.g. {@code popular_times}) are kept in
 * {@link #getAdditionalProperties()} so raw rows serialize back out unchanged.
 * Rows are produced by the external collector and are never modified here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Sample {

    private Long id;

    private String restaurantId;

    private String restaurantName;

    private String restaurantAddress;

    /** Observation time as sent by the store; formats vary, see TimestampNormalizer. */
    private String timestamp;

    private Double rating;

    private Integer ratingCount;

    /** Live popularity 0-100, null when the collector saw no live data. */
    private Integer currentPopularity;

    private Integer timeSpentMin;

    private Integer timeSpentMax;

    private String createdAt;

    @Builder.Default
    @Setter(AccessLevel.NONE)
    private Map<String, Object> additionalProperties = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonAnySetter
    public void setAdditionalProperty(String name, Object value) {
        if (additionalProperties == null) {
            additionalProperties = new LinkedHashMap<>();
        }
        additionalProperties.put(name, value);
    }

    /** Returns true if the row carries a live popularity value. */
    public boolean hasPopularity() {
        return currentPopularity != null;
    }

    /** Observation time, falling back to the insert time for rows without one. */
    public String observedAt() {
        return timestamp != null ? timestamp : createdAt;
    }
}
