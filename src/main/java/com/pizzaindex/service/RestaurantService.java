package com.pizzaindex.service;

import com.pizzaindex.aggregation.IndexCalculator;
import com.pizzaindex.aggregation.IndexPipeline;
import com.pizzaindex.api.RestaurantChartResponse;
import com.pizzaindex.api.RestaurantStatsResponse;
import com.pizzaindex.domain.Granularity;
import com.pizzaindex.domain.PopularityStats;
import com.pizzaindex.domain.Restaurant;
import com.pizzaindex.domain.RestaurantRegistry;
import com.pizzaindex.domain.Sample;
import com.pizzaindex.domain.TimedSample;
import com.pizzaindex.storage.SampleStore;
import com.pizzaindex.storage.StoreQuery;
import com.pizzaindex.util.TimestampNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;

/**
 * Per-restaurant reads. Every operation rejects ids missing from the registry
 * with {@link NotFoundException} before touching the store.
 */
@Service
public class RestaurantService {

    private static final Logger log = LoggerFactory.getLogger(RestaurantService.class);

    private final SampleStore store;
    private final IndexPipeline pipeline;
    private final RestaurantRegistry registry;
    private final Clock clock;

    public RestaurantService(SampleStore store, IndexPipeline pipeline, RestaurantRegistry registry, Clock clock) {
        this.store = store;
        this.pipeline = pipeline;
        this.registry = registry;
        this.clock = clock;
    }

    public Map<String, Restaurant> restaurants() {
        return registry.all();
    }

    /**
     * Raw rows, most recent first.
     *
     * @param limit single page of at most this many rows; all pages when null
     * @param days window in days, takes precedence over {@code hours}
     * @param hours window in hours
     */
    public List<Sample> data(String restaurantId, Integer limit, Integer days, Integer hours) {
        requireRestaurant(restaurantId);

        StoreQuery.Builder query = StoreQuery.forRestaurant(restaurantId).newestFirst();
        if (days != null) {
            query.since(now().minusDays(days));
        } else if (hours != null) {
            query.since(now().minusHours(hours));
        }

        if (limit != null) {
            return store.fetchPage(query.build(), limit, 0);
        }
        return store.fetchAll(query.build());
    }

    /**
     * @throws NotFoundException if the restaurant is unknown or has no rows
     */
    public Sample latest(String restaurantId) {
        requireRestaurant(restaurantId);
        return store.findLatest(restaurantId)
            .orElseThrow(() -> new NotFoundException("No data available for restaurant: " + restaurantId));
    }

    /**
     * One summary per bucket of the restaurant's own rows, ascending. Buckets whose rows
     * carry no popularity value appear as explicit no-data entries.
     */
    public RestaurantChartResponse chartData(String restaurantId, int days, Granularity granularity) {
        Restaurant restaurant = requireRestaurant(restaurantId);
        if (granularity == Granularity.MINUTE) {
            throw new IllegalArgumentException("Unsupported interval 'minute'. Allowed: hour, day");
        }

        List<Sample> rows = store.fetchAll(
            StoreQuery.forRestaurant(restaurantId).since(now().minusDays(days)).oldestFirst().build());
        NavigableMap<OffsetDateTime, List<TimedSample>> buckets =
            pipeline.bucket(granularity, pipeline.normalize(rows));

        List<RestaurantChartResponse.BucketSummary> summaries = new ArrayList<>(buckets.size());
        for (Map.Entry<OffsetDateTime, List<TimedSample>> entry : buckets.entrySet()) {
            summaries.add(summarizeBucket(granularity, entry.getKey(), entry.getValue()));
        }
        return new RestaurantChartResponse(
            restaurantId, restaurant.name(), days, granularity.tag(), summaries, summaries.size());
    }

    public RestaurantStatsResponse stats(String restaurantId, int days) {
        Restaurant restaurant = requireRestaurant(restaurantId);

        List<Sample> rows = store.fetchAll(
            StoreQuery.forRestaurant(restaurantId).since(now().minusDays(days)).newestFirst().build());
        if (rows.isEmpty()) {
            return RestaurantStatsResponse.empty(restaurantId, restaurant.name(), days);
        }

        PopularityStats stats = pipeline.aggregator().summarize(pipeline.normalize(rows));
        return new RestaurantStatsResponse(
            restaurantId,
            restaurant.name(),
            days,
            rows.size(),
            rows.get(0),
            stats.popularity(),
            stats.rating(),
            null
        );
    }

    /**
     * @throws NotFoundException if the id is not registered
     */
    public Restaurant requireRestaurant(String restaurantId) {
        return registry.find(restaurantId).orElseThrow(() -> {
            log.warn("Request for unknown restaurant: {}", restaurantId);
            return NotFoundException.restaurant(restaurantId);
        });
    }

    private RestaurantChartResponse.BucketSummary summarizeBucket(
            Granularity granularity, OffsetDateTime bucketStart, List<TimedSample> samples) {
        String timestamp = TimestampNormalizer.format(bucketStart);
        Optional<TimedSample> latest = pipeline.aggregator().latestWithPopularity(samples);
        if (latest.isEmpty()) {
            return new RestaurantChartResponse.BucketSummary(
                timestamp, false, null, null, null, null, null,
                samples.size(), 0, RestaurantChartResponse.NO_DATA);
        }

        var record = pipeline.aggregateBucket(granularity, bucketStart, samples);
        TimedSample sample = latest.get();
        return new RestaurantChartResponse.BucketSummary(
            timestamp,
            true,
            sample.popularity(),
            IndexCalculator.round1(record.avgPopularity()),
            record.indexValue(),
            sample.sample().getRating(),
            TimestampNormalizer.format(sample.at()),
            record.dataPoints(),
            record.sampleCount(),
            null
        );
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }
}
