package com.pizzaindex.service;

import com.pizzaindex.aggregation.IndexCalculator;
import com.pizzaindex.aggregation.IndexPipeline;
import com.pizzaindex.aggregation.IndexPipeline.EmptyBucketPolicy;
import com.pizzaindex.api.ChartDataResponse;
import com.pizzaindex.api.LiveIndexResponse;
import com.pizzaindex.cache.ResponseCache;
import com.pizzaindex.domain.AggregateRecord;
import com.pizzaindex.domain.Granularity;
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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Computes the combined index across all restaurants.
 *
 * Both operations are memoized in {@link ResponseCache}; store failures propagate
 * and leave the cache untouched.
 */
@Service
public class PizzaIndexService {

    private static final Logger log = LoggerFactory.getLogger(PizzaIndexService.class);

    static final String LIVE_ENDPOINT = "pizza-index/live";
    static final String CHART_ENDPOINT = "pizza-index/chart-data";

    private final SampleStore store;
    private final IndexPipeline pipeline;
    private final ResponseCache cache;
    private final RestaurantRegistry registry;
    private final Clock clock;

    public PizzaIndexService(
            SampleStore store,
            IndexPipeline pipeline,
            ResponseCache cache,
            RestaurantRegistry registry,
            Clock clock) {
        this.store = store;
        this.pipeline = pipeline;
        this.cache = cache;
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Index of the bucket containing now, with change against the bucket before it.
     */
    public LiveIndexResponse live(Granularity granularity) {
        return cache.getOrCompute(LIVE_ENDPOINT, Map.of("interval", granularity.tag()),
            () -> computeLive(granularity));
    }

    /**
     * Index series over the last {@code days} days. Buckets without popularity values are omitted.
     */
    public ChartDataResponse chartData(int days, Granularity granularity) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive: " + days);
        }
        return cache.getOrCompute(CHART_ENDPOINT, Map.of("days", days, "interval", granularity.tag()),
            () -> computeChart(days, granularity));
    }

    private LiveIndexResponse computeLive(Granularity granularity) {
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        OffsetDateTime currentStart = granularity.bucketStart(now);
        OffsetDateTime previousStart = granularity.previousBucketStart(now);

        List<Sample> rows = store.fetchAll(StoreQuery.builder().since(previousStart).oldestFirst().build());
        NavigableMap<OffsetDateTime, List<TimedSample>> buckets =
            pipeline.bucket(granularity, pipeline.normalize(rows));

        List<TimedSample> currentSamples = buckets.getOrDefault(currentStart, Collections.emptyList());
        List<TimedSample> previousSamples = buckets.getOrDefault(previousStart, Collections.emptyList());
        AggregateRecord current = pipeline.aggregateBucket(granularity, currentStart, currentSamples);
        AggregateRecord previous = pipeline.aggregateBucket(granularity, previousStart, previousSamples);

        IndexCalculator.Change change = IndexCalculator.change(
            current.indexValue(), current.sampleCount(), previous.indexValue(), previous.sampleCount());

        Map<String, LiveIndexResponse.RestaurantSnapshot> snapshots = new LinkedHashMap<>();
        int totalPopularity = 0;
        for (Map.Entry<String, Restaurant> entry : registry.all().entrySet()) {
            List<TimedSample> own = new ArrayList<>();
            for (TimedSample sample : currentSamples) {
                if (entry.getKey().equals(sample.sample().getRestaurantId())) {
                    own.add(sample);
                }
            }
            var latest = pipeline.aggregator().latestWithPopularity(own);
            if (latest.isPresent()) {
                TimedSample sample = latest.get();
                totalPopularity += sample.popularity();
                snapshots.put(entry.getKey(), new LiveIndexResponse.RestaurantSnapshot(
                    entry.getValue(), sample.popularity(), sample.sample().getRating(),
                    TimestampNormalizer.format(sample.at())));
            }
        }

        if (!current.hasData()) {
            log.debug("No popularity samples in current {} bucket {}", granularity.tag(), currentStart);
        }

        LiveIndexResponse.Metadata metadata = new LiveIndexResponse.Metadata(
            TimestampNormalizer.format(now),
            granularity.tag(),
            TimestampNormalizer.format(currentStart),
            TimestampNormalizer.format(previousStart),
            totalPopularity,
            IndexCalculator.round1(current.avgPopularity()),
            snapshots.size(),
            registry.size(),
            current.sampleCount(),
            previous.sampleCount(),
            previous.indexValue()
        );

        return new LiveIndexResponse(
            LiveIndexResponse.IndexInfo.of(current.indexValue(), change.change(), change.changePercent()),
            metadata,
            snapshots
        );
    }

    private ChartDataResponse computeChart(int days, Granularity granularity) {
        OffsetDateTime since = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).minusDays(days);
        List<Sample> rows = store.fetchAll(StoreQuery.builder().since(since).oldestFirst().build());
        List<AggregateRecord> records = pipeline.aggregate(rows, granularity, EmptyBucketPolicy.OMIT);

        List<ChartDataResponse.ChartPoint> points = new ArrayList<>(records.size());
        for (AggregateRecord record : records) {
            points.add(ChartDataResponse.ChartPoint.from(record));
        }
        log.debug("Chart data: {} rows -> {} {} points over {} days", rows.size(), points.size(), granularity.tag(), days);
        return new ChartDataResponse(points, days, granularity.tag(), rows.size());
    }
}
