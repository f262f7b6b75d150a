package com.pizzaindex.aggregation;

import com.pizzaindex.domain.AggregateRecord;
import com.pizzaindex.domain.Granularity;
import com.pizzaindex.domain.ParsedTimestamp;
import com.pizzaindex.domain.Sample;
import com.pizzaindex.domain.TimedSample;
import com.pizzaindex.util.TimeBucketManager;
import com.pizzaindex.util.TimestampNormalizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Single normalize, bucket and aggregate pipeline shared by every granularity.
 *
 * Raw rows are normalized once, grouped by {@link TimeBucketManager} and reduced by
 * {@link PopularityAggregator}. Timestamp fallbacks are logged and counted here so the
 * normalizer itself stays side-effect free.
 */
@Component
public class IndexPipeline {

    private static final Logger log = LoggerFactory.getLogger(IndexPipeline.class);

    private final TimestampNormalizer normalizer;
    private final TimeBucketManager bucketManager;
    private final PopularityAggregator aggregator;
    private final MeterRegistry meterRegistry;
    private final Counter fallbackCounter;

    public IndexPipeline(
            TimestampNormalizer normalizer,
            TimeBucketManager bucketManager,
            PopularityAggregator aggregator,
            MeterRegistry meterRegistry) {
        this.normalizer = normalizer;
        this.bucketManager = bucketManager;
        this.aggregator = aggregator;
        this.meterRegistry = meterRegistry;
        this.fallbackCounter = meterRegistry.counter("pizza.timestamp.fallbacks");
    }

    /**
     * Normalizes observation times, keeping input order.
     * Unreadable timestamps are replaced by "now" and reported at WARN.
     */
    public List<TimedSample> normalize(List<Sample> samples) {
        List<TimedSample> timed = new ArrayList<>(samples.size());
        for (Sample sample : samples) {
            ParsedTimestamp parsed = normalizer.normalize(sample.observedAt());
            if (parsed.usedFallback()) {
                fallbackCounter.increment();
                log.warn("Unparseable timestamp '{}' on row id={}, restaurant={}; using current time",
                    sample.observedAt(), sample.getId(), sample.getRestaurantId());
            }
            timed.add(new TimedSample(parsed.value(), sample));
        }
        return timed;
    }

    /** Groups normalized samples into ascending buckets. */
    public NavigableMap<OffsetDateTime, List<TimedSample>> bucket(Granularity granularity, List<TimedSample> samples) {
        return bucketManager.group(granularity, samples);
    }

    /**
     * Aggregates raw rows into one record per bucket, ascending.
     *
     * @param policy whether buckets without any popularity value are kept
     */
    public List<AggregateRecord> aggregate(List<Sample> samples, Granularity granularity, EmptyBucketPolicy policy) {
        Timer.Sample timer = Timer.start(meterRegistry);
        try {
            NavigableMap<OffsetDateTime, List<TimedSample>> buckets = bucket(granularity, normalize(samples));
            List<AggregateRecord> records = new ArrayList<>(buckets.size());
            for (Map.Entry<OffsetDateTime, List<TimedSample>> entry : buckets.entrySet()) {
                AggregateRecord record = aggregator.aggregate(granularity, entry.getKey(), entry.getValue());
                if (record.hasData() || policy == EmptyBucketPolicy.KEEP) {
                    records.add(record);
                }
            }
            log.debug("Aggregated {} rows into {} {} buckets", samples.size(), records.size(), granularity.tag());
            return records;
        } finally {
            timer.stop(meterRegistry.timer("pizza.pipeline.aggregate.time", "granularity", granularity.tag()));
        }
    }

    /** Aggregates one bucket of already-normalized samples. */
    public AggregateRecord aggregateBucket(Granularity granularity, OffsetDateTime bucketStart, List<TimedSample> samples) {
        return aggregator.aggregate(granularity, bucketStart, samples);
    }

    public PopularityAggregator aggregator() {
        return aggregator;
    }

    /** What to do with buckets that hold rows but no popularity value. */
    public enum EmptyBucketPolicy {
        /** Drop them (bulk chart series). */
        OMIT,
        /** Keep them with avg 0 and index 100 (persisted aggregates). */
        KEEP
    }
}
