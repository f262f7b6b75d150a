package com.pizzaindex.util;

import com.pizzaindex.domain.Granularity;
import com.pizzaindex.domain.TimedSample;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Groups samples into UTC-aligned time buckets.
 *
 * Thread-safe and stateless - all methods are pure functions.
 */
public class TimeBucketManager {

    /**
     * Returns the UTC bucket start for a timestamp.
     *
     * @param timestamp any instant
     * @param granularity bucket width
     * @return the aligned bucket start at UTC offset
     */
    public OffsetDateTime getBucketStart(OffsetDateTime timestamp, Granularity granularity) {
        return granularity.bucketStart(timestamp.withOffsetSameInstant(ZoneOffset.UTC));
    }

    /**
     * Groups samples by bucket start.
     * Buckets iterate in ascending time order; within a bucket samples keep input order.
     *
     * @param granularity bucket width
     * @param samples normalized samples in any order
     * @return ascending map of bucket start to members
     */
    public NavigableMap<OffsetDateTime, List<TimedSample>> group(Granularity granularity, List<TimedSample> samples) {
        NavigableMap<OffsetDateTime, List<TimedSample>> buckets = new TreeMap<>();
        for (TimedSample sample : samples) {
            OffsetDateTime bucket = getBucketStart(sample.at(), granularity);
            buckets.computeIfAbsent(bucket, key -> new ArrayList<>()).add(sample);
        }
        return buckets;
    }
}
