package com.pizzaindex.aggregation;

import com.pizzaindex.domain.AggregateRecord;
import com.pizzaindex.domain.Granularity;
import com.pizzaindex.domain.PopularityStats;
import com.pizzaindex.domain.TimedSample;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Reduces a group of samples to count, mean, min, max and latest popularity.
 * Rows without a popularity value are skipped, never treated as zero.
 *
 * Stateless and thread-safe.
 */
public class PopularityAggregator {

    /**
     * Aggregates one bucket. {@code avgPopularity} is the explicit 0 sentinel
     * and the index is 100.0 when no sample carries a popularity value.
     */
    public AggregateRecord aggregate(Granularity granularity, OffsetDateTime bucketStart, List<TimedSample> samples) {
        long total = 0;
        int valid = 0;
        for (TimedSample sample : samples) {
            if (sample.hasPopularity()) {
                total += sample.popularity();
                valid++;
            }
        }
        double avg = valid > 0 ? (double) total / valid : 0.0;
        double index = valid > 0 ? IndexCalculator.indexValue(avg) : IndexCalculator.BASE_VALUE;
        return new AggregateRecord(granularity, bucketStart, index, avg, valid, samples.size());
    }

    /**
     * Window statistics for the per-restaurant endpoints.
     * {@code latest} is the first present value in descending timestamp order.
     */
    public PopularityStats summarize(List<TimedSample> samples) {
        Integer latest = null;
        OffsetDateTime latestAt = null;
        Integer min = null;
        Integer max = null;
        long total = 0;
        int count = 0;

        Double latestRating = null;
        OffsetDateTime latestRatingAt = null;
        double ratingTotal = 0;
        int ratingCount = 0;

        for (TimedSample sample : samples) {
            Integer popularity = sample.popularity();
            if (popularity != null) {
                total += popularity;
                count++;
                min = min == null ? popularity : Math.min(min, popularity);
                max = max == null ? popularity : Math.max(max, popularity);
                if (latestAt == null || sample.at().isAfter(latestAt)) {
                    latest = popularity;
                    latestAt = sample.at();
                }
            }
            Double rating = sample.sample().getRating();
            if (rating != null) {
                ratingTotal += rating;
                ratingCount++;
                if (latestRatingAt == null || sample.at().isAfter(latestRatingAt)) {
                    latestRating = rating;
                    latestRatingAt = sample.at();
                }
            }
        }

        return new PopularityStats(
            count,
            new PopularityStats.Popularity(latest, count > 0 ? (double) total / count : null, min, max),
            new PopularityStats.Rating(latestRating, ratingCount > 0 ? ratingTotal / ratingCount : null)
        );
    }

    /** Returns the most recent sample that carries a popularity value. */
    public Optional<TimedSample> latestWithPopularity(List<TimedSample> samples) {
        TimedSample latest = null;
        for (TimedSample sample : samples) {
            if (sample.hasPopularity() && (latest == null || sample.at().isAfter(latest.at()))) {
                latest = sample;
            }
        }
        return Optional.ofNullable(latest);
    }
}
