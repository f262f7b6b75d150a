package com.pizzaindex.scheduled;

import com.pizzaindex.aggregation.IndexPipeline;
import com.pizzaindex.aggregation.IndexPipeline.EmptyBucketPolicy;
import com.pizzaindex.domain.AggregateRecord;
import com.pizzaindex.domain.AggregateRow;
import com.pizzaindex.domain.Granularity;
import com.pizzaindex.domain.Sample;
import com.pizzaindex.storage.DataStoreException;
import com.pizzaindex.storage.SampleStore;
import com.pizzaindex.storage.StoreQuery;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Recomputes minute, hour and day aggregates from the whole raw table and upserts
 * them into the aggregates table.
 *
 * Buckets without popularity values are written with avg 0 and index 100. A failed
 * upsert is counted and skipped; a failed read aborts the run before anything is written.
 */
@Component
@ConditionalOnProperty(value = "pizza.backfill.enabled", havingValue = "true")
public class IndexBackfillJob {

    private static final Logger log = LoggerFactory.getLogger(IndexBackfillJob.class);

    private final SampleStore store;
    private final IndexPipeline pipeline;
    private final Counter upsertFailures;

    public IndexBackfillJob(SampleStore store, IndexPipeline pipeline, MeterRegistry meterRegistry) {
        this.store = store;
        this.pipeline = pipeline;
        this.upsertFailures = meterRegistry.counter("pizza.backfill.upsert.failures");
    }

    @Scheduled(cron = "${pizza.backfill.cron}")
    public void scheduledRun() {
        try {
            run();
        } catch (DataStoreException e) {
            log.error("Backfill aborted, raw rows could not be read: {}", e.getMessage());
        }
    }

    /**
     * @throws DataStoreException if the raw table cannot be read
     */
    public BackfillReport run() {
        log.info("Starting pizza index backfill");
        List<Sample> rows = store.fetchAll(StoreQuery.builder().oldestFirst().build());
        log.info("Fetched {} raw rows", rows.size());

        Map<Granularity, GranularityResult> results = new EnumMap<>(Granularity.class);
        for (Granularity granularity : Granularity.values()) {
            results.put(granularity, backfill(rows, granularity));
        }

        BackfillReport report = new BackfillReport(rows.size(), Collections.unmodifiableMap(results));
        log.info("Backfill completed: {} rows, {} aggregates upserted, {} failed",
            report.rowsRead(), report.totalUpserted(), report.totalFailed());
        return report;
    }

    private GranularityResult backfill(List<Sample> rows, Granularity granularity) {
        List<AggregateRecord> records = pipeline.aggregate(rows, granularity, EmptyBucketPolicy.KEEP);
        log.info("Aggregating {} {} buckets", records.size(), granularity.tag());

        int upserted = 0;
        int failed = 0;
        for (AggregateRecord record : records) {
            AggregateRow row = AggregateRow.from(record);
            try {
                store.upsertAggregate(row);
                upserted++;
            } catch (DataStoreException e) {
                failed++;
                upsertFailures.increment();
                log.error("Failed to upsert {} aggregate {}: {}", granularity.tag(), row.timestamp(), e.getMessage());
            }
        }
        return new GranularityResult(records.size(), upserted, failed);
    }

    public record GranularityResult(int buckets, int upserted, int failed) {}

    /**
     * Outcome of one run.
     *
     * @param rowsRead raw rows fetched
     * @param results per-granularity counts
     */
    public record BackfillReport(int rowsRead, Map<Granularity, GranularityResult> results) {

        public int totalUpserted() {
            return results.values().stream().mapToInt(GranularityResult::upserted).sum();
        }

        public int totalFailed() {
            return results.values().stream().mapToInt(GranularityResult::failed).sum();
        }
    }
}
