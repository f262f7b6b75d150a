package com.pizzaindex.service;

import com.pizzaindex.aggregation.IndexPipeline;
import com.pizzaindex.api.DataSummaryResponse;
import com.pizzaindex.api.LatestDataResponse;
import com.pizzaindex.domain.PopularityStats;
import com.pizzaindex.domain.Restaurant;
import com.pizzaindex.domain.RestaurantRegistry;
import com.pizzaindex.domain.Sample;
import com.pizzaindex.storage.DataStoreException;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cross-restaurant views of the raw table.
 */
@Service
public class DataService {

    private static final Logger log = LoggerFactory.getLogger(DataService.class);

    private final SampleStore store;
    private final IndexPipeline pipeline;
    private final RestaurantRegistry registry;
    private final Clock clock;

    public DataService(SampleStore store, IndexPipeline pipeline, RestaurantRegistry registry, Clock clock) {
        this.store = store;
        this.pipeline = pipeline;
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Latest row per registered restaurant. A failed lookup marks that restaurant
     * with an error instead of failing the whole response.
     */
    public LatestDataResponse latestAll() {
        Map<String, LatestDataResponse.RestaurantLatest> result = new LinkedHashMap<>();
        for (Map.Entry<String, Restaurant> entry : registry.all().entrySet()) {
            String id = entry.getKey();
            try {
                Optional<Sample> latest = store.findLatest(id);
                result.put(id, new LatestDataResponse.RestaurantLatest(entry.getValue(), latest.orElse(null), null));
            } catch (DataStoreException e) {
                log.error("Error fetching latest data for {}: {}", id, e.getMessage());
                result.put(id, new LatestDataResponse.RestaurantLatest(
                    entry.getValue(), null, LatestDataResponse.FETCH_FAILED));
            }
        }
        return new LatestDataResponse(TimestampNormalizer.format(now()), result);
    }

    /**
     * Statistics per restaurant over the last {@code days} days. Rows of ids missing from
     * the registry are still reported, named after their id.
     */
    public DataSummaryResponse summary(int days) {
        List<Sample> rows = store.fetchAll(StoreQuery.builder().since(now().minusDays(days)).newestFirst().build());

        Map<String, List<Sample>> byRestaurant = new LinkedHashMap<>();
        for (Sample row : rows) {
            byRestaurant.computeIfAbsent(row.getRestaurantId(), key -> new ArrayList<>()).add(row);
        }

        Map<String, DataSummaryResponse.RestaurantSummary> summaries = new LinkedHashMap<>();
        for (Map.Entry<String, List<Sample>> entry : byRestaurant.entrySet()) {
            List<Sample> items = entry.getValue();
            Restaurant restaurant = registry.find(entry.getKey())
                .orElseGet(() -> new Restaurant(entry.getKey(), null));
            PopularityStats stats = pipeline.aggregator().summarize(pipeline.normalize(items));
            summaries.put(entry.getKey(), new DataSummaryResponse.RestaurantSummary(
                restaurant, items.size(), items.get(0), stats.popularity(), stats.rating()));
        }
        log.debug("Summary over {} days: {} rows, {} restaurants", days, rows.size(), summaries.size());
        return new DataSummaryResponse(days, rows.size(), summaries);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }
}
