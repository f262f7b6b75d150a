package com.pizzaindex.storage;

import com.pizzaindex.domain.AggregateRow;
import com.pizzaindex.domain.Sample;

import java.util.List;
import java.util.Optional;

/**
 * Access to the external popular-times store.
 * All methods throw {@link DataStoreException} on a non-success answer or transport failure.
 */
public interface SampleStore {

    /**
     * Reads one page of rows.
     *
     * @param query filter and ordering
     * @param limit maximum rows to return
     * @param offset rows to skip
     * @return the page, empty if past the end
     */
    List<Sample> fetchPage(StoreQuery query, int limit, int offset);

    /**
     * Reads every row matching {@code query}, following pagination to the end.
     * Never returns a partial result.
     */
    List<Sample> fetchAll(StoreQuery query);

    /**
     * Finds the most recent row for a restaurant.
     *
     * @param restaurantId registry id
     * @return the row if the restaurant has any
     */
    Optional<Sample> findLatest(String restaurantId);

    /**
     * Inserts or merges an aggregate keyed on (interval, timestamp); last write wins.
     */
    void upsertAggregate(AggregateRow row);

    /**
     * Checks if the store is reachable. Never throws.
     *
     * @return true if the REST root answered 2xx
     */
    boolean isHealthy();
}
