package com.pizzaindex.storage;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Filter and ordering for a REST table read, rendered as PostgREST query parameters
 * ({@code column=op.value}, {@code order=column.asc|desc}). Limit and offset are
 * supplied per page by the caller.
 */
public final class StoreQuery {

    public static final String TIME_COLUMN = "timestamp";

    private final List<Filter> filters;
    private final String orderColumn;
    private final boolean descending;

    private StoreQuery(List<Filter> filters, String orderColumn, boolean descending) {
        this.filters = Collections.unmodifiableList(filters);
        this.orderColumn = orderColumn;
        this.descending = descending;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the rows of one restaurant. */
    public static Builder forRestaurant(String restaurantId) {
        return builder().eq("restaurant_id", restaurantId);
    }

    public List<Filter> filters() {
        return filters;
    }

    public String orderColumn() {
        return orderColumn;
    }

    public boolean descending() {
        return descending;
    }

    /** Query parameters in insertion order, excluding limit and offset. */
    public Map<String, String> toParams() {
        Map<String, String> params = new LinkedHashMap<>();
        for (Filter filter : filters) {
            params.put(filter.column(), filter.operator() + "." + filter.value());
        }
        if (orderColumn != null) {
            params.put("order", orderColumn + (descending ? ".desc" : ".asc"));
        }
        return params;
    }

    @Override
    public String toString() {
        return toParams().toString();
    }

    /** One {@code column=operator.value} condition. */
    public record Filter(String column, String operator, String value) {
        public Filter {
            Objects.requireNonNull(column, "Column cannot be null");
            Objects.requireNonNull(operator, "Operator cannot be null");
            Objects.requireNonNull(value, "Value cannot be null");
        }
    }

    public static final class Builder {

        private static final DateTimeFormatter INSTANT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'");

        private final List<Filter> filters = new ArrayList<>();
        private String orderColumn = TIME_COLUMN;
        private boolean descending;

        private Builder() {
        }

        public Builder eq(String column, String value) {
            return filter(new Filter(column, "eq", value));
        }

        /** Keeps rows observed at or after {@code from}. */
        public Builder since(OffsetDateTime from) {
            return filter(new Filter(TIME_COLUMN, "gte", INSTANT_FORMAT.format(from.withOffsetSameInstant(ZoneOffset.UTC))));
        }

        public Builder newestFirst() {
            this.descending = true;
            return this;
        }

        public Builder oldestFirst() {
            this.descending = false;
            return this;
        }

        /**
         * Parameters are keyed by column, so a column takes at most one filter.
         *
         * @throws IllegalArgumentException if {@code column} is already filtered
         */
        private Builder filter(Filter filter) {
            for (Filter existing : filters) {
                if (existing.column().equals(filter.column())) {
                    throw new IllegalArgumentException(String.format(
                        "Column '%s' already filtered by %s.%s", filter.column(), existing.operator(), existing.value()));
                }
            }
            filters.add(filter);
            return this;
        }

        public StoreQuery build() {
            return new StoreQuery(new ArrayList<>(filters), orderColumn, descending);
        }
    }
}
