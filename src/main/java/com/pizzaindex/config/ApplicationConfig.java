package com.pizzaindex.config;

import com.pizzaindex.aggregation.PopularityAggregator;
import com.pizzaindex.cache.ResponseCache;
import com.pizzaindex.domain.Restaurant;
import com.pizzaindex.domain.RestaurantRegistry;
import com.pizzaindex.storage.rest.SupabaseSampleStore;
import com.pizzaindex.util.TimeBucketManager;
import com.pizzaindex.util.TimestampNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    private static final Logger log = LoggerFactory.getLogger(ApplicationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TimestampNormalizer timestampNormalizer(Clock clock) {
        return new TimestampNormalizer(clock);
    }

    @Bean
    public TimeBucketManager timeBucketManager() {
        return new TimeBucketManager();
    }

    @Bean
    public PopularityAggregator popularityAggregator() {
        return new PopularityAggregator();
    }

    @Bean
    public ResponseCache responseCache(PizzaIndexProperties properties, Clock clock, MeterRegistry meterRegistry) {
        return new ResponseCache(properties.getCache().getTtl(), clock, meterRegistry);
    }

    @Bean
    public RestaurantRegistry restaurantRegistry(PizzaIndexProperties properties) {
        Map<String, Restaurant> restaurants = new LinkedHashMap<>();
        properties.getRestaurants().forEach((id, config) -> restaurants.put(id, config.toRestaurant()));
        log.info("Tracking {} restaurants: {}", restaurants.size(), restaurants.keySet());
        return new RestaurantRegistry(restaurants);
    }

    @Bean
    public RestClient supabaseRestClient(RestClient.Builder builder, PizzaIndexProperties properties) {
        PizzaIndexProperties.Store store = properties.getStore();
        if (store.effectiveKey() == null || store.effectiveKey().isBlank()) {
            log.warn("No Supabase key configured; store requests will be rejected");
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(store.getConnectTimeout());
        requestFactory.setReadTimeout(store.getReadTimeout());

        return SupabaseSampleStore.configure(builder.requestFactory(requestFactory), store).build();
    }
}
