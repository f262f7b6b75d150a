package com.pizzaindex.config;

import com.pizzaindex.domain.Restaurant;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Externalized configuration for the pizza index service.
 * Maps to 'pizza.*' properties in application.yml. Read once at startup.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pizza")
public class PizzaIndexProperties {

    private Store store = new Store();
    private Cache cache = new Cache();
    private Chart chart = new Chart();
    private Backfill backfill = new Backfill();
    private Map<String, RestaurantConfig> restaurants = new LinkedHashMap<>();

    @Data
    public static class Store {
        private String url = "http://localhost:54321";
        private String anonKey = "";
        private String serviceRoleKey = "";
        private String table = "restaurant_popular_times";
        private String aggregatesTable = "pizza_index_aggregates";
        private int pageSize = 1000;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);

        /** Privileged key when configured, anonymous key otherwise. */
        public String effectiveKey() {
            return serviceRoleKey != null && !serviceRoleKey.isBlank() ? serviceRoleKey : anonKey;
        }
    }

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofSeconds(60);
    }

    @Data
    public static class Chart {
        private int defaultDays = 7;

        /** Window in days for a request, {@link #defaultDays} when the caller gave none. */
        public int resolveDays(Integer requested) {
            return requested != null ? requested : defaultDays;
        }
    }

    @Data
    public static class Backfill {
        private boolean enabled = false;
        private String cron = "0 5 * * * *";
    }

    @Data
    public static class RestaurantConfig {
        private String name;
        private String address;

        public Restaurant toRestaurant() {
            return new Restaurant(name, address);
        }
    }
}
