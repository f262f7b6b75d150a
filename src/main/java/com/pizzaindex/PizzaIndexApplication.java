package com.pizzaindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Pentagon Pizza Index service.
 *
 * Reads restaurant popularity samples from the hosted store, buckets them by
 * minute, hour or day and serves a derived index plus per-restaurant statistics.
 * Scheduling is enabled for the optional aggregate backfill.
 */
@SpringBootApplication
@EnableScheduling
public class PizzaIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(PizzaIndexApplication.class, args);
    }
}
