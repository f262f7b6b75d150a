package com.pizzaindex.api;

import com.pizzaindex.config.PizzaIndexProperties;
import com.pizzaindex.domain.Granularity;
import com.pizzaindex.domain.Sample;
import com.pizzaindex.service.RestaurantService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Positive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Per-restaurant reads plus the legacy Extreme Pizza routes.
 */
@RestController
@Validated
@Tag(name = "Restaurants", description = "Raw rows and statistics for one restaurant")
public class RestaurantController {

    private static final Logger log = LoggerFactory.getLogger(RestaurantController.class);

    static final String LEGACY_RESTAURANT_ID = "extreme_pizza";

    private final RestaurantService restaurantService;
    private final PizzaIndexProperties properties;

    public RestaurantController(RestaurantService restaurantService, PizzaIndexProperties properties) {
        this.restaurantService = restaurantService;
        this.properties = properties;
    }

    @Operation(summary = "List tracked restaurants")
    @GetMapping("/restaurants")
    public ResponseEntity<RestaurantsResponse> getRestaurants() {
        var restaurants = restaurantService.restaurants();
        return ResponseEntity.ok(new RestaurantsResponse(restaurants, restaurants.size()));
    }

    @Operation(
        summary = "Get raw rows for a restaurant",
        description = "Most recent first. `days` takes precedence over `hours`; without `limit` every page is read."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Rows, possibly empty"),
        @ApiResponse(responseCode = "404", description = "Unknown restaurant",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/restaurant/{restaurantId}/data")
    public ResponseEntity<List<Sample>> getData(
            @PathVariable String restaurantId,
            @Parameter(description = "Maximum rows") @RequestParam(required = false)
            @Positive(message = "limit must be positive") Integer limit,
            @Parameter(description = "Window in days") @RequestParam(required = false)
            @Positive(message = "days must be positive") Integer days,
            @Parameter(description = "Window in hours") @RequestParam(required = false)
            @Positive(message = "hours must be positive") Integer hours) {

        List<Sample> rows = restaurantService.data(restaurantId, limit, days, hours);
        log.debug("Restaurant data: id={}, limit={}, days={}, hours={}, rows={}",
            restaurantId, limit, days, hours, rows.size());
        return ResponseEntity.ok(rows);
    }

    @Operation(summary = "Get the most recent row for a restaurant")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Latest row"),
        @ApiResponse(responseCode = "404", description = "Unknown restaurant or no rows",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/restaurant/{restaurantId}/latest")
    public ResponseEntity<Sample> getLatest(@PathVariable String restaurantId) {
        return ResponseEntity.ok(restaurantService.latest(restaurantId));
    }

    @Operation(
        summary = "Get per-bucket summaries for a restaurant",
        description = "Latest sample per hour or day bucket. Buckets without popularity values are reported with `has_data=false`."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Bucket summaries",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = RestaurantChartResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid days or interval",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "404", description = "Unknown restaurant",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/restaurant/{restaurantId}/chart-data")
    public ResponseEntity<RestaurantChartResponse> getChartData(
            @PathVariable String restaurantId,
            @Parameter(description = "Window length in days, pizza.chart.default-days when omitted", example = "7")
            @RequestParam(required = false) @Positive(message = "days must be positive") Integer days,
            @Parameter(description = "Bucket width: hour or day", example = "hour")
            @RequestParam(defaultValue = "hour") String interval) {

        return ResponseEntity.ok(restaurantService.chartData(
            restaurantId, properties.getChart().resolveDays(days), Granularity.fromTag(interval)));
    }

    @Operation(summary = "Get popularity and rating statistics for a restaurant")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Statistics",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = RestaurantStatsResponse.class))),
        @ApiResponse(responseCode = "404", description = "Unknown restaurant",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/restaurant/{restaurantId}/stats")
    public ResponseEntity<RestaurantStatsResponse> getStats(
            @PathVariable String restaurantId,
            @Parameter(description = "Window length in days, pizza.chart.default-days when omitted", example = "7")
            @RequestParam(required = false) @Positive(message = "days must be positive") Integer days) {

        return ResponseEntity.ok(restaurantService.stats(restaurantId, properties.getChart().resolveDays(days)));
    }

    @Operation(summary = "Latest Extreme Pizza row", deprecated = true)
    @GetMapping("/extreme-pizza/live")
    public ResponseEntity<Sample> getLegacyLive() {
        return getLatest(LEGACY_RESTAURANT_ID);
    }

    @Operation(summary = "All Extreme Pizza rows, most recent first", deprecated = true)
    @GetMapping("/extreme-pizza/history")
    public ResponseEntity<List<Sample>> getLegacyHistory() {
        return getData(LEGACY_RESTAURANT_ID, null, null, null);
    }
}
