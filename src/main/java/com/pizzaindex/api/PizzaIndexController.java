package com.pizzaindex.api;

import com.pizzaindex.config.PizzaIndexProperties;
import com.pizzaindex.domain.Granularity;
import com.pizzaindex.service.PizzaIndexService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Combined index across all tracked restaurants.
 */
@RestController
@RequestMapping("/pizza-index")
@Validated
@Tag(name = "Pizza Index", description = "Live index and historical index series")
public class PizzaIndexController {

    private static final Logger log = LoggerFactory.getLogger(PizzaIndexController.class);

    private final PizzaIndexService indexService;
    private final PizzaIndexProperties properties;
    private final MeterRegistry meterRegistry;

    public PizzaIndexController(
            PizzaIndexService indexService,
            PizzaIndexProperties properties,
            MeterRegistry meterRegistry) {
        this.indexService = indexService;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Operation(
        summary = "Get the live pizza index",
        description = """
            Index of the bucket containing the current time, with change against the bucket before it.
            The index is `100 + avg_popularity * 0.8`. Responses are cached for 60 seconds.

            When either bucket has no popularity samples the change is reported as 0.0;
            check `metadata.sample_count` to tell "no data" from "unchanged".
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Live index",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = LiveIndexResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "index": {"id": "pizza", "name": "Pentagon Pizza Index", "symbol": "PZZA",
                                    "value": 132.0, "change": 4.0, "changePercent": 3.13},
                          "metadata": {"interval": "hour", "sample_count": 5, "previous_sample_count": 4},
                          "restaurants": {}
                        }
                        """
                )
            )
        ),
        @ApiResponse(responseCode = "400", description = "Unsupported interval",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "500", description = "Data store unavailable",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/live")
    public ResponseEntity<LiveIndexResponse> getLive(
            @Parameter(description = "Bucket width: minute, hour or day", example = "hour")
            @RequestParam(defaultValue = "hour") String interval) {

        Granularity granularity = Granularity.fromTag(interval);
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            LiveIndexResponse response = indexService.live(granularity);
            log.debug("Live index: interval={}, value={}", granularity.tag(), response.index().value());
            return ResponseEntity.ok(response);
        } finally {
            sample.stop(meterRegistry.timer("api.pizza_index.request.time",
                "endpoint", "live", "interval", granularity.tag()));
        }
    }

    @Operation(
        summary = "Get the index series",
        description = "Index per bucket over the last N days, ascending. Buckets without popularity samples are omitted."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Index series",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ChartDataResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid days or interval",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/chart-data")
    public ResponseEntity<ChartDataResponse> getChartData(
            @Parameter(description = "Window length in days, pizza.chart.default-days when omitted", example = "7")
            @RequestParam(required = false) @Positive(message = "days must be positive") Integer days,

            @Parameter(description = "Bucket width: minute, hour or day", example = "hour")
            @RequestParam(defaultValue = "hour") String interval) {

        Granularity granularity = Granularity.fromTag(interval);
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return ResponseEntity.ok(indexService.chartData(properties.getChart().resolveDays(days), granularity));
        } finally {
            sample.stop(meterRegistry.timer("api.pizza_index.request.time",
                "endpoint", "chart-data", "interval", granularity.tag()));
        }
    }
}
