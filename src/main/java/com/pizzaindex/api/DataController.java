package com.pizzaindex.api;

import com.pizzaindex.config.PizzaIndexProperties;
import com.pizzaindex.service.DataService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/data")
@Validated
@Tag(name = "Data", description = "Views across all restaurants")
public class DataController {

    private final DataService dataService;
    private final PizzaIndexProperties properties;

    public DataController(DataService dataService, PizzaIndexProperties properties) {
        this.dataService = dataService;
        this.properties = properties;
    }

    @Operation(
        summary = "Get the latest row of every restaurant",
        description = "A restaurant whose lookup fails is reported with `error` instead of failing the response."
    )
    @GetMapping("/latest")
    public ResponseEntity<LatestDataResponse> getLatest() {
        return ResponseEntity.ok(dataService.latestAll());
    }

    @Operation(summary = "Get per-restaurant statistics over the last N days")
    @GetMapping("/summary")
    public ResponseEntity<DataSummaryResponse> getSummary(
            @Parameter(description = "Window length in days, pizza.chart.default-days when omitted", example = "7")
            @RequestParam(required = false) @Positive(message = "days must be positive") Integer days) {
        return ResponseEntity.ok(dataService.summary(properties.getChart().resolveDays(days)));
    }
}
