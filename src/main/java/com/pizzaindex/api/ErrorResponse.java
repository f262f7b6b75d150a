package com.pizzaindex.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by every endpoint. Never carries a stack trace.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "404")
    int status,

    @Schema(description = "Error category", example = "NOT_FOUND")
    String error,

    @Schema(description = "Human-readable error message", example = "Restaurant not found: foo")
    String message,

    @Schema(description = "Request path that caused the error", example = "/restaurant/foo/latest")
    String path,

    @Schema(description = "Timestamp of the error", example = "2024-01-01T10:30:00Z")
    Instant timestamp,

    @Schema(description = "Field-level validation errors, if any")
    List<ValidationError> validationErrors
) {

    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public ErrorResponse(int status, String error, String message, String path, List<ValidationError> validationErrors) {
        this(status, error, message, path, Instant.now(), validationErrors);
    }

    @Schema(description = "Field-level validation error")
    public record ValidationError(
        @Schema(description = "Parameter that failed validation", example = "days")
        String field,

        @Schema(description = "Rejected value", example = "-1")
        String rejectedValue,

        @Schema(description = "Validation error message", example = "days must be positive")
        String message
    ) {}
}
