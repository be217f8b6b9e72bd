package com.fintech.signals.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Error body for every failed request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "422")
    int status,

    @Schema(description = "Error kind", example = "INSUFFICIENT_DATA")
    String error,

    @Schema(description = "Human-readable error message", example = "No 1h candles collected yet for WBTC")
    String message,

    @Schema(description = "Request path that caused the error", example = "/api/v1/rsi")
    String path,

    @Schema(description = "Timestamp of the error", example = "2025-12-09T10:30:00Z")
    Instant timestamp,

    @Schema(description = "Detailed validation errors (if applicable)")
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
        @Schema(description = "Field name that failed validation", example = "count")
        String field,

        @Schema(description = "Rejected value", example = "5000")
        String rejectedValue,

        @Schema(description = "Validation error message", example = "count must be at most 1000")
        String message
    ) {}
}
