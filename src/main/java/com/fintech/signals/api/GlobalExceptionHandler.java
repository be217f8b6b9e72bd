package com.fintech.signals.api;

import com.fintech.signals.error.AuthorizationDeniedException;
import com.fintech.signals.error.SignalEngineException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API controllers.
 * Provides consistent error responses across all endpoints.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Refused payment: 402 with the operation's price.
     */
    @ExceptionHandler(AuthorizationDeniedException.class)
    public ResponseEntity<PaymentRequiredResponse> handlePaymentRequired(
            AuthorizationDeniedException ex,
            WebRequest request) {

        String path = pathOf(request);
        log.info("Payment required on {}: operation={}, reason={}",
                path, ex.requirement().operation().operationName(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
            .body(PaymentRequiredResponse.of(ex.requirement(), ex.getMessage()));
    }

    /**
     * Domain failures, mapped by kind.
     */
    @ExceptionHandler(SignalEngineException.class)
    public ResponseEntity<ErrorResponse> handleSignalEngineException(
            SignalEngineException ex,
            WebRequest request) {

        HttpStatus status = switch (ex.kind()) {
            case INSUFFICIENT_DATA -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INSTRUMENT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UPSTREAM_FETCH_ERROR -> HttpStatus.BAD_GATEWAY;
            case PAYMENT_REQUIRED -> HttpStatus.PAYMENT_REQUIRED;
        };
        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(status.value(), ex.kind().name(), ex.getMessage(), path);

        if (status.is5xxServerError()) {
            log.error("Upstream failure on {}: {}", path, ex.getMessage());
        } else {
            log.warn("{} on {}: {}", ex.kind(), path, ex.getMessage());
        }
        return ResponseEntity.status(status).body(error);
    }

    /**
     * Handle validation constraint violations.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            WebRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getConstraintViolations().stream()
            .map(violation -> new ErrorResponse.ValidationError(
                getFieldName(violation),
                violation.getInvalidValue() != null ? violation.getInvalidValue().toString() : "null",
                violation.getMessage()
            ))
            .collect(Collectors.toList());

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "VALIDATION_ERROR",
            "Request validation failed",
            path,
            validationErrors
        );

        log.warn("Validation error on {}: {}", path, validationErrors);
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "MISSING_PARAMETER",
            String.format("Required parameter '%s' is missing", ex.getParameterName()),
            path,
            List.of(new ErrorResponse.ValidationError(ex.getParameterName(), null, "This parameter is required"))
        );

        log.warn("Missing parameter on {}: {}", path, ex.getParameterName());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle type conversion errors (e.g., string instead of number).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request) {

        String path = pathOf(request);
        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";

        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "TYPE_MISMATCH",
            String.format("Parameter '%s' must be a valid %s", ex.getName(), expectedType),
            path,
            List.of(new ErrorResponse.ValidationError(
                ex.getName(),
                ex.getValue() != null ? ex.getValue().toString() : "null",
                String.format("Expected type: %s", expectedType)
            ))
        );

        log.warn("Type mismatch on {}: {} expected {} but got {}",
                path, ex.getName(), expectedType, ex.getValue());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle illegal argument exceptions (e.g., unsupported interval or category).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "INVALID_ARGUMENT",
            ex.getMessage(),
            path
        );

        log.warn("Invalid argument on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "INTERNAL_ERROR",
            "An unexpected error occurred. Please contact support if this persists.",
            path
        );

        log.error("Unexpected error on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private static String pathOf(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }

    private String getFieldName(ConstraintViolation<?> violation) {
        String propertyPath = violation.getPropertyPath().toString();
        int lastDot = propertyPath.lastIndexOf('.');
        return lastDot >= 0 ? propertyPath.substring(lastDot + 1) : propertyPath;
    }
}
