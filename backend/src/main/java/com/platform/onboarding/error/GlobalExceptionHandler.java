package com.platform.onboarding.error;

import com.platform.onboarding.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for all REST controllers.
 *
 * Converts exceptions to standardized ErrorResponse, logs them with a
 * severity matching the error category and counts them by code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final MetricsRegistry metricsRegistry;

    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    // ==================== Onboarding Exceptions ====================

    @ExceptionHandler(OnboardingException.class)
    public ResponseEntity<ErrorResponse> handleOnboardingException(
            OnboardingException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);

        logError(ex, errorCode, traceId);
        recordMetric(errorCode);

        ErrorResponse response = ErrorResponse.of(errorCode, ex.getMessage(), status.value(),
            request.getRequestURI(), traceId);

        return ResponseEntity.status(status).body(response);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Resource not found: {} ({})",
            traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());

        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(),
            HttpStatus.NOT_FOUND.value(), request.getRequestURI(), traceId);
        response.setMetadata(Map.of(
            "resourceType", ex.getResourceType(),
            "resourceId", ex.getResourceId()
        ));

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());

        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(),
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setErrors(ex.getProblems());

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(
            PersistenceException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.error("[{}] State persistence failed for {}: {}", traceId, ex.getKey(), ex.getMessage(), ex);
        recordMetric(ex.getErrorCode());

        HttpStatus status = ex.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR;
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), status.value(),
            request.getRequestURI(), traceId);
        response.setMetadata(Map.of("retryable", ex.isRetryable()));

        return ResponseEntity.status(status).body(response);
    }

    // ==================== Request Errors ====================

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);

        ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_REQUEST, "Invalid request body",
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setDetail(ex.getMostSpecificCause().getMessage());

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Method not supported: {} on {}", traceId, ex.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.INVALID_REQUEST);

        ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_REQUEST,
            String.format("Method %s not supported for this endpoint", ex.getMethod()),
            HttpStatus.METHOD_NOT_ALLOWED.value(), request.getRequestURI(), traceId);

        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(response);
    }

    // ==================== Catch-All ====================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.INTERNAL_ERROR);

        ErrorResponse response = ErrorResponse.of(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred",
            HttpStatus.INTERNAL_SERVER_ERROR.value(), request.getRequestURI(), traceId);
        response.setDetail(ex.getClass().getSimpleName() + ": " + ex.getMessage());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    // ==================== Helpers ====================

    private String getOrCreateTraceId() {
        String traceId = MDC.get("correlationId");
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
        }
        return traceId;
    }

    private void logError(OnboardingException ex, ErrorCode errorCode, String traceId) {
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
    }

    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.recordError(errorCode.getCode());
    }

    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, TASK_NOT_FOUND ->
                HttpStatus.NOT_FOUND;
            case VALIDATION_ERROR, INVALID_REQUEST, UNSUPPORTED_SCHEMA_VERSION, INVALID_FIELD_VALUE, UNRESOLVED_REFERENCE ->
                HttpStatus.BAD_REQUEST;
            case PLANNING_FAILED, APPLY_FAILED ->
                HttpStatus.UNPROCESSABLE_ENTITY;
            case DEVICE_UNAVAILABLE, PERSISTENCE_UNAVAILABLE ->
                HttpStatus.SERVICE_UNAVAILABLE;
            case DEVICE_ERROR ->
                HttpStatus.BAD_GATEWAY;
            default ->
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
