package com.platform.onboarding.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Error body returned by the REST layer when a request cannot produce a task.
 * Failures inside a reconciliation are reported on the task result instead.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Unique error code (e.g., DO-301).
     */
    private String code;

    private String message;

    private String detail;

    /**
     * Whether this error is fatal (requires intervention) or recoverable (can retry).
     */
    private boolean fatal;

    private int status;

    private Instant timestamp;

    private String path;

    /**
     * Trace ID for correlating with logs.
     */
    private String traceId;

    /**
     * Every problem found in a rejected declaration.
     */
    private List<String> errors;

    private Map<String, Object> metadata;

    public static ErrorResponse of(ErrorCode errorCode, String message, int status, String path, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status)
            .timestamp(Instant.now())
            .path(path)
            .traceId(traceId)
            .build();
    }
}
