package com.platform.onboarding.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Client-facing outcome of a task: HTTP-style code, status string, message and errors.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskResult {

    public static final String STATUS_RUNNING = "RUNNING";
    public static final String STATUS_ROLLING_BACK = "ROLLING_BACK";
    public static final String STATUS_OK = "OK";
    public static final String STATUS_ERROR = "ERROR";

    int code;

    String status;

    String message;

    @Builder.Default
    List<String> errors = List.of();

    public static TaskResult pending() {
        return TaskResult.builder()
            .code(202)
            .status(STATUS_RUNNING)
            .message("processing")
            .build();
    }

    /**
     * Copy with the given errors appended to the existing ones.
     */
    public TaskResult withAddedErrors(List<String> added) {
        if (added == null || added.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(errors);
        merged.addAll(added);
        return toBuilder().errors(List.copyOf(merged)).build();
    }

    @JsonIgnore
    public boolean isOk() {
        return STATUS_OK.equals(status);
    }
}
