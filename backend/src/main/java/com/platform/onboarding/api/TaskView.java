package com.platform.onboarding.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.platform.onboarding.model.Declaration;
import com.platform.onboarding.state.Task;
import com.platform.onboarding.state.TaskResult;
import com.platform.onboarding.state.TaskState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Response body for a task. Snapshots and rollback data stay internal;
 * traces are included only when the declaration asked for them.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskView {

    String id;

    String selfLink;

    TaskState state;

    Instant lastUpdate;

    TaskResult result;

    JsonNode declaration;

    Boolean rebootRequired;

    JsonNode traceCurrent;

    JsonNode traceDesired;

    JsonNode traceDiff;

    public static TaskView of(Task task, String basePath) {
        TaskViewBuilder builder = TaskView.builder()
            .id(task.getId())
            .selfLink(basePath + "/" + task.getId())
            .state(task.getState())
            .lastUpdate(task.getLastUpdate())
            .result(task.getResult())
            .declaration(task.getDeclaration())
            .rebootRequired(task.isRebootRequired() ? Boolean.TRUE : null);

        if (task.hasTrace() && Declaration.of(task.getDeclaration()).controls().traceResponse()) {
            builder.traceCurrent(task.getTraceCurrent())
                .traceDesired(task.getTraceDesired())
                .traceDiff(task.getTraceDiff());
        }
        return builder.build();
    }
}
