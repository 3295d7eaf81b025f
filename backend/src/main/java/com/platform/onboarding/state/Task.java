package com.platform.onboarding.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.platform.onboarding.model.DeviceConfig;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Immutable snapshot of one reconciliation task as held by the StateStore.
 *
 * The declaration is always stored masked. Trace fields are only populated
 * when the declaration asked for tracing.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Task {

    String id;

    TaskState state;

    Instant createdAt;

    Instant lastUpdate;

    @Builder.Default
    TaskResult result = TaskResult.pending();

    JsonNode declaration;

    /**
     * Device identifier the original configuration was recorded under.
     */
    String machineId;

    DeviceConfig currentConfig;

    DeviceConfig originalConfig;

    /**
     * Device configuration captured right before the apply phase.
     */
    DeviceConfig rollbackInfo;

    boolean rebootRequired;

    JsonNode traceCurrent;

    JsonNode traceDesired;

    JsonNode traceDiff;

    public boolean hasTrace() {
        return traceCurrent != null || traceDesired != null || traceDiff != null;
    }
}
