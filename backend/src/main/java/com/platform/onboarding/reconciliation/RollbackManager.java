package com.platform.onboarding.reconciliation;

import com.platform.onboarding.device.DeviceClient;
import com.platform.onboarding.error.OnboardingException;
import com.platform.onboarding.error.RollbackException;
import com.platform.onboarding.handler.HandlerOutcome;
import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.model.Operation;
import com.platform.onboarding.observability.MetricsRegistry;
import com.platform.onboarding.observability.StructuredLogger;
import com.platform.onboarding.plan.DiffPlanner;
import com.platform.onboarding.state.Task;
import com.platform.onboarding.translate.DeviceConfigReader;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Restores the device to the snapshot taken before a failed apply.
 *
 * The reverse plan is computed from a fresh read of the device, not from
 * the operations that were attempted, so partial and out-of-band changes
 * are both undone.
 */
@Slf4j
public class RollbackManager {

    private final DeviceConfigReader reader;
    private final DiffPlanner planner;
    private final ApplyEngine applyEngine;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Clock clock;

    public RollbackManager(DeviceConfigReader reader, DiffPlanner planner, ApplyEngine applyEngine,
                           MetricsRegistry metricsRegistry, StructuredLogger structuredLogger, Clock clock) {
        this.reader = reader;
        this.planner = planner;
        this.applyEngine = applyEngine;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Re-plans from the live device back to the task's rollback snapshot and applies it.
     *
     * @throws RollbackException if there is no snapshot or any step of the restore fails
     */
    public HandlerOutcome rollback(Task task, DeviceClient client) {
        DeviceConfig snapshot = task.getRollbackInfo();
        if (snapshot == null) {
            metricsRegistry.recordRollback(false);
            throw new RollbackException(task.getId(), "no pre-apply snapshot recorded");
        }

        Instant start = clock.instant();
        try {
            DeviceConfig current = reader.read(client);
            List<Operation> restore = planner.planRestore(snapshot, current);
            log.info("Rolling back task {} with {} operation(s)", task.getId(), restore.size());
            structuredLogger.reconciliation().rollbackStarted(task.getId(), restore.size());

            HandlerOutcome outcome = applyEngine.apply(restore, snapshot, current, client);

            metricsRegistry.recordRollback(true);
            structuredLogger.reconciliation().rollbackCompleted(task.getId(),
                Duration.between(start, clock.instant()).toMillis());
            return outcome;
        } catch (OnboardingException e) {
            log.error("Rollback of task {} failed: {}", task.getId(), e.getMessage());
            metricsRegistry.recordRollback(false);
            structuredLogger.reconciliation().rollbackFailed(task.getId(), e.getMessage());
            throw new RollbackException(task.getId(), e);
        }
    }
}
