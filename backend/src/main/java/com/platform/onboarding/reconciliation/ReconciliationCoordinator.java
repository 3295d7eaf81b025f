package com.platform.onboarding.reconciliation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.onboarding.device.DeviceClient;
import com.platform.onboarding.device.MutationTrackingDeviceClient;
import com.platform.onboarding.error.ApplyException;
import com.platform.onboarding.error.DeviceClientException;
import com.platform.onboarding.error.ErrorCode;
import com.platform.onboarding.error.OnboardingException;
import com.platform.onboarding.error.PersistenceException;
import com.platform.onboarding.error.PlanningException;
import com.platform.onboarding.error.RollbackException;
import com.platform.onboarding.error.ValidationException;
import com.platform.onboarding.handler.HandlerOutcome;
import com.platform.onboarding.model.Controls;
import com.platform.onboarding.model.Declaration;
import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.model.Operation;
import com.platform.onboarding.observability.LoggingConfig;
import com.platform.onboarding.observability.MetricsRegistry;
import com.platform.onboarding.observability.StructuredLogger;
import com.platform.onboarding.plan.DiffPlanner;
import com.platform.onboarding.plan.ReferenceResolver;
import com.platform.onboarding.plan.SecretDigests;
import com.platform.onboarding.state.StateStore;
import com.platform.onboarding.state.TaskResult;
import com.platform.onboarding.state.TaskState;
import com.platform.onboarding.translate.ConfigTranslator;
import com.platform.onboarding.translate.DeviceConfigReader;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Runs one task through validate, snapshot, plan, apply and finalize or rollback.
 *
 * Every outcome ends in a terminal task state with a result, except
 * cancellation, which leaves the task in the last state it reached.
 */
@Slf4j
public class ReconciliationCoordinator {

    static final String MESSAGE_SUCCESS = "success";
    static final String MESSAGE_DRY_RUN = "success - dry run, no changes applied";
    static final String MESSAGE_INVALID = "invalid config";
    static final String MESSAGE_BAD_DECLARATION = "bad declaration";
    static final String MESSAGE_ROLLING_BACK = "rolling back";
    static final String MESSAGE_ROLLED_BACK = "invalid config - rolled back";
    static final String MESSAGE_ROLLBACK_FAILED = "invalid config - rollback failed";
    static final String MESSAGE_INTERNAL = "internal error";

    private final SchemaValidator schemaValidator;
    private final ConfigTranslator translator;
    private final DeviceConfigReader reader;
    private final ReferenceResolver referenceResolver;
    private final DiffPlanner planner;
    private final ApplyEngine applyEngine;
    private final RollbackManager rollbackManager;
    private final StateStore stateStore;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReconciliationCoordinator(SchemaValidator schemaValidator, ConfigTranslator translator,
                                     DeviceConfigReader reader, ReferenceResolver referenceResolver,
                                     DiffPlanner planner, ApplyEngine applyEngine, RollbackManager rollbackManager,
                                     StateStore stateStore, MetricsRegistry metricsRegistry,
                                     StructuredLogger structuredLogger, ObjectMapper objectMapper, Clock clock) {
        this.schemaValidator = schemaValidator;
        this.translator = translator;
        this.reader = reader;
        this.referenceResolver = referenceResolver;
        this.planner = planner;
        this.applyEngine = applyEngine;
        this.rollbackManager = rollbackManager;
        this.stateStore = stateStore;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Reconciles the device against a declaration for an existing CREATED task.
     *
     * @throws PersistenceException if the task record can no longer be written
     * @throws CancellationException if the running thread was interrupted mid-apply
     */
    public void reconcile(String taskId, JsonNode rawDeclaration, DeviceClient client) {
        Instant start = clock.instant();
        LoggingConfig.setTaskContext(taskId);
        metricsRegistry.taskStarted();
        String outcome = "failed";
        try {
            stateStore.setDeclaration(taskId, rawDeclaration);
            stateStore.transition(taskId, TaskState.VALIDATING, "declaration received");
            outcome = run(taskId, rawDeclaration, client, start);
        } catch (CancellationException e) {
            outcome = "cancelled";
            log.warn("Reconciliation of task {} was cancelled in state {}", taskId, currentState(taskId));
            throw e;
        } catch (PersistenceException e) {
            outcome = "persistence_error";
            metricsRegistry.recordError(e.getErrorCode().getCode());
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected failure reconciling task {}", taskId, e);
            metricsRegistry.recordError(ErrorCode.INTERNAL_ERROR.getCode());
            failIfPossible(taskId, 500, MESSAGE_INTERNAL, List.of(String.valueOf(e.getMessage())));
        } finally {
            metricsRegistry.recordReconciliation(outcome, Duration.between(start, clock.instant()));
            metricsRegistry.taskFinished();
            LoggingConfig.clearTaskContext();
        }
    }

    private String run(String taskId, JsonNode rawDeclaration, DeviceClient client, Instant start) {
        Controls controls = Controls.none();
        DeviceConfig desired;
        DeviceConfig current;
        String machineId;
        List<Operation> plan;

        // ==================== Validate, snapshot, plan ====================

        try {
            schemaValidator.validate(rawDeclaration);
            Declaration declaration = Declaration.of(rawDeclaration);
            controls = declaration.controls();

            current = reader.read(client);
            machineId = reader.readMachineId(client);
            stateStore.setMachineId(taskId, machineId);
            DeviceConfig original = originalConfigFor(machineId, current);
            stateStore.setOriginalConfigByTaskId(taskId, original);

            desired = translator.fromDeclaration(declaration).withMissingNamelessFrom(original);
            referenceResolver.validate(desired, current);
            plan = planner.plan(desired, current, SecretDigests.of(stateStore.getAppliedSecrets(machineId)));
        } catch (ValidationException e) {
            recordFailure(taskId, null, null, e);
            finish(taskId, TaskState.FAILED, 400, TaskResult.STATUS_ERROR, MESSAGE_BAD_DECLARATION, e.getProblems());
            return "invalid";
        } catch (PlanningException e) {
            recordFailure(taskId, null, null, e);
            finish(taskId, TaskState.FAILED, 422, TaskResult.STATUS_ERROR, MESSAGE_INVALID, e.getUnresolved());
            return "invalid";
        } catch (DeviceClientException e) {
            recordFailure(taskId, null, null, e);
            finish(taskId, TaskState.FAILED, 500, TaskResult.STATUS_ERROR, MESSAGE_INTERNAL, List.of(e.getMessage()));
            return "failed";
        }

        if (controls.trace()) {
            stateStore.setTraceCurrent(taskId, current.toJson());
            stateStore.setTraceDesired(taskId, desired.toJson());
            stateStore.setTraceDiff(taskId, objectMapper.valueToTree(plan));
        }
        structuredLogger.reconciliation().planned(taskId, plan.size(), controls.dryRun());

        if (controls.dryRun()) {
            stateStore.setCurrentConfig(taskId, current);
            finish(taskId, TaskState.SUCCEEDED, 200, TaskResult.STATUS_OK, MESSAGE_DRY_RUN, null);
            return "dry_run";
        }

        // ==================== Apply ====================

        stateStore.setRollbackInfo(taskId, current);
        stateStore.transition(taskId, TaskState.APPLYING, plan.size() + " operation(s) planned");
        MutationTrackingDeviceClient tracking = new MutationTrackingDeviceClient(client);
        HandlerOutcome applied;
        try {
            applied = applyEngine.apply(plan, desired, current, tracking);
        } catch (ApplyException e) {
            recordFailure(taskId, e.getConfigClass(), e.getObjectName(), e);
            return handleApplyFailure(taskId, e, tracking, client);
        } catch (DeviceClientException e) {
            recordFailure(taskId, null, null, e);
            return handleApplyFailure(taskId, e, tracking, client);
        }

        stateStore.setAppliedSecrets(machineId, planner.secretDigests(desired).asMap());
        DeviceConfig after = reader.read(client);
        stateStore.setCurrentConfig(taskId, after);
        stateStore.setRebootRequired(taskId, applied.rebootRequired());
        finish(taskId, TaskState.SUCCEEDED, 200, TaskResult.STATUS_OK, MESSAGE_SUCCESS, null);
        structuredLogger.reconciliation().completed(taskId,
            Duration.between(start, clock.instant()).toMillis(), applied.rebootRequired());
        log.info("Task {} applied {} operation(s)", taskId, applied.operationsApplied());
        return "succeeded";
    }

    private String handleApplyFailure(String taskId, OnboardingException failure,
                                      MutationTrackingDeviceClient tracking, DeviceClient client) {
        List<String> errors = List.of(failure.getMessage());
        if (!tracking.hasMutated()) {
            finish(taskId, TaskState.FAILED, 422, TaskResult.STATUS_ERROR, MESSAGE_INVALID, errors);
            return "failed";
        }

        log.warn("Apply of task {} failed after {} device change(s), rolling back",
            taskId, tracking.getMutationCount());
        stateStore.updateResult(taskId, 202, TaskResult.STATUS_ROLLING_BACK, MESSAGE_ROLLING_BACK, errors);
        stateStore.transition(taskId, TaskState.ROLLING_BACK, failure.getMessage());
        try {
            rollbackManager.rollback(stateStore.getTask(taskId), client);
            finish(taskId, TaskState.ROLLED_BACK, 422, TaskResult.STATUS_ERROR, MESSAGE_ROLLED_BACK, null);
            return "rolled_back";
        } catch (RollbackException e) {
            metricsRegistry.recordError(e.getErrorCode().getCode());
            finish(taskId, TaskState.FAILED, 500, TaskResult.STATUS_ERROR, MESSAGE_ROLLBACK_FAILED,
                List.of(e.getMessage()));
            return "rollback_failed";
        }
    }

    private DeviceConfig originalConfigFor(String machineId, DeviceConfig current) {
        return stateStore.getOriginalConfigByConfigId(machineId).orElseGet(() -> {
            log.info("Recording original configuration for device {}", machineId);
            stateStore.setOriginalConfigByConfigId(machineId, current);
            return current;
        });
    }

    private void finish(String taskId, TaskState state, int code, String status, String message, List<String> errors) {
        stateStore.updateResult(taskId, code, status, message, errors);
        stateStore.transition(taskId, state, message);
    }

    private void failIfPossible(String taskId, int code, String message, List<String> errors) {
        TaskState state = currentState(taskId);
        if (state != null && StateStore.isTransitionAllowed(state, TaskState.FAILED)) {
            finish(taskId, TaskState.FAILED, code, TaskResult.STATUS_ERROR, message, errors);
        }
    }

    private void recordFailure(String taskId, String configClass, String objectName, OnboardingException e) {
        metricsRegistry.recordError(e.getErrorCode().getCode());
        structuredLogger.reconciliation().failed(taskId, configClass, objectName,
            e.getErrorCode().getCode(), e.getMessage());
    }

    private TaskState currentState(String taskId) {
        return stateStore.getTaskIds().contains(taskId) ? stateStore.getState(taskId) : null;
    }
}
