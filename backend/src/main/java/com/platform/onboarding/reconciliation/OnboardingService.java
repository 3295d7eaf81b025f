package com.platform.onboarding.reconciliation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.config.OnboardingProperties;
import com.platform.onboarding.device.DeviceClient;
import com.platform.onboarding.model.ConfigObject;
import com.platform.onboarding.model.Declaration;
import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.state.StateStore;
import com.platform.onboarding.state.Task;
import com.platform.onboarding.translate.DeviceConfigReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point for submitting declarations and reading tasks.
 *
 * Synchronous declarations are reconciled on the calling thread; asynchronous
 * ones are handed to the onboarding executor and the caller polls the task.
 */
@Slf4j
@Service
public class OnboardingService {

    private final ReconciliationCoordinator coordinator;
    private final StateStore stateStore;
    private final DeviceConfigReader reader;
    private final DeviceClient deviceClient;
    private final TaskExecutor executor;
    private final OnboardingProperties properties;

    public OnboardingService(
            ReconciliationCoordinator coordinator,
            StateStore stateStore,
            DeviceConfigReader reader,
            DeviceClient deviceClient,
            @Qualifier("onboardingExecutor") TaskExecutor executor,
            OnboardingProperties properties) {
        this.coordinator = coordinator;
        this.stateStore = stateStore;
        this.reader = reader;
        this.deviceClient = deviceClient;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * Creates a task for the declaration and starts reconciling it.
     *
     * @return the task as of return: still running for async declarations, terminal otherwise
     */
    public Task submit(JsonNode declaration) {
        String taskId = stateStore.addTask();
        boolean async = Declaration.of(declaration).isAsync();
        log.info("Accepted declaration as task {} (async={})", taskId, async);

        if (async) {
            executor.execute(() -> coordinator.reconcile(taskId, declaration, deviceClient));
        } else {
            coordinator.reconcile(taskId, declaration, deviceClient);
        }
        return stateStore.getTask(taskId);
    }

    public Task getTask(String taskId) {
        return stateStore.getTask(taskId);
    }

    public List<String> listTaskIds() {
        return stateStore.getTaskIds();
    }

    public List<Task> listTasks() {
        return stateStore.getTaskIds().stream()
            .map(stateStore::getTask)
            .toList();
    }

    /**
     * Reads the device and renders its configuration as a declaration.
     *
     * Named objects are keyed by name, falling back to {@code <Class>_<name>}
     * when two classes share a name. Nameless classes appear as {@code current<Class>}.
     */
    public ObjectNode inspect() {
        DeviceConfig current = reader.read(deviceClient);

        ObjectNode declaration = JsonNodeFactory.instance.objectNode();
        declaration.put("class", "Device");
        declaration.put("schemaVersion", properties.getVersion());
        ObjectNode common = declaration.putObject(Declaration.COMMON);
        common.put("class", "Tenant");

        for (ConfigClass configClass : ConfigClass.values()) {
            if (configClass.isNameless()) {
                current.nameless(configClass).ifPresent(object ->
                    common.set("current" + configClass.getDeclaredName(), render(configClass, object)));
                continue;
            }
            for (Map.Entry<String, ConfigObject> entry : current.named(configClass).entrySet()) {
                String key = common.has(entry.getKey())
                    ? configClass.getDeclaredName() + "_" + entry.getKey()
                    : entry.getKey();
                common.set(key, render(configClass, entry.getValue()));
            }
        }
        return declaration;
    }

    private static ObjectNode render(ConfigClass configClass, ConfigObject object) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("class", configClass.getDeclaredName());
        node.setAll(object.toJson());
        return node;
    }
}
