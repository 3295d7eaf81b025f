package com.platform.onboarding.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.reconciliation.OnboardingService;
import com.platform.onboarding.state.Task;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for submitting declarations and polling tasks.
 */
@RestController
@RequestMapping("/mgmt/onboarding")
public class OnboardingController {

    static final String TASK_PATH = "/mgmt/onboarding/task";

    private final OnboardingService onboardingService;

    public OnboardingController(OnboardingService onboardingService) {
        this.onboardingService = onboardingService;
    }

    /**
     * The HTTP status mirrors the task result code: 202 while running.
     */
    @PostMapping("/declare")
    public ResponseEntity<TaskView> declare(@RequestBody JsonNode declaration) {
        return respond(onboardingService.submit(declaration));
    }

    @GetMapping("/task")
    public List<TaskView> listTasks() {
        return onboardingService.listTasks().stream()
            .map(task -> TaskView.of(task, TASK_PATH))
            .toList();
    }

    @GetMapping("/task/{taskId}")
    public ResponseEntity<TaskView> getTask(@PathVariable String taskId) {
        return respond(onboardingService.getTask(taskId));
    }

    @GetMapping("/inspect")
    public ObjectNode inspect() {
        return onboardingService.inspect();
    }

    private static ResponseEntity<TaskView> respond(Task task) {
        return ResponseEntity.status(task.getResult().getCode()).body(TaskView.of(task, TASK_PATH));
    }
}
