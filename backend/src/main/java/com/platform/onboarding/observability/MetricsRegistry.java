package com.platform.onboarding.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for all application metrics.
 * Records task transitions, planned operations, device calls and rollbacks.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final AtomicInteger activeTasks;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.activeTasks = new AtomicInteger(0);
        
        Gauge.builder("onboarding.tasks.active", activeTasks, AtomicInteger::get)
            .register(meterRegistry);
        log.info("Metrics registry initialized");
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Record a task state transition.
     */
    public void recordTaskTransition(Object fromState, Object toState) {
        String from = fromState != null ? fromState.toString() : "none";
        String to = toState != null ? toState.toString() : "unknown";
        
        incrementCounter("onboarding.task.transition", "from", from, "to", to);
        log.debug("Recorded task transition: {} -> {}", from, to);
    }
    
    /**
     * Record a rejected task state transition.
     */
    public void recordInvalidTransition(Object fromState, Object toState) {
        incrementCounter("onboarding.task.transition.invalid",
            "from", String.valueOf(fromState), "to", String.valueOf(toState));
    }
    
    /**
     * Record a planned operation applied to the device.
     */
    public void recordOperation(String configClass, String kind) {
        incrementCounter("onboarding.operations", "class", configClass, "kind", kind);
    }
    
    /**
     * Record latency of one device request.
     */
    public void recordDeviceRequest(String method, long latencyMs, boolean success) {
        Timer timer = timers.computeIfAbsent("device." + method + "." + success, k ->
            Timer.builder("onboarding.device.request")
                .tag("method", method)
                .tag("success", String.valueOf(success))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(Duration.ofMillis(latencyMs));
    }
    
    /**
     * Record retry attempt against the device.
     */
    public void recordRetryAttempt(String method, int attemptNumber) {
        incrementCounter("onboarding.device.retry", "method", method, "attempt", String.valueOf(attemptNumber));
    }
    
    /**
     * Record the outcome and duration of one reconciliation.
     */
    public void recordReconciliation(String outcome, Duration duration) {
        Timer timer = timers.computeIfAbsent("reconciliation." + outcome, k ->
            Timer.builder("onboarding.reconciliation.duration")
                .tag("outcome", outcome)
                .register(meterRegistry));
        timer.record(duration);
    }
    
    /**
     * Record a rollback attempt.
     */
    public void recordRollback(boolean success) {
        incrementCounter("onboarding.rollback", "success", String.valueOf(success));
    }
    
    /**
     * Record an error surfaced to clients or tasks.
     */
    public void recordError(String errorCode) {
        incrementCounter("onboarding.errors", "code", errorCode);
    }
    
    public void taskStarted() {
        activeTasks.incrementAndGet();
    }
    
    public void taskFinished() {
        activeTasks.decrementAndGet();
    }
}
