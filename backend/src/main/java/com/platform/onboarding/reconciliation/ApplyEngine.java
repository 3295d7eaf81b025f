package com.platform.onboarding.reconciliation;

import com.platform.onboarding.device.DeviceClient;
import com.platform.onboarding.handler.DomainHandler;
import com.platform.onboarding.handler.DomainSlice;
import com.platform.onboarding.handler.HandlerOutcome;
import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.model.Operation;
import com.platform.onboarding.observability.LoggingConfig;
import com.platform.onboarding.observability.MetricsRegistry;
import com.platform.onboarding.schema.Domain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Drives a plan through the domain handlers.
 *
 * The plan is cut into maximal runs of consecutive operations of the same
 * domain. Runs are dispatched one at a time in plan order; a failing run
 * stops the apply and later runs never start.
 */
@Slf4j
@Component
public class ApplyEngine {

    private final Map<Domain, DomainHandler> handlers;
    private final MetricsRegistry metricsRegistry;

    public ApplyEngine(List<DomainHandler> handlers, MetricsRegistry metricsRegistry) {
        this.handlers = new EnumMap<>(Domain.class);
        for (DomainHandler handler : handlers) {
            DomainHandler previous = this.handlers.put(handler.domain(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for domain " + handler.domain());
            }
        }
        for (Domain domain : Domain.values()) {
            if (!this.handlers.containsKey(domain)) {
                throw new IllegalStateException("No handler registered for domain " + domain);
            }
        }
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Applies every operation of the plan.
     *
     * @throws com.platform.onboarding.error.ApplyException from the first failing handler
     */
    public HandlerOutcome apply(List<Operation> plan, DeviceConfig desired, DeviceConfig current, DeviceClient client) {
        HandlerOutcome outcome = HandlerOutcome.none();
        for (DomainSlice slice : slices(plan, desired, current)) {
            DomainHandler handler = handlers.get(slice.domain());
            LoggingConfig.setOperationContext(slice.domain().name(), null);
            try {
                log.debug("Applying {} operation(s) in domain {}", slice.operations().size(), slice.domain());
                HandlerOutcome result = handler.process(slice, client);
                slice.operations().forEach(op ->
                    metricsRegistry.recordOperation(op.configClass().getDeclaredName(), op.kind().name()));
                outcome = outcome.combine(result);
            } finally {
                LoggingConfig.clearOperationContext();
            }
        }
        return outcome;
    }

    /**
     * Splits a plan into maximal contiguous runs of one domain, preserving order.
     */
    static List<DomainSlice> slices(List<Operation> plan, DeviceConfig desired, DeviceConfig current) {
        List<DomainSlice> slices = new ArrayList<>();
        List<Operation> run = new ArrayList<>();
        Domain runDomain = null;
        for (Operation operation : plan) {
            if (runDomain != null && operation.domain() != runDomain) {
                slices.add(new DomainSlice(runDomain, run, desired, current));
                run = new ArrayList<>();
            }
            runDomain = operation.domain();
            run.add(operation);
        }
        if (!run.isEmpty()) {
            slices.add(new DomainSlice(runDomain, run, desired, current));
        }
        return slices;
    }
}
