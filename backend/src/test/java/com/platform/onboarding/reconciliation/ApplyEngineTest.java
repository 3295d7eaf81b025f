package com.platform.onboarding.reconciliation;

import com.platform.onboarding.device.DeviceClient;
import com.platform.onboarding.error.ApplyException;
import com.platform.onboarding.handler.DomainHandler;
import com.platform.onboarding.handler.DomainSlice;
import com.platform.onboarding.handler.HandlerOutcome;
import com.platform.onboarding.model.ConfigObject;
import com.platform.onboarding.model.DeviceConfig;
import com.platform.onboarding.model.Operation;
import com.platform.onboarding.observability.MetricsRegistry;
import com.platform.onboarding.schema.ConfigClass;
import com.platform.onboarding.schema.Domain;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ApplyEngineTest {

    private final Map<Domain, DomainHandler> handlers = new EnumMap<>(Domain.class);
    private final DeviceClient client = mock(DeviceClient.class);
    private ApplyEngine engine;

    @BeforeEach
    void setup() {
        for (Domain domain : Domain.values()) {
            DomainHandler handler = mock(DomainHandler.class);
            when(handler.domain()).thenReturn(domain);
            when(handler.process(any(), any())).thenAnswer(invocation ->
                new HandlerOutcome(((DomainSlice) invocation.getArgument(0)).operations().size(), false));
            handlers.put(domain, handler);
        }
        engine = new ApplyEngine(new ArrayList<>(handlers.values()), new MetricsRegistry(new SimpleMeterRegistry()));
    }

    private static Operation create(ConfigClass configClass, String name) {
        return Operation.create(configClass, name, ConfigObject.empty());
    }

    @Test
    void GIVEN_interleaved_domains_WHEN_sliced_THEN_contiguous_runs_kept_in_order() {
        List<Operation> plan = List.of(
            create(ConfigClass.USER, "u1"),
            create(ConfigClass.VLAN, "v1"),
            create(ConfigClass.ROUTE_DOMAIN, "rd"),
            create(ConfigClass.FIREWALL_POLICY, "p1"),
            create(ConfigClass.SELF_IP, "s1"));

        List<DomainSlice> slices = ApplyEngine.slices(plan, DeviceConfig.empty(), DeviceConfig.empty());

        assertThat(slices.stream().map(DomainSlice::domain).toList(),
            contains(Domain.SYSTEM, Domain.NETWORK, Domain.FIREWALL, Domain.NETWORK));
        assertEquals(2, slices.get(1).operations().size());
    }

    @Test
    void GIVEN_empty_plan_WHEN_applied_THEN_no_handler_called() {
        HandlerOutcome outcome = engine.apply(List.of(), DeviceConfig.empty(), DeviceConfig.empty(), client);

        assertEquals(0, outcome.operationsApplied());
        handlers.values().forEach(handler -> verify(handler, never()).process(any(), any()));
    }

    @Test
    void GIVEN_plan_WHEN_applied_THEN_handlers_called_in_plan_order_and_outcomes_combined() {
        doReturn(new HandlerOutcome(1, true)).when(handlers.get(Domain.SYSTEM)).process(any(), any());

        HandlerOutcome outcome = engine.apply(List.of(
            create(ConfigClass.VLAN, "v1"),
            create(ConfigClass.USER, "u1"),
            create(ConfigClass.VLAN, "v2")), DeviceConfig.empty(), DeviceConfig.empty(), client);

        InOrder order = inOrder(handlers.get(Domain.NETWORK), handlers.get(Domain.SYSTEM));
        order.verify(handlers.get(Domain.NETWORK)).process(any(), any());
        order.verify(handlers.get(Domain.SYSTEM)).process(any(), any());
        order.verify(handlers.get(Domain.NETWORK)).process(any(), any());
        assertEquals(3, outcome.operationsApplied());
        assertTrue(outcome.rebootRequired());
    }

    @Test
    void GIVEN_handler_fails_WHEN_applied_THEN_later_slices_never_start() {
        doThrow(new ApplyException("VLAN", "v1", "/tm/net/vlan", "boom"))
            .when(handlers.get(Domain.NETWORK)).process(any(), any());

        assertThrows(ApplyException.class, () -> engine.apply(List.of(
            create(ConfigClass.VLAN, "v1"),
            create(ConfigClass.GSLB_DATA_CENTER, "dc1")), DeviceConfig.empty(), DeviceConfig.empty(), client));

        verify(handlers.get(Domain.GSLB), never()).process(any(), any());
    }

    @Test
    void GIVEN_missing_domain_handler_WHEN_constructed_THEN_rejected() {
        List<DomainHandler> partial = new ArrayList<>(handlers.values());
        partial.remove(handlers.get(Domain.GSLB));

        assertThrows(IllegalStateException.class,
            () -> new ApplyEngine(partial, new MetricsRegistry(new SimpleMeterRegistry())));
    }
}
