package com.platform.onboarding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.platform.onboarding.handler.AuthenticationHandler;
import com.platform.onboarding.handler.CertificateInstaller;
import com.platform.onboarding.handler.DscHandler;
import com.platform.onboarding.handler.FirewallHandler;
import com.platform.onboarding.handler.GslbHandler;
import com.platform.onboarding.handler.NetworkHandler;
import com.platform.onboarding.handler.ResourceWriter;
import com.platform.onboarding.handler.StepRunner;
import com.platform.onboarding.handler.SystemHandler;
import com.platform.onboarding.observability.MetricsRegistry;
import com.platform.onboarding.observability.StructuredLogger;
import com.platform.onboarding.persistence.InMemoryStatePersistence;
import com.platform.onboarding.plan.DiffPlanner;
import com.platform.onboarding.plan.ReferenceResolver;
import com.platform.onboarding.reconciliation.ApplyEngine;
import com.platform.onboarding.reconciliation.DeclarationSchemaValidator;
import com.platform.onboarding.reconciliation.ReconciliationCoordinator;
import com.platform.onboarding.reconciliation.RollbackManager;
import com.platform.onboarding.schema.SchemaMap;
import com.platform.onboarding.state.StateStore;
import com.platform.onboarding.state.StateUpgrader;
import com.platform.onboarding.translate.ConfigTranslator;
import com.platform.onboarding.translate.DeviceConfigReader;
import com.platform.onboarding.translate.IdentifierMigrator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

/**
 * The whole engine wired by hand over in-memory persistence, for tests
 * that drive declarations end to end against a fake device.
 */
public class EngineFixture implements AutoCloseable {

    public static final String VERSION = "1.30.0-3";

    public final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    public final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    public final SchemaMap schema = SchemaMap.standard();
    public final IdentifierMigrator migrator = new IdentifierMigrator(schema);
    public final ConfigTranslator translator = new ConfigTranslator(schema, migrator);
    public final DeviceConfigReader reader = new DeviceConfigReader(schema, translator);
    public final ReferenceResolver referenceResolver = new ReferenceResolver(schema);
    public final DiffPlanner planner = new DiffPlanner(schema, referenceResolver);
    public final MetricsRegistry metrics = new MetricsRegistry(new SimpleMeterRegistry());
    public final StructuredLogger structuredLogger = new StructuredLogger();
    public final StepRunner runner = new StepRunner(2);
    public final ApplyEngine applyEngine;
    public final InMemoryStatePersistence persistence = new InMemoryStatePersistence();
    public final StateUpgrader upgrader = new StateUpgrader(migrator, VERSION, clock);
    public final StateStore stateStore;
    public final RollbackManager rollbackManager;
    public final ReconciliationCoordinator coordinator;

    public EngineFixture() {
        ResourceWriter writer = new ResourceWriter(schema, translator);
        CertificateInstaller certificates = new CertificateInstaller();
        applyEngine = new ApplyEngine(List.of(
            new SystemHandler(writer, runner, certificates),
            new NetworkHandler(writer, runner),
            new FirewallHandler(writer, runner),
            new DscHandler(writer, runner, reader),
            new AuthenticationHandler(writer, runner, certificates),
            new GslbHandler(writer, runner)), metrics);
        stateStore = newStateStore();
        stateStore.load();
        rollbackManager = new RollbackManager(reader, planner, applyEngine, metrics, structuredLogger, clock);
        coordinator = new ReconciliationCoordinator(
            new DeclarationSchemaValidator(schema, List.of("1.30.0", "1.29.0", "1.0.0")),
            translator, reader, referenceResolver, planner, applyEngine, rollbackManager,
            stateStore, metrics, structuredLogger, objectMapper, clock);
    }

    /**
     * A second store over the same persistence, as after a restart.
     */
    public StateStore newStateStore() {
        return new StateStore(persistence, upgrader, objectMapper, metrics, structuredLogger,
            Duration.ofDays(7), clock);
    }

    public JsonNode json(String text) {
        try {
            return objectMapper.readTree(text.replace('\'', '"'));
        } catch (Exception e) {
            throw new IllegalArgumentException("Bad test JSON: " + text, e);
        }
    }

    @Override
    public void close() {
        runner.close();
    }

    /**
     * Clock the test moves by hand.
     */
    public static class MutableClock extends Clock {

        private volatile Instant now;

        public MutableClock(Instant start) {
            this.now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
