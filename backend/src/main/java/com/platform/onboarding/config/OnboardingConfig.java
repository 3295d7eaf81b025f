package com.platform.onboarding.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.onboarding.handler.CertificateInstaller;
import com.platform.onboarding.handler.ResourceWriter;
import com.platform.onboarding.handler.StepRunner;
import com.platform.onboarding.observability.MetricsRegistry;
import com.platform.onboarding.observability.StructuredLogger;
import com.platform.onboarding.persistence.JpaStatePersistence;
import com.platform.onboarding.persistence.StatePersistence;
import com.platform.onboarding.persistence.repository.StateRecordJpaRepository;
import com.platform.onboarding.plan.DiffPlanner;
import com.platform.onboarding.plan.ReferenceResolver;
import com.platform.onboarding.reconciliation.ApplyEngine;
import com.platform.onboarding.reconciliation.DeclarationSchemaValidator;
import com.platform.onboarding.reconciliation.ReconciliationCoordinator;
import com.platform.onboarding.reconciliation.RollbackManager;
import com.platform.onboarding.reconciliation.SchemaValidator;
import com.platform.onboarding.schema.SchemaMap;
import com.platform.onboarding.state.StateStore;
import com.platform.onboarding.state.StateUpgrader;
import com.platform.onboarding.translate.ConfigTranslator;
import com.platform.onboarding.translate.DeviceConfigReader;
import com.platform.onboarding.translate.IdentifierMigrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Wiring for the reconciliation engine.
 *
 * Engine classes carry no Spring annotations so they can be built directly
 * in tests; this class is the only place they are assembled.
 */
@Slf4j
@Configuration
public class OnboardingConfig {

    // ==================== Schema & Translation ====================

    @Bean
    public SchemaMap schemaMap() {
        return SchemaMap.standard();
    }

    @Bean
    public IdentifierMigrator identifierMigrator(SchemaMap schemaMap) {
        return new IdentifierMigrator(schemaMap);
    }

    @Bean
    public ConfigTranslator configTranslator(SchemaMap schemaMap, IdentifierMigrator identifierMigrator) {
        return new ConfigTranslator(schemaMap, identifierMigrator);
    }

    @Bean
    public DeviceConfigReader deviceConfigReader(SchemaMap schemaMap, ConfigTranslator configTranslator) {
        return new DeviceConfigReader(schemaMap, configTranslator);
    }

    @Bean
    public SchemaValidator schemaValidator(SchemaMap schemaMap, OnboardingProperties properties) {
        return new DeclarationSchemaValidator(schemaMap, properties.getSupportedSchemaVersions());
    }

    // ==================== Planning ====================

    @Bean
    public ReferenceResolver referenceResolver(SchemaMap schemaMap) {
        return new ReferenceResolver(schemaMap);
    }

    @Bean
    public DiffPlanner diffPlanner(SchemaMap schemaMap, ReferenceResolver referenceResolver) {
        return new DiffPlanner(schemaMap, referenceResolver);
    }

    // ==================== Apply ====================

    @Bean
    public ResourceWriter resourceWriter(SchemaMap schemaMap, ConfigTranslator configTranslator) {
        return new ResourceWriter(schemaMap, configTranslator);
    }

    @Bean(destroyMethod = "close")
    public StepRunner stepRunner(OnboardingProperties properties) {
        return new StepRunner(properties.getApply().getMaxParallel());
    }

    @Bean
    public CertificateInstaller certificateInstaller() {
        return new CertificateInstaller();
    }

    @Bean
    public RollbackManager rollbackManager(DeviceConfigReader deviceConfigReader, DiffPlanner diffPlanner,
                                           ApplyEngine applyEngine, MetricsRegistry metricsRegistry,
                                           StructuredLogger structuredLogger, Clock clock) {
        return new RollbackManager(deviceConfigReader, diffPlanner, applyEngine, metricsRegistry,
            structuredLogger, clock);
    }

    @Bean(name = "onboardingExecutor")
    public ThreadPoolTaskExecutor onboardingExecutor(OnboardingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getApply().getAsyncPoolSize());
        executor.setMaxPoolSize(properties.getApply().getAsyncPoolSize());
        executor.setThreadNamePrefix("onboarding-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    // ==================== State ====================

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StatePersistence statePersistence(StateRecordJpaRepository repository, ObjectMapper objectMapper) {
        return new JpaStatePersistence(repository, objectMapper);
    }

    @Bean
    public StateUpgrader stateUpgrader(IdentifierMigrator identifierMigrator, OnboardingProperties properties,
                                       Clock clock) {
        return new StateUpgrader(identifierMigrator, properties.getVersionRelease(), clock);
    }

    @Bean
    public StateStore stateStore(StatePersistence statePersistence, StateUpgrader stateUpgrader,
                                 ObjectMapper objectMapper, MetricsRegistry metricsRegistry,
                                 StructuredLogger structuredLogger, OnboardingProperties properties, Clock clock) {
        StateStore store = new StateStore(statePersistence, stateUpgrader, objectMapper, metricsRegistry,
            structuredLogger, properties.getTaskRetention(), clock);
        store.load();
        log.info("State store ready, engine version {}", properties.getVersionRelease());
        return store;
    }

    // ==================== Coordinator ====================

    @Bean
    public ReconciliationCoordinator reconciliationCoordinator(
            SchemaValidator schemaValidator,
            ConfigTranslator configTranslator,
            DeviceConfigReader deviceConfigReader,
            ReferenceResolver referenceResolver,
            DiffPlanner diffPlanner,
            ApplyEngine applyEngine,
            RollbackManager rollbackManager,
            StateStore stateStore,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            ObjectMapper objectMapper,
            Clock clock) {
        return new ReconciliationCoordinator(schemaValidator, configTranslator, deviceConfigReader,
            referenceResolver, diffPlanner, applyEngine, rollbackManager, stateStore, metricsRegistry,
            structuredLogger, objectMapper, clock);
    }
}
