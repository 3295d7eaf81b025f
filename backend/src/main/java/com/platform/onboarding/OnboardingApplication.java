package com.platform.onboarding;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Declarative Onboarding Application
 *
 * Reconciles network appliances against declared configuration:
 * - System, network, authentication, DSC, firewall and GSLB classes
 * - Dependency-ordered create/modify/delete plans
 * - Rollback to the pre-apply snapshot on partial failure
 * - Asynchronous tasks with persisted, versioned state
 */
@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties
public class OnboardingApplication {

    public static void main(String[] args) {
        SpringApplication.run(OnboardingApplication.class, args);
    }
}
