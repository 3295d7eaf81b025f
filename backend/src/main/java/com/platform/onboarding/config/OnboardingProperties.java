package com.platform.onboarding.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the onboarding service.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "onboarding")
@Validated
public class OnboardingProperties {
    
    /**
     * Product version stamped on stored original configurations.
     */
    @NotBlank
    private String version = "1.30.0";
    
    /**
     * Release number, combined with version as VERSION-RELEASE.
     */
    @NotBlank
    private String release = "3";
    
    /**
     * Tasks whose last update is older than this are purged when a new task is added.
     */
    private Duration taskRetention = Duration.ofDays(7);
    
    /**
     * Declaration schema versions accepted by the validator.
     */
    @NotEmpty
    private List<String> supportedSchemaVersions = new ArrayList<>(List.of(
        "1.30.0", "1.29.0", "1.28.0", "1.27.0", "1.26.0", "1.25.0", "1.24.0", "1.23.0",
        "1.22.0", "1.21.0", "1.20.0", "1.19.0", "1.18.0", "1.17.0", "1.16.0", "1.15.0",
        "1.14.0", "1.13.0", "1.12.0", "1.11.0", "1.10.0", "1.9.0", "1.8.0", "1.7.0",
        "1.6.0", "1.5.0", "1.4.0", "1.3.0", "1.2.0", "1.1.0", "1.0.0"));
    
    @Valid
    private Apply apply = new Apply();
    
    @Valid
    private Device device = new Device();
    
    public String getVersionRelease() {
        return version + "-" + release;
    }
    
    /**
     * Execution limits for reconciliation.
     */
    @Data
    public static class Apply {
        /**
         * Maximum concurrent device requests for independent steps.
         */
        @Min(1)
        private int maxParallel = 4;
        
        /**
         * Worker threads running asynchronous tasks.
         */
        @Min(1)
        private int asyncPoolSize = 2;
    }
    
    /**
     * Connection settings for the managed device.
     */
    @Data
    public static class Device {
        private String host = "localhost";
        private int port = 443;
        private String scheme = "https";
        private String username = "admin";
        private String password = "";
        private int connectionTimeoutMs = 5000;
        private int readTimeoutMs = 60000;
        
        /**
         * Attempts per request, including the first, for retryable failures.
         */
        @Min(1)
        private int retryAttempts = 3;
        private long retryWaitMs = 1000;
        
        public String getBaseUrl() {
            return String.format("%s://%s:%d/mgmt", scheme, host, port);
        }
    }
}
