package com.platform.onboarding.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.context.annotation.Bean;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation ids per request and task context in the MDC.
 */
@Slf4j
@Configuration
public class LoggingConfig {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_TASK_ID = "taskId";
    public static final String MDC_DOMAIN = "domain";
    public static final String MDC_CONFIG_CLASS = "configClass";

    @Value("${spring.application.name:declarative-onboarding}")
    private String applicationName;

    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);

        log.info("Logging configuration initialized for application: {}", applicationName);
    }

    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }

    public static class CorrelationIdFilter extends OncePerRequestFilter {

        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_REQUEST_PATH = "requestPath";
        private static final String MDC_REQUEST_METHOD = "requestMethod";

        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {

            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }

                MDC.put(MDC_CORRELATION_ID, correlationId);
                MDC.put(MDC_REQUEST_PATH, request.getRequestURI());
                MDC.put(MDC_REQUEST_METHOD, request.getMethod());

                response.setHeader(CORRELATION_ID_HEADER, correlationId);

                filterChain.doFilter(request, response);

            } finally {
                MDC.remove(MDC_CORRELATION_ID);
                MDC.remove(MDC_REQUEST_PATH);
                MDC.remove(MDC_REQUEST_METHOD);
            }
        }
    }

    /**
     * Set the task being reconciled on this thread.
     */
    public static void setTaskContext(String taskId) {
        MDC.put(MDC_TASK_ID, taskId);
    }

    public static void clearTaskContext() {
        MDC.remove(MDC_TASK_ID);
        MDC.remove(MDC_DOMAIN);
        MDC.remove(MDC_CONFIG_CLASS);
    }

    /**
     * Set the domain and class being applied for detailed logging.
     */
    public static void setOperationContext(String domain, String configClass) {
        MDC.put(MDC_DOMAIN, domain);
        if (configClass != null) {
            MDC.put(MDC_CONFIG_CLASS, configClass);
        }
    }

    public static void clearOperationContext() {
        MDC.remove(MDC_DOMAIN);
        MDC.remove(MDC_CONFIG_CLASS);
    }
}
