package com.platform.onboarding.device;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.platform.onboarding.config.OnboardingProperties;
import com.platform.onboarding.error.DeviceClientException;
import com.platform.onboarding.observability.MetricsRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * HTTP client for the device management API.
 * Transient failures (transport errors, 5xx) are retried with a fixed wait.
 * An interrupted request surfaces as {@link CancellationException} with the
 * interrupt flag restored; it is never retried or reported as a device error.
 */
@Slf4j
@Component
public class RestDeviceClient implements DeviceClient {
    
    private static final int MAX_ERROR_BODY = 500;
    
    private final OnboardingProperties.Device config;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;
    private final HttpClient httpClient;
    private final Retry retry;
    
    @Autowired
    public RestDeviceClient(OnboardingProperties properties, ObjectMapper objectMapper, MetricsRegistry metricsRegistry) {
        this(properties, objectMapper, metricsRegistry, HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getDevice().getConnectionTimeoutMs()))
            .build());
    }
    
    RestDeviceClient(OnboardingProperties properties, ObjectMapper objectMapper, MetricsRegistry metricsRegistry,
                     HttpClient httpClient) {
        this.config = properties.getDevice();
        this.objectMapper = objectMapper;
        this.metricsRegistry = metricsRegistry;
        this.httpClient = httpClient;
        
        RetryConfig retryConfig = RetryConfig.custom()
            .maxAttempts(Math.max(1, config.getRetryAttempts()))
            .waitDuration(Duration.ofMillis(config.getRetryWaitMs()))
            .retryOnException(e -> e instanceof DeviceClientException dce && dce.isRetryable())
            .build();
        this.retry = Retry.of("device", retryConfig);
        this.retry.getEventPublisher().onRetry(event -> {
            log.warn("Retrying device request (attempt {}): {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage());
            metricsRegistry.recordRetryAttempt("device", event.getNumberOfRetryAttempts());
        });
    }
    
    @Override
    public JsonNode get(String path, RequestOptions options) {
        return execute("GET", path, null, options);
    }
    
    @Override
    public JsonNode create(String path, JsonNode body, RequestOptions options) {
        return execute("POST", path, serialize(path, body), options);
    }
    
    @Override
    public JsonNode modify(String path, JsonNode body, RequestOptions options) {
        return execute("PATCH", path, serialize(path, body), options);
    }
    
    @Override
    public void delete(String path, RequestOptions options) {
        execute("DELETE", path, null, options);
    }
    
    @Override
    public JsonNode upload(String path, String content, RequestOptions options) {
        return execute("POST", path, content, options);
    }
    
    private String serialize(String path, JsonNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DeviceClientException("SERIALIZE", path, e);
        }
    }
    
    private JsonNode execute(String method, String path, String body, RequestOptions options) {
        Supplier<JsonNode> call = () -> send(method, path, body, options);
        return options.retry() ? Retry.decorateSupplier(retry, call).get() : call.get();
    }
    
    private JsonNode send(String method, String path, String body, RequestOptions options) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(config.getBaseUrl() + path))
            .timeout(Duration.ofMillis(config.getReadTimeoutMs()))
            .header("Authorization", basicAuth())
            .header("Content-Type", options.headers().getOrDefault("Content-Type", "application/json"));
        // the HTTP client computes Content-Length itself and rejects it as a header
        options.headers().forEach((name, value) -> {
            if (!name.equalsIgnoreCase("Content-Type") && !name.equalsIgnoreCase("Content-Length")) {
                builder.header(name, value);
            }
        });
        
        HttpRequest.BodyPublisher publisher = body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8);
        builder.method(method, publisher);
        
        if (options.silent()) {
            log.debug("{} {} (body suppressed)", method, path);
        } else {
            log.debug("{} {} {}", method, path, body != null ? body : "");
        }
        
        long start = System.currentTimeMillis();
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            metricsRegistry.recordDeviceRequest(method, System.currentTimeMillis() - start, false);
            throw new DeviceClientException(method, path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted during " + method + " " + path);
            cancelled.initCause(e);
            throw cancelled;
        }
        
        int status = response.statusCode();
        boolean success = status >= 200 && status < 300;
        metricsRegistry.recordDeviceRequest(method, System.currentTimeMillis() - start, success);
        
        if (!success) {
            String detail = options.silent() ? "(response suppressed)" : truncate(response.body());
            throw new DeviceClientException(method, path, status, detail);
        }
        return parse(response.body());
    }
    
    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return JsonNodeFactory.instance.objectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Non-JSON device response: {}", truncate(body));
            return JsonNodeFactory.instance.textNode(body);
        }
    }
    
    private String basicAuth() {
        String credentials = config.getUsername() + ":" + config.getPassword();
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
    
    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "..." : body;
    }
}
