package com.audioflow.processing.health;

import com.audioflow.config.AppProperties;
import com.audioflow.processing.service.RecognitionAdapter;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports which recognition backend serves the provider pipeline.
 *
 * <p>UP with {@code backend=provider} when Azure Speech is configured, UP with
 * {@code backend=simulated} otherwise. Exposed via /actuator/health.
 */
@Component
public class RecognitionHealthIndicator implements HealthIndicator {

    private final RecognitionAdapter recognitionAdapter;
    private final AppProperties appProperties;

    public RecognitionHealthIndicator(RecognitionAdapter recognitionAdapter, AppProperties appProperties) {
        this.recognitionAdapter = recognitionAdapter;
        this.appProperties = appProperties;
    }

    @Override
    public Health health() {
        Health.Builder builder = recognitionAdapter.isAvailable() ? Health.up() : Health.down();
        return builder
                .withDetail("backend", recognitionAdapter.origin().value())
                .withDetail("providerConfigured", appProperties.azure().isConfigured())
                .withDetail("testMode", appProperties.testMode())
                .build();
    }
}
