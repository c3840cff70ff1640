package com.audioflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        boolean testMode,
        Azure azure,
        Retry retry,
        Transport transport,
        Recognition recognition,
        Streaming streaming
) {

    public record Azure(
            String speechKey,
            String speechRegion,
            long timeoutSeconds
    ) {

        public boolean isConfigured() {
            return speechKey != null && !speechKey.isBlank()
                    && speechRegion != null && !speechRegion.isBlank();
        }
    }

    public record Retry(
            int maxAttempts,
            long initialDelayMs,
            long maxDelayMs
    ) {}

    public record Transport(
            long timeoutMs,
            long maxPayloadBytes,
            long simulatedDelayMs
    ) {}

    public record Recognition(
            long simulatedDelayMs
    ) {}

    public record Streaming(
            long partialIntervalMs,
            long finalizeDelayMs
    ) {}
}
