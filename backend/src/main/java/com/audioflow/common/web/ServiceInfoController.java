package com.audioflow.common.web;

import com.audioflow.config.AppProperties;
import com.audioflow.config.WebSocketConfig;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class ServiceInfoController {

    private final AppProperties appProperties;

    public ServiceInfoController(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @GetMapping("/")
    public Map<String, Object> describe() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "GET /health");
        endpoints.put("createTranscription", "POST /v1/transcriptions");
        endpoints.put("createProviderTranscription", "POST /v1/transcriptions/provider");
        endpoints.put("listTranscriptions", "GET /v1/transcriptions");
        endpoints.put("streaming", "WS " + WebSocketConfig.STREAMING_PATH);
        endpoints.put("docs", "GET /docs");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "AudioFlow API");
        body.put("version", "1.0.0");
        body.put("endpoints", endpoints);
        return body;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", Instant.now());
        body.put("uptime", Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime()).toSeconds());
        body.put("testMode", appProperties.testMode());
        body.put("provider", Map.of("configured", appProperties.azure().isConfigured()));
        return body;
    }
}
