package com.audioflow.config;

import com.audioflow.common.retry.BackoffExecutor;
import com.audioflow.processing.adapter.AzureSpeechRecognitionAdapter;
import com.audioflow.processing.adapter.HttpTransportAdapter;
import com.audioflow.processing.adapter.SimulatedRecognitionAdapter;
import com.audioflow.processing.adapter.SimulatedTransportAdapter;
import com.audioflow.processing.service.RecognitionAdapter;
import com.audioflow.processing.service.TransportAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AdapterConfig {

    private static final Logger log = LoggerFactory.getLogger(AdapterConfig.class);

    @Bean
    TransportAdapter transportAdapter(AppProperties properties) {
        if (AdapterSelector.transport(properties) == AdapterKind.SIMULATED) {
            log.info("Using simulated transport adapter");
            return new SimulatedTransportAdapter(Duration.ofMillis(properties.transport().simulatedDelayMs()));
        }

        log.info("Using HTTP transport adapter");
        return new HttpTransportAdapter(Duration.ofMillis(properties.transport().timeoutMs()));
    }

    @Bean
    RecognitionAdapter recognitionAdapter(AppProperties properties) {
        if (AdapterSelector.recognition(properties) == AdapterKind.REAL) {
            log.info("Using Azure Speech recognition adapter (region {})", properties.azure().speechRegion());
            return new AzureSpeechRecognitionAdapter(properties.azure());
        }

        log.info("Using simulated recognition adapter (Azure Speech credentials not configured)");
        return new SimulatedRecognitionAdapter(Duration.ofMillis(properties.recognition().simulatedDelayMs()));
    }

    @Bean
    BackoffExecutor backoffExecutor() {
        return new BackoffExecutor();
    }
}
