package com.audioflow.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfiguration {

    @Bean
    public OpenAPI audioFlowOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("AudioFlow API")
                        .version("1.0.0")
                        .description("Audio transcription service with simulated and Azure Speech-to-Text pipelines. "
                                + "Streaming transcription is available over WebSocket at /v1/ws/transcription."));
    }
}
