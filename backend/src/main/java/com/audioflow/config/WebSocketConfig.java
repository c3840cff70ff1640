package com.audioflow.config;

import com.audioflow.streaming.web.TranscriptionWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String STREAMING_PATH = "/v1/ws/transcription";

    private final TranscriptionWebSocketHandler transcriptionWebSocketHandler;

    public WebSocketConfig(TranscriptionWebSocketHandler transcriptionWebSocketHandler) {
        this.transcriptionWebSocketHandler = transcriptionWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(transcriptionWebSocketHandler, STREAMING_PATH)
                .setAllowedOriginPatterns("*");
    }

    @Bean
    static ThreadPoolTaskScheduler streamingTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("streaming-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
