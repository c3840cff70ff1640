package com.audioflow.streaming.service;

import com.audioflow.config.AppProperties;
import com.audioflow.transcriptions.model.LanguageTag;
import com.audioflow.transcriptions.service.TranscriptionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class StreamingSessionManager {

    private static final Logger log = LoggerFactory.getLogger(StreamingSessionManager.class);

    private final Map<String, StreamingSession> sessions = new ConcurrentHashMap<>();
    private final TranscriptionStore transcriptionStore;
    private final TaskScheduler scheduler;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final MeterRegistry meterRegistry;

    public StreamingSessionManager(TranscriptionStore transcriptionStore,
                                   @Qualifier("streamingTaskScheduler") TaskScheduler scheduler,
                                   ObjectMapper objectMapper,
                                   AppProperties appProperties,
                                   MeterRegistry meterRegistry) {
        this.transcriptionStore = transcriptionStore;
        this.scheduler = scheduler;
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
        this.meterRegistry = meterRegistry;
        meterRegistry.gaugeMapSize("streaming.sessions.active", Tags.empty(), sessions);
    }

    /**
     * Registers a connection and sends the welcome message. The returned session id is also the
     * suffix of the audio reference stored with the final transcription.
     */
    public StreamingSession open(String connectionId, SessionChannel channel, LanguageTag language) {
        String sessionId = UUID.randomUUID().toString();
        StreamingSession session = new StreamingSession(
                sessionId,
                channel,
                transcriptionStore,
                scheduler,
                objectMapper,
                Duration.ofMillis(appProperties.streaming().partialIntervalMs()),
                Duration.ofMillis(appProperties.streaming().finalizeDelayMs()),
                language
        );
        sessions.put(connectionId, session);

        withSession(sessionId, () -> {
            log.info("Streaming session opened (connection {}, language {})",
                    connectionId, language == null ? "none" : language.tag());
            session.open();
        });
        meterRegistry.counter("streaming.sessions.total", "outcome", "opened").increment();
        return session;
    }

    public void onMessage(String connectionId, String payload) {
        find(connectionId).ifPresent(session -> withSession(session.sessionId(), () -> session.onMessage(payload)));
    }

    public void onTransportError(String connectionId, Throwable error) {
        find(connectionId).ifPresent(session -> withSession(session.sessionId(), () -> session.onTransportError(error)));
    }

    public void onClosed(String connectionId) {
        StreamingSession session = sessions.remove(connectionId);
        if (session == null) {
            return;
        }
        withSession(session.sessionId(), session::onClosed);
        String outcome = session.isCompleted() ? "completed"
                : session.state() == SessionState.FAILED ? "failed" : "abandoned";
        meterRegistry.counter("streaming.sessions.total", "outcome", outcome).increment();
    }

    public Optional<StreamingSession> find(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    private void withSession(String sessionId, Runnable action) {
        MDC.put("sessionId", sessionId);
        try {
            action.run();
        } finally {
            MDC.remove("sessionId");
        }
    }
}
