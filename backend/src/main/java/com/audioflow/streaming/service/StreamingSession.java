package com.audioflow.streaming.service;

import com.audioflow.common.exception.ErrorCodes;
import com.audioflow.streaming.dto.ChunkMessage;
import com.audioflow.streaming.dto.ErrorMessage;
import com.audioflow.streaming.dto.FinalMessage;
import com.audioflow.streaming.dto.OutboundMessage;
import com.audioflow.streaming.dto.PartialMessage;
import com.audioflow.transcriptions.model.LanguageTag;
import com.audioflow.transcriptions.model.SessionMetadata;
import com.audioflow.transcriptions.model.TranscriptionEntity;
import com.audioflow.transcriptions.model.TranscriptionOrigin;
import com.audioflow.transcriptions.service.TranscriptionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * One live streaming connection: OPEN, RECEIVING, FINALIZING, then CLOSED or FAILED.
 *
 * <p>Inbound messages arrive on the connection's thread; partial results are emitted by a task on the
 * shared scheduler. State transitions and partial sends are serialized on {@code lock}, so once
 * FINALIZING is entered no further partial can reach the channel.
 */
public class StreamingSession {

    private static final Logger log = LoggerFactory.getLogger(StreamingSession.class);
    private static final String AUDIO_REFERENCE_PREFIX = "ws://streaming-session/";

    private final String sessionId;
    private final SessionChannel channel;
    private final TranscriptionStore transcriptionStore;
    private final TaskScheduler scheduler;
    private final ObjectMapper objectMapper;
    private final Duration partialInterval;
    private final Duration finalizeDelay;
    private final LanguageTag language;
    private final Instant startedAt;
    private final Object lock = new Object();
    private final List<String> accumulatedChunks = Collections.synchronizedList(new ArrayList<>());

    private volatile SessionState state = SessionState.OPEN;
    private volatile int chunksReceived;
    private volatile String recordId;
    private ScheduledFuture<?> emissionLoop;
    private ScheduledFuture<?> pendingFinalization;

    public StreamingSession(String sessionId,
                            SessionChannel channel,
                            TranscriptionStore transcriptionStore,
                            TaskScheduler scheduler,
                            ObjectMapper objectMapper,
                            Duration partialInterval,
                            Duration finalizeDelay,
                            LanguageTag language) {
        this.sessionId = sessionId;
        this.channel = channel;
        this.transcriptionStore = transcriptionStore;
        this.scheduler = scheduler;
        this.objectMapper = objectMapper;
        this.partialInterval = partialInterval;
        this.finalizeDelay = finalizeDelay;
        this.language = language;
        this.startedAt = Instant.now();
    }

    public void open() {
        if (!send(PartialMessage.of(StreamingTranscripts.WELCOME_TEXT, 1.0))) {
            return;
        }
        synchronized (lock) {
            if (state == SessionState.OPEN) {
                state = SessionState.RECEIVING;
            }
        }
    }

    public void onMessage(String payload) {
        SessionState current = state;
        if (current != SessionState.RECEIVING && current != SessionState.OPEN) {
            log.debug("Session {} ignoring message in state {}", sessionId, current);
            return;
        }

        ChunkMessage chunk = parse(payload);
        if (chunk == null) {
            send(ErrorMessage.of("Failed to process audio chunk", ErrorCodes.INVALID_MESSAGE));
            return;
        }

        int count;
        synchronized (lock) {
            if (state != SessionState.RECEIVING) {
                return;
            }
            accumulatedChunks.add(chunk.data() == null ? "" : chunk.data());
            count = ++chunksReceived;
        }
        log.info("Session {} received chunk {} (last={})", sessionId, count, chunk.last());

        if (count == 1) {
            startEmissionLoop();
        }
        if (chunk.last()) {
            beginFinalization();
        }
    }

    public void onTransportError(Throwable error) {
        log.error("Session {} transport error", sessionId, error);
        if (transition(SessionState.FAILED)) {
            stopBackgroundWork();
            channel.close(true);
        }
    }

    public void onClosed() {
        SessionState previous;
        synchronized (lock) {
            previous = state;
            if (!previous.isTerminal()) {
                state = SessionState.CLOSED;
            }
        }
        stopBackgroundWork();
        if (!previous.isTerminal()) {
            log.info("Session {} closed by client in state {} after {} chunks; nothing persisted",
                    sessionId, previous, chunksReceived);
        }
    }

    public String sessionId() {
        return sessionId;
    }

    public SessionState state() {
        return state;
    }

    public int chunksReceived() {
        return chunksReceived;
    }

    public List<String> accumulatedChunks() {
        synchronized (accumulatedChunks) {
            return List.copyOf(accumulatedChunks);
        }
    }

    public boolean isCompleted() {
        return recordId != null;
    }

    private void startEmissionLoop() {
        synchronized (lock) {
            if (state == SessionState.RECEIVING && emissionLoop == null) {
                emissionLoop = scheduler.scheduleAtFixedRate(this::emitPartial, partialInterval);
            }
        }
    }

    private void emitPartial() {
        synchronized (lock) {
            if (state != SessionState.RECEIVING) {
                return;
            }
            int chunks = chunksReceived;
            PartialMessage partial = PartialMessage.of(
                    StreamingTranscripts.partialText(chunks),
                    StreamingTranscripts.partialConfidence(chunks)
            );
            if (send(partial)) {
                log.debug("Session {} sent partial for {} chunks", sessionId, chunks);
            }
        }
    }

    private void beginFinalization() {
        synchronized (lock) {
            if (state != SessionState.RECEIVING) {
                return;
            }
            state = SessionState.FINALIZING;
            cancel(emissionLoop);
            pendingFinalization = scheduler.schedule(this::completeFinalization, Instant.now().plus(finalizeDelay));
        }
    }

    /**
     * Persists the final record. The state check and the write happen under {@code lock}, so a
     * client close either lands first and nothing is stored, or waits until the record exists.
     */
    private void completeFinalization() {
        int chunks;
        long durationMs;
        TranscriptionEntity saved;
        synchronized (lock) {
            if (state != SessionState.FINALIZING) {
                log.info("Session {} abandoned before finalization", sessionId);
                return;
            }

            chunks = chunksReceived;
            durationMs = Duration.between(startedAt, Instant.now()).toMillis();

            TranscriptionEntity record = new TranscriptionEntity();
            record.setAudioReference(AUDIO_REFERENCE_PREFIX + sessionId);
            record.setText(StreamingTranscripts.finalText(sessionId, chunks));
            record.setOrigin(TranscriptionOrigin.SIMULATED);
            record.setLanguageTag(language);
            record.setSessionMetadata(new SessionMetadata(sessionId, durationMs, chunks));

            try {
                saved = transcriptionStore.create(record);
            } catch (RuntimeException exception) {
                log.error("Session {} failed to persist final transcription", sessionId, exception);
                saved = null;
            }
            if (saved != null) {
                recordId = saved.getId().toString();
            }
        }

        if (saved == null) {
            send(ErrorMessage.of("Failed to save transcription", ErrorCodes.PERSISTENCE_ERROR));
            if (transition(SessionState.FAILED)) {
                channel.close(true);
            }
            return;
        }

        send(FinalMessage.of(saved.getText(), recordId));
        log.info("Session {} completed: record {} from {} chunks in {}ms", sessionId, recordId, chunks, durationMs);

        if (transition(SessionState.CLOSED)) {
            channel.close(false);
        }
    }

    private ChunkMessage parse(String payload) {
        try {
            ChunkMessage message = objectMapper.readValue(payload, ChunkMessage.class);
            if (message == null || !message.isChunk()) {
                log.warn("Session {} received unsupported message type", sessionId);
                return null;
            }
            return message;
        } catch (JsonProcessingException exception) {
            log.warn("Session {} received malformed message: {}", sessionId, exception.getOriginalMessage());
            return null;
        }
    }

    private boolean send(OutboundMessage message) {
        try {
            channel.send(message);
            return true;
        } catch (IOException exception) {
            log.error("Session {} failed to send {} message", sessionId, message.type(), exception);
            if (transition(SessionState.FAILED)) {
                stopBackgroundWork();
            }
            return false;
        }
    }

    private boolean transition(SessionState target) {
        synchronized (lock) {
            if (state.isTerminal()) {
                return false;
            }
            state = target;
            return true;
        }
    }

    private void stopBackgroundWork() {
        synchronized (lock) {
            cancel(emissionLoop);
            cancel(pendingFinalization);
        }
    }

    private void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }
}
