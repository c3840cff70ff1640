package com.audioflow.streaming.web;

import com.audioflow.common.exception.ErrorCodes;
import com.audioflow.streaming.dto.ErrorMessage;
import com.audioflow.streaming.dto.OutboundMessage;
import com.audioflow.streaming.service.SessionChannel;
import com.audioflow.streaming.service.StreamingSession;
import com.audioflow.streaming.service.StreamingSessionManager;
import com.audioflow.transcriptions.model.LanguageTag;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.Optional;

@Component
public class TranscriptionWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TranscriptionWebSocketHandler.class);
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final StreamingSessionManager sessionManager;
    private final ObjectMapper objectMapper;

    public TranscriptionWebSocketHandler(StreamingSessionManager sessionManager, ObjectMapper objectMapper) {
        this.sessionManager = sessionManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        SessionChannel channel = new WebSocketChannel(concurrent);

        String requested = languageParameter(session);
        Optional<LanguageTag> language = requested == null ? Optional.empty() : LanguageTag.find(requested);

        StreamingSession streamingSession = sessionManager.open(session.getId(), channel, language.orElse(null));
        if (requested != null && language.isEmpty()) {
            log.warn("Session {} requested unsupported language {}", streamingSession.sessionId(), requested);
            try {
                channel.send(ErrorMessage.of("Unsupported language: " + requested, ErrorCodes.UNSUPPORTED_LANGUAGE));
            } catch (IOException exception) {
                sessionManager.onTransportError(session.getId(), exception);
            }
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        sessionManager.onMessage(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        sessionManager.onTransportError(session.getId(), exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("Connection {} closed with {}", session.getId(), status);
        sessionManager.onClosed(session.getId());
    }

    private String languageParameter(WebSocketSession session) {
        if (session.getUri() == null) {
            return null;
        }
        String value = UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams().getFirst("language");
        return value == null || value.isBlank() ? null : value.trim();
    }

    private final class WebSocketChannel implements SessionChannel {

        private final WebSocketSession session;

        private WebSocketChannel(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public void send(OutboundMessage message) throws IOException {
            if (!session.isOpen()) {
                throw new IOException("Connection is closed");
            }
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
        }

        @Override
        public void close(boolean failed) {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(failed ? CloseStatus.SERVER_ERROR : CloseStatus.NORMAL);
            } catch (IOException exception) {
                log.warn("Unable to close connection {}", session.getId(), exception);
            }
        }
    }
}
