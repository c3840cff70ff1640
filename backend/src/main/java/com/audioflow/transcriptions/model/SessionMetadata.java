package com.audioflow.transcriptions.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class SessionMetadata {

    @Column(name = "session_id", updatable = false)
    private String sessionId;

    @Column(name = "session_duration_ms", updatable = false)
    private Long durationMs;

    @Column(name = "session_chunk_count", updatable = false)
    private Integer chunkCount;

    protected SessionMetadata() {
    }

    public SessionMetadata(String sessionId, long durationMs, int chunkCount) {
        this.sessionId = sessionId;
        this.durationMs = durationMs;
        this.chunkCount = chunkCount;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public Integer getChunkCount() {
        return chunkCount;
    }
}
