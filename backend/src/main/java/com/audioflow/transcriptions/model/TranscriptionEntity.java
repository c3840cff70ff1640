package com.audioflow.transcriptions.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

@Entity
@Immutable
@Table(name = "transcriptions", indexes = {
        @Index(name = "idx_transcriptions_created_at_origin", columnList = "created_at DESC, origin"),
        @Index(name = "idx_transcriptions_created_at", columnList = "created_at DESC"),
        @Index(name = "idx_transcriptions_origin_created_at", columnList = "origin, created_at DESC"),
        @Index(name = "idx_transcriptions_session_id", columnList = "session_id")
})
public class TranscriptionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "audio_reference", nullable = false, updatable = false, length = 2048)
    private String audioReference;

    @Column(name = "transcript_text", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String text;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private TranscriptionOrigin origin;

    @Column(name = "language_tag", updatable = false, length = 8)
    private LanguageTag languageTag;

    @Embedded
    private SessionMetadata sessionMetadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getAudioReference() {
        return audioReference;
    }

    public void setAudioReference(String audioReference) {
        this.audioReference = audioReference;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public TranscriptionOrigin getOrigin() {
        return origin;
    }

    public void setOrigin(TranscriptionOrigin origin) {
        this.origin = origin;
    }

    public LanguageTag getLanguageTag() {
        return languageTag;
    }

    public void setLanguageTag(LanguageTag languageTag) {
        this.languageTag = languageTag;
    }

    public SessionMetadata getSessionMetadata() {
        return sessionMetadata;
    }

    public void setSessionMetadata(SessionMetadata sessionMetadata) {
        this.sessionMetadata = sessionMetadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
