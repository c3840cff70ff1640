package com.audioflow.transcriptions.dto;

import com.audioflow.transcriptions.model.LanguageTag;
import com.audioflow.transcriptions.model.TranscriptionOrigin;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranscriptionResponse(
        String id,
        String audioUrl,
        String transcription,
        TranscriptionOrigin source,
        LanguageTag language,
        Instant createdAt
) {
}
