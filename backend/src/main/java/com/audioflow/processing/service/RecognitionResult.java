package com.audioflow.processing.service;

import com.audioflow.transcriptions.model.LanguageTag;

public record RecognitionResult(
        String text,
        LanguageTag language,
        Double confidence,
        Long durationMs
) {
}
