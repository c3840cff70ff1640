package com.audioflow.transcriptions.dto;

import com.audioflow.transcriptions.model.LanguageTag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateProviderTranscriptionRequest(
        @NotBlank(message = "audioUrl is required") @Size(max = 2048) String audioUrl,
        LanguageTag language
) {
}
