package com.audioflow.transcriptions.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTranscriptionRequest(
        @NotBlank(message = "audioUrl is required") @Size(max = 2048) String audioUrl
) {
}
