package com.audioflow.transcriptions.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TranscriptionOrigin {
    SIMULATED,
    PROVIDER;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TranscriptionOrigin fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (TranscriptionOrigin origin : values()) {
            if (origin.value().equalsIgnoreCase(value.trim())) {
                return origin;
            }
        }
        throw new IllegalArgumentException("Unsupported transcription source: " + value);
    }
}
