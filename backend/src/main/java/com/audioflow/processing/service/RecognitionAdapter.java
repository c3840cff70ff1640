package com.audioflow.processing.service;

import com.audioflow.transcriptions.model.LanguageTag;
import com.audioflow.transcriptions.model.TranscriptionOrigin;

public interface RecognitionAdapter {
    boolean isAvailable();

    TranscriptionOrigin origin();

    RecognitionResult recognize(byte[] payload, LanguageTag language);
}
