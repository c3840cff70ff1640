package com.audioflow.transcriptions.controller;

import com.audioflow.transcriptions.model.TranscriptionOrigin;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Binds the lowercase {@code source} query value ("simulated", "provider").
 */
@Component
public class TranscriptionOriginConverter implements Converter<String, TranscriptionOrigin> {

    @Override
    public TranscriptionOrigin convert(String source) {
        return source.isBlank() ? null : TranscriptionOrigin.fromValue(source);
    }
}
