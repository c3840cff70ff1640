package com.audioflow.transcriptions.service;

import com.audioflow.transcriptions.model.TranscriptionEntity;

import java.util.List;

public record TranscriptionPage(
        List<TranscriptionEntity> items,
        long totalMatching,
        int page,
        int pageSize,
        int totalPages
) {
}
