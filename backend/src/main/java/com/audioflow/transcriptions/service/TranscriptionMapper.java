package com.audioflow.transcriptions.service;

import com.audioflow.transcriptions.dto.TranscriptionListResponse;
import com.audioflow.transcriptions.dto.TranscriptionResponse;
import com.audioflow.transcriptions.model.TranscriptionEntity;

public final class TranscriptionMapper {

    private TranscriptionMapper() {
    }

    public static TranscriptionResponse toResponse(TranscriptionEntity entity) {
        return new TranscriptionResponse(
                entity.getId().toString(),
                entity.getAudioReference(),
                entity.getText(),
                entity.getOrigin(),
                entity.getLanguageTag(),
                entity.getCreatedAt()
        );
    }

    public static TranscriptionListResponse toListResponse(TranscriptionPage page) {
        return new TranscriptionListResponse(
                page.totalMatching(),
                page.page(),
                page.pageSize(),
                page.totalPages(),
                page.items().stream()
                        .map(TranscriptionMapper::toResponse)
                        .toList()
        );
    }
}
