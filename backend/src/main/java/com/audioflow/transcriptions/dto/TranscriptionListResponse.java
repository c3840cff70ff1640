package com.audioflow.transcriptions.dto;

import java.util.List;

public record TranscriptionListResponse(
        long count,
        int page,
        int pageSize,
        int totalPages,
        List<TranscriptionResponse> items
) {
}
