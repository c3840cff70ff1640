package com.audioflow.transcriptions.service;

import com.audioflow.common.exception.BadRequestException;
import com.audioflow.transcriptions.model.TranscriptionEntity;
import com.audioflow.transcriptions.model.TranscriptionOrigin;
import com.audioflow.transcriptions.repo.TranscriptionRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Service
public class TranscriptionStore {

    private final TranscriptionRepository transcriptionRepository;

    public TranscriptionStore(TranscriptionRepository transcriptionRepository) {
        this.transcriptionRepository = transcriptionRepository;
    }

    @Transactional
    public TranscriptionEntity create(TranscriptionEntity record) {
        if (record.getId() != null) {
            throw new IllegalArgumentException("Transcription records are append-only and cannot be re-saved");
        }
        if (record.getText() == null || record.getText().isBlank()) {
            throw new IllegalArgumentException("Transcription text must not be empty");
        }
        record.setCreatedAt(Instant.now());
        return transcriptionRepository.save(record);
    }

    @Transactional(readOnly = true)
    public TranscriptionPage query(int daysBack, int page, int pageSize, TranscriptionOrigin origin) {
        if (daysBack < 1 || page < 1 || pageSize < 1) {
            throw new BadRequestException("daysBack, page and pageSize must be positive");
        }

        Instant threshold = Instant.now().minus(daysBack, ChronoUnit.DAYS);
        Pageable pageable = PageRequest.of(page - 1, pageSize, Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<TranscriptionEntity> result = origin == null
                ? transcriptionRepository.findByCreatedAtGreaterThanEqual(threshold, pageable)
                : transcriptionRepository.findByCreatedAtGreaterThanEqualAndOrigin(threshold, origin, pageable);

        return new TranscriptionPage(
                result.getContent(),
                result.getTotalElements(),
                page,
                pageSize,
                (int) ((result.getTotalElements() + pageSize - 1) / pageSize)
        );
    }
}
