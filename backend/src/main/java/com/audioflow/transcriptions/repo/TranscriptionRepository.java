package com.audioflow.transcriptions.repo;

import com.audioflow.transcriptions.model.TranscriptionEntity;
import com.audioflow.transcriptions.model.TranscriptionOrigin;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface TranscriptionRepository extends JpaRepository<TranscriptionEntity, UUID> {
    Page<TranscriptionEntity> findByCreatedAtGreaterThanEqual(Instant threshold, Pageable pageable);

    Page<TranscriptionEntity> findByCreatedAtGreaterThanEqualAndOrigin(Instant threshold,
                                                                       TranscriptionOrigin origin,
                                                                       Pageable pageable);

    Optional<TranscriptionEntity> findBySessionMetadataSessionId(String sessionId);
}
