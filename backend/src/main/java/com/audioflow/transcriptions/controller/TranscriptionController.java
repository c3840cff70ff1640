package com.audioflow.transcriptions.controller;

import com.audioflow.processing.service.BatchTranscriptionService;
import com.audioflow.transcriptions.dto.CreateProviderTranscriptionRequest;
import com.audioflow.transcriptions.dto.CreateTranscriptionRequest;
import com.audioflow.transcriptions.dto.TranscriptionListResponse;
import com.audioflow.transcriptions.dto.TranscriptionResponse;
import com.audioflow.transcriptions.model.TranscriptionOrigin;
import com.audioflow.transcriptions.service.TranscriptionMapper;
import com.audioflow.transcriptions.service.TranscriptionStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/transcriptions")
@Validated
public class TranscriptionController {

    private final BatchTranscriptionService batchTranscriptionService;
    private final TranscriptionStore transcriptionStore;

    public TranscriptionController(BatchTranscriptionService batchTranscriptionService,
                                   TranscriptionStore transcriptionStore) {
        this.batchTranscriptionService = batchTranscriptionService;
        this.transcriptionStore = transcriptionStore;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TranscriptionResponse create(@RequestBody @Valid CreateTranscriptionRequest request) {
        return TranscriptionMapper.toResponse(batchTranscriptionService.transcribeSimulated(request.audioUrl().trim()));
    }

    @PostMapping("/provider")
    @ResponseStatus(HttpStatus.CREATED)
    public TranscriptionResponse createWithProvider(@RequestBody @Valid CreateProviderTranscriptionRequest request) {
        return TranscriptionMapper.toResponse(
                batchTranscriptionService.transcribeWithProvider(request.audioUrl().trim(), request.language()));
    }

    @GetMapping
    public TranscriptionListResponse list(@RequestParam(value = "daysBack", defaultValue = "30") @Min(1) int daysBack,
                                          @RequestParam(value = "page", defaultValue = "1") @Min(1) int page,
                                          @RequestParam(value = "pageSize", defaultValue = "10") @Min(1) @Max(100) int pageSize,
                                          @RequestParam(value = "source", required = false) TranscriptionOrigin source) {
        return TranscriptionMapper.toListResponse(transcriptionStore.query(daysBack, page, pageSize, source));
    }
}
