package com.audioflow.processing.service;

import com.audioflow.common.exception.DownloadFailedException;
import com.audioflow.common.exception.InvalidUrlException;
import com.audioflow.common.exception.RecognitionFailedException;
import com.audioflow.common.retry.BackoffExecutor;
import com.audioflow.common.retry.RetryPolicy;
import com.audioflow.common.util.AudioUrls;
import com.audioflow.config.AppProperties;
import com.audioflow.transcriptions.model.LanguageTag;
import com.audioflow.transcriptions.model.TranscriptionEntity;
import com.audioflow.transcriptions.model.TranscriptionOrigin;
import com.audioflow.transcriptions.service.TranscriptionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

@Service
public class BatchTranscriptionService {

    private static final Logger log = LoggerFactory.getLogger(BatchTranscriptionService.class);

    private final TransportAdapter transportAdapter;
    private final RecognitionAdapter recognitionAdapter;
    private final BackoffExecutor backoffExecutor;
    private final TranscriptionStore transcriptionStore;
    private final AppProperties appProperties;
    private final RetryPolicy downloadPolicy;
    private final RetryPolicy recognitionPolicy;
    private final Timer downloadTimer;
    private final Timer recognitionTimer;
    private final MeterRegistry meterRegistry;

    public BatchTranscriptionService(TransportAdapter transportAdapter,
                                     RecognitionAdapter recognitionAdapter,
                                     BackoffExecutor backoffExecutor,
                                     TranscriptionStore transcriptionStore,
                                     AppProperties appProperties,
                                     MeterRegistry meterRegistry) {
        this.transportAdapter = transportAdapter;
        this.recognitionAdapter = recognitionAdapter;
        this.backoffExecutor = backoffExecutor;
        this.transcriptionStore = transcriptionStore;
        this.appProperties = appProperties;
        this.meterRegistry = meterRegistry;
        this.downloadTimer = meterRegistry.timer("transcriptions.download.latency");
        this.recognitionTimer = meterRegistry.timer("transcriptions.recognition.latency");

        Counter downloadRetries = meterRegistry.counter("transcriptions.retry.total", "stage", "download");
        Counter recognitionRetries = meterRegistry.counter("transcriptions.retry.total", "stage", "recognition");
        RetryPolicy basePolicy = new RetryPolicy(
                appProperties.retry().maxAttempts(),
                Duration.ofMillis(appProperties.retry().initialDelayMs()),
                Duration.ofMillis(appProperties.retry().maxDelayMs())
        );
        this.downloadPolicy = basePolicy.withObserver((attempt, error) -> downloadRetries.increment());
        this.recognitionPolicy = basePolicy.withObserver((attempt, error) -> {
            recognitionRetries.increment();
            log.warn("Retrying recognition (attempt {}): {}", attempt, error.getMessage());
        });
    }

    public TranscriptionEntity transcribeSimulated(String audioUrl) {
        log.info("Starting simulated transcription for {}", audioUrl);
        download(audioUrl);

        TranscriptionEntity record = new TranscriptionEntity();
        record.setAudioReference(audioUrl);
        record.setText(simulatedText(audioUrl, Instant.now()));
        record.setOrigin(TranscriptionOrigin.SIMULATED);
        return persist(record);
    }

    public TranscriptionEntity transcribeWithProvider(String audioUrl, LanguageTag language) {
        LanguageTag effective = language == null ? LanguageTag.DEFAULT : language;
        TranscriptionOrigin origin = recognitionAdapter.origin();
        log.info("Starting {} transcription for {} ({})", origin.value(), audioUrl, effective.tag());

        validateUrl(audioUrl);
        if (!recognitionAdapter.isAvailable()) {
            throw new RecognitionFailedException("Speech recognition provider is not configured", null);
        }
        TransportResponse audio = download(audioUrl);
        RecognitionResult result = recognize(audioUrl, audio.payload(), effective);

        TranscriptionEntity record = new TranscriptionEntity();
        record.setAudioReference(audioUrl);
        record.setText(result.text().trim());
        record.setOrigin(origin);
        record.setLanguageTag(effective);
        return persist(record);
    }

    private void validateUrl(String audioUrl) {
        if (!AudioUrls.isValidUrl(audioUrl)) {
            throw new InvalidUrlException(audioUrl);
        }
    }

    private TransportResponse download(String audioUrl) {
        validateUrl(audioUrl);

        FetchOptions options = FetchOptions.audio(
                Duration.ofMillis(appProperties.transport().timeoutMs()),
                appProperties.transport().maxPayloadBytes()
        );

        Timer.Sample sample = Timer.start();
        try {
            TransportResponse response = backoffExecutor.execute(() -> transportAdapter.fetch(audioUrl, options), downloadPolicy);
            log.info("Audio download successful for {} ({} bytes, {})", audioUrl, response.payload().length, response.contentType());
            return response;
        } catch (RuntimeException exception) {
            log.error("Audio download failed for {}", audioUrl, exception);
            throw new DownloadFailedException("Unable to download audio: " + exception.getMessage(), exception);
        } finally {
            sample.stop(downloadTimer);
        }
    }

    private RecognitionResult recognize(String audioUrl, byte[] payload, LanguageTag language) {
        Timer.Sample sample = Timer.start();
        try {
            return backoffExecutor.execute(() -> {
                RecognitionResult result = recognitionAdapter.recognize(payload, language);
                if (result == null || result.text() == null || result.text().isBlank()) {
                    throw new RecognitionException("Recognition returned empty text");
                }
                return result;
            }, recognitionPolicy);
        } catch (RuntimeException exception) {
            log.error("Recognition failed for {}", audioUrl, exception);
            throw new RecognitionFailedException("Speech recognition unavailable: " + exception.getMessage(), exception);
        } finally {
            sample.stop(recognitionTimer);
        }
    }

    private TranscriptionEntity persist(TranscriptionEntity record) {
        TranscriptionEntity saved = transcriptionStore.create(record);
        meterRegistry.counter("transcriptions.created.total", "origin", saved.getOrigin().value()).increment();
        log.info("Transcription {} saved ({})", saved.getId(), saved.getOrigin().value());
        return saved;
    }

    static String simulatedText(String audioUrl, Instant processedAt) {
        return "This is a simulated transcription of the audio file: " + AudioUrls.filenameFromUrl(audioUrl)
                + ". The audio was processed at " + processedAt + ". "
                + "A provider-backed transcription would contain the recognized speech from the audio content.";
    }
}
