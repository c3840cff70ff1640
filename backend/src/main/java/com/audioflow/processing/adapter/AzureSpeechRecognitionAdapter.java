package com.audioflow.processing.adapter;

import com.audioflow.config.AppProperties;
import com.audioflow.processing.service.RecognitionAdapter;
import com.audioflow.processing.service.RecognitionException;
import com.audioflow.processing.service.RecognitionResult;
import com.audioflow.transcriptions.model.LanguageTag;
import com.audioflow.transcriptions.model.TranscriptionOrigin;
import com.microsoft.cognitiveservices.speech.CancellationReason;
import com.microsoft.cognitiveservices.speech.ResultReason;
import com.microsoft.cognitiveservices.speech.SpeechConfig;
import com.microsoft.cognitiveservices.speech.SpeechRecognizer;
import com.microsoft.cognitiveservices.speech.audio.AudioConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Continuous recognition against Azure Speech. Recognized segments are joined in arrival order.
 * When the hard timeout elapses with some text already recognized, that text is returned as a
 * best-effort result; with no text the timeout is a failure.
 */
public class AzureSpeechRecognitionAdapter implements RecognitionAdapter {

    private static final Logger log = LoggerFactory.getLogger(AzureSpeechRecognitionAdapter.class);
    private static final double SESSION_CONFIDENCE = 0.9;

    private final AppProperties.Azure azure;
    private final Duration timeout;

    public AzureSpeechRecognitionAdapter(AppProperties.Azure azure) {
        this(azure, Duration.ofSeconds(azure.timeoutSeconds() > 0 ? azure.timeoutSeconds() : 60));
    }

    AzureSpeechRecognitionAdapter(AppProperties.Azure azure, Duration timeout) {
        this.azure = azure;
        this.timeout = timeout;
    }

    @Override
    public boolean isAvailable() {
        return azure.isConfigured();
    }

    @Override
    public TranscriptionOrigin origin() {
        return TranscriptionOrigin.PROVIDER;
    }

    @Override
    public RecognitionResult recognize(byte[] payload, LanguageTag language) {
        if (!isAvailable()) {
            throw new RecognitionException("Azure Speech credentials not configured");
        }

        LanguageTag effective = language == null ? LanguageTag.DEFAULT : language;
        log.info("Starting Azure Speech recognition for {} bytes ({})", payload.length, effective.tag());
        long start = System.currentTimeMillis();

        Path audioFile = null;
        SpeechConfig speechConfig = null;
        AudioConfig audioConfig = null;
        SpeechRecognizer recognizer = null;
        List<String> segments = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> completion = new CompletableFuture<>();

        try {
            audioFile = Files.createTempFile("audioflow-", ".wav");
            Files.write(audioFile, payload);

            speechConfig = SpeechConfig.fromSubscription(azure.speechKey(), azure.speechRegion());
            speechConfig.setSpeechRecognitionLanguage(effective.tag());
            audioConfig = AudioConfig.fromWavFileInput(audioFile.toAbsolutePath().toString());
            recognizer = new SpeechRecognizer(speechConfig, audioConfig);

            recognizer.recognized.addEventListener((sender, event) -> {
                if (event.getResult().getReason() == ResultReason.RecognizedSpeech) {
                    segments.add(event.getResult().getText());
                }
            });
            recognizer.sessionStopped.addEventListener((sender, event) -> completion.complete(null));
            recognizer.canceled.addEventListener((sender, event) -> onCanceled(
                    event.getReason() == CancellationReason.Error,
                    event.getErrorCode() + " " + event.getErrorDetails(),
                    completion));

            try {
                recognizer.startContinuousRecognitionAsync().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException exception) {
                throw new RecognitionException("Azure Speech recognition did not start within " + timeout.toMillis() + "ms", exception);
            } catch (ExecutionException exception) {
                throw new RecognitionException("Unable to start Azure Speech recognition", exception.getCause());
            }

            return awaitResult(segments, completion, effective, start);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new RecognitionException("Azure Speech recognition interrupted", exception);
        } catch (IOException exception) {
            throw new RecognitionException("Unable to stage audio for Azure Speech", exception);
        } finally {
            release(recognizer, audioConfig, speechConfig, audioFile);
        }
    }

    static void onCanceled(boolean error, String details, CompletableFuture<Void> completion) {
        if (error) {
            completion.completeExceptionally(new RecognitionException("Azure Speech canceled: " + details));
        } else {
            completion.complete(null);
        }
    }

    /**
     * Waits for the session to stop. A timeout with recognized text yields that text with no
     * confidence; a timeout without text fails.
     */
    RecognitionResult awaitResult(List<String> segments, CompletableFuture<Void> completion,
                                  LanguageTag language, long startMillis) throws InterruptedException {
        Double confidence = SESSION_CONFIDENCE;
        try {
            completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException exception) {
            if (joined(segments).isEmpty()) {
                throw new RecognitionException("Azure Speech recognition timed out after " + timeout.toMillis() + "ms");
            }
            log.warn("Azure Speech recognition timed out, returning {} recognized segments", segments.size());
            confidence = null;
        } catch (ExecutionException exception) {
            if (exception.getCause() instanceof RecognitionException recognitionException) {
                throw recognitionException;
            }
            throw new RecognitionException("Azure Speech recognition failed", exception.getCause());
        }

        long durationMs = System.currentTimeMillis() - startMillis;
        log.info("Azure Speech recognition finished in {}ms with {} segments", durationMs, segments.size());
        return new RecognitionResult(joined(segments), language, confidence, durationMs);
    }

    private String joined(List<String> segments) {
        synchronized (segments) {
            return String.join(" ", segments).trim();
        }
    }

    private void release(SpeechRecognizer recognizer, AudioConfig audioConfig, SpeechConfig speechConfig, Path audioFile) {
        if (recognizer != null) {
            try {
                recognizer.stopContinuousRecognitionAsync().get(5, TimeUnit.SECONDS);
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while stopping Azure Speech recognizer");
            } catch (ExecutionException | TimeoutException exception) {
                log.warn("Unable to stop Azure Speech recognizer cleanly", exception);
            }
            closeQuietly(recognizer);
        }
        if (audioConfig != null) {
            closeQuietly(audioConfig);
        }
        if (speechConfig != null) {
            closeQuietly(speechConfig);
        }
        if (audioFile != null) {
            try {
                Files.deleteIfExists(audioFile);
            } catch (IOException exception) {
                log.warn("Unable to delete staged audio {}", audioFile, exception);
            }
        }
    }

    private void closeQuietly(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception exception) {
            log.warn("Error closing {}", resource.getClass().getSimpleName(), exception);
        }
    }
}
