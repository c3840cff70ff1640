package com.audioflow.processing.service;

import com.audioflow.common.exception.DownloadFailedException;
import com.audioflow.common.exception.ErrorCodes;
import com.audioflow.common.exception.InvalidUrlException;
import com.audioflow.common.exception.RecognitionFailedException;
import com.audioflow.common.retry.BackoffExecutor;
import com.audioflow.config.AppProperties;
import com.audioflow.transcriptions.model.LanguageTag;
import com.audioflow.transcriptions.model.TranscriptionEntity;
import com.audioflow.transcriptions.model.TranscriptionOrigin;
import com.audioflow.transcriptions.service.TranscriptionStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchTranscriptionServiceTest {

    private static final String AUDIO_URL = "https://example.com/audio/meeting.mp3";

    @Mock
    private TransportAdapter transportAdapter;

    @Mock
    private RecognitionAdapter recognitionAdapter;

    @Mock
    private TranscriptionStore transcriptionStore;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    @Test
    void simulatedPipelinePersistsTemplatedText() {
        BatchTranscriptionService service = createService();
        when(transportAdapter.fetch(eq(AUDIO_URL), any(FetchOptions.class))).thenReturn(audio());
        when(transcriptionStore.create(any(TranscriptionEntity.class))).thenAnswer(inv -> saved(inv.getArgument(0)));

        TranscriptionEntity result = service.transcribeSimulated(AUDIO_URL);

        assertThat(result.getId()).isNotNull();
        assertThat(result.getOrigin()).isEqualTo(TranscriptionOrigin.SIMULATED);
        assertThat(result.getAudioReference()).isEqualTo(AUDIO_URL);
        assertThat(result.getText()).contains("meeting.mp3");
        assertThat(result.getLanguageTag()).isNull();
        verifyNoInteractions(recognitionAdapter);
        assertThat(meterRegistry.counter("transcriptions.created.total", "origin", "simulated").count()).isEqualTo(1.0);
    }

    @Test
    void invalidUrlFailsWithoutAnyNetworkCall() {
        BatchTranscriptionService service = createService();

        assertThatThrownBy(() -> service.transcribeSimulated("not-a-url"))
                .isInstanceOf(InvalidUrlException.class)
                .satisfies(error -> assertThat(((InvalidUrlException) error).getCode()).isEqualTo(ErrorCodes.INVALID_URL));

        verifyNoInteractions(transportAdapter, transcriptionStore);
    }

    @Test
    void downloadIsRetriedBeforeSucceeding() {
        BatchTranscriptionService service = createService();
        when(transportAdapter.fetch(eq(AUDIO_URL), any(FetchOptions.class)))
                .thenThrow(new TransportException("connection reset"))
                .thenThrow(new TransportException("connection reset"))
                .thenReturn(audio());
        when(transcriptionStore.create(any(TranscriptionEntity.class))).thenAnswer(inv -> saved(inv.getArgument(0)));

        service.transcribeSimulated(AUDIO_URL);

        verify(transportAdapter, times(3)).fetch(eq(AUDIO_URL), any(FetchOptions.class));
        assertThat(meterRegistry.counter("transcriptions.retry.total", "stage", "download").count()).isEqualTo(2.0);
    }

    @Test
    void exhaustedDownloadSurfacesDownloadErrorAndPersistsNothing() {
        BatchTranscriptionService service = createService();
        when(transportAdapter.fetch(eq(AUDIO_URL), any(FetchOptions.class)))
                .thenThrow(new TransportException("GET failed: HTTP 503"));

        assertThatThrownBy(() -> service.transcribeSimulated(AUDIO_URL))
                .isInstanceOf(DownloadFailedException.class)
                .hasMessageContaining("HTTP 503");

        verify(transportAdapter, times(3)).fetch(eq(AUDIO_URL), any(FetchOptions.class));
        verifyNoInteractions(transcriptionStore);
    }

    @Test
    void providerPipelineRecordsLanguageAndAdapterOrigin() {
        BatchTranscriptionService service = createService();
        when(recognitionAdapter.origin()).thenReturn(TranscriptionOrigin.PROVIDER);
        when(recognitionAdapter.isAvailable()).thenReturn(true);
        when(transportAdapter.fetch(eq(AUDIO_URL), any(FetchOptions.class))).thenReturn(audio());
        when(recognitionAdapter.recognize(any(byte[].class), eq(LanguageTag.DE_DE)))
                .thenReturn(new RecognitionResult("  Guten Tag  ", LanguageTag.DE_DE, 0.9, 1200L));
        when(transcriptionStore.create(any(TranscriptionEntity.class))).thenAnswer(inv -> saved(inv.getArgument(0)));

        TranscriptionEntity result = service.transcribeWithProvider(AUDIO_URL, LanguageTag.DE_DE);

        assertThat(result.getText()).isEqualTo("Guten Tag");
        assertThat(result.getOrigin()).isEqualTo(TranscriptionOrigin.PROVIDER);
        assertThat(result.getLanguageTag()).isEqualTo(LanguageTag.DE_DE);
    }

    @Test
    void providerPipelineDefaultsToEnglish() {
        BatchTranscriptionService service = createService();
        when(recognitionAdapter.origin()).thenReturn(TranscriptionOrigin.SIMULATED);
        when(recognitionAdapter.isAvailable()).thenReturn(true);
        when(transportAdapter.fetch(eq(AUDIO_URL), any(FetchOptions.class))).thenReturn(audio());
        when(recognitionAdapter.recognize(any(byte[].class), eq(LanguageTag.EN_US)))
                .thenReturn(new RecognitionResult("Hello there", LanguageTag.EN_US, 0.95, 2500L));
        ArgumentCaptor<TranscriptionEntity> captor = ArgumentCaptor.forClass(TranscriptionEntity.class);
        when(transcriptionStore.create(captor.capture())).thenAnswer(inv -> saved(inv.getArgument(0)));

        service.transcribeWithProvider(AUDIO_URL, null);

        assertThat(captor.getValue().getLanguageTag()).isEqualTo(LanguageTag.EN_US);
        assertThat(captor.getValue().getOrigin()).isEqualTo(TranscriptionOrigin.SIMULATED);
    }

    @Test
    void unavailableProviderFailsBeforeDownloading() {
        BatchTranscriptionService service = createService();
        when(recognitionAdapter.origin()).thenReturn(TranscriptionOrigin.PROVIDER);
        when(recognitionAdapter.isAvailable()).thenReturn(false);

        assertThatThrownBy(() -> service.transcribeWithProvider(AUDIO_URL, LanguageTag.EN_US))
                .isInstanceOf(RecognitionFailedException.class)
                .satisfies(error -> assertThat(((RecognitionFailedException) error).getStatus().value()).isEqualTo(503));

        verifyNoInteractions(transportAdapter, transcriptionStore);
    }

    @Test
    void blankRecognitionIsRetriedThenSurfacesRecognitionError() {
        BatchTranscriptionService service = createService();
        when(recognitionAdapter.origin()).thenReturn(TranscriptionOrigin.PROVIDER);
        when(recognitionAdapter.isAvailable()).thenReturn(true);
        when(transportAdapter.fetch(eq(AUDIO_URL), any(FetchOptions.class))).thenReturn(audio());
        when(recognitionAdapter.recognize(any(byte[].class), any(LanguageTag.class)))
                .thenReturn(new RecognitionResult(" ", LanguageTag.EN_US, null, 10L));

        assertThatThrownBy(() -> service.transcribeWithProvider(AUDIO_URL, LanguageTag.EN_US))
                .isInstanceOf(RecognitionFailedException.class)
                .hasMessageContaining("empty text");

        verify(recognitionAdapter, times(3)).recognize(any(byte[].class), any(LanguageTag.class));
        verify(transcriptionStore, never()).create(any());
        assertThat(meterRegistry.counter("transcriptions.retry.total", "stage", "recognition").count()).isEqualTo(2.0);
    }

    @Test
    void recognitionRecoversAfterTransientFailure() {
        BatchTranscriptionService service = createService();
        when(recognitionAdapter.origin()).thenReturn(TranscriptionOrigin.PROVIDER);
        when(recognitionAdapter.isAvailable()).thenReturn(true);
        when(transportAdapter.fetch(eq(AUDIO_URL), any(FetchOptions.class))).thenReturn(audio());
        when(recognitionAdapter.recognize(any(byte[].class), any(LanguageTag.class)))
                .thenThrow(new RecognitionException("quota"))
                .thenReturn(new RecognitionResult("Recovered", LanguageTag.EN_US, 0.9, 100L));
        when(transcriptionStore.create(any(TranscriptionEntity.class))).thenAnswer(inv -> saved(inv.getArgument(0)));

        TranscriptionEntity result = service.transcribeWithProvider(AUDIO_URL, LanguageTag.EN_US);

        assertThat(result.getText()).isEqualTo("Recovered");
        verify(recognitionAdapter, times(2)).recognize(any(byte[].class), any(LanguageTag.class));
    }

    @Test
    void simulatedTextNamesFileAndTimestamp() {
        Instant processedAt = Instant.parse("2024-05-01T10:15:30Z");

        String text = BatchTranscriptionService.simulatedText("https://example.com/x/interview.wav", processedAt);

        assertThat(text).contains("interview.wav").contains("2024-05-01T10:15:30Z");
    }

    private BatchTranscriptionService createService() {
        AppProperties properties = new AppProperties(
                true,
                new AppProperties.Azure(null, null, 60),
                new AppProperties.Retry(3, 1000, 10000),
                new AppProperties.Transport(1000, 1024, 0),
                new AppProperties.Recognition(0),
                new AppProperties.Streaming(20, 20)
        );
        return new BatchTranscriptionService(
                transportAdapter,
                recognitionAdapter,
                new BackoffExecutor(duration -> { }),
                transcriptionStore,
                properties,
                meterRegistry
        );
    }

    private static TransportResponse audio() {
        return new TransportResponse(200, Map.of("content-type", "audio/mpeg"),
                "MOCK_AUDIO".getBytes(StandardCharsets.UTF_8));
    }

    private static TranscriptionEntity saved(TranscriptionEntity record) {
        record.setId(UUID.randomUUID());
        record.setCreatedAt(Instant.now());
        return record;
    }
}
